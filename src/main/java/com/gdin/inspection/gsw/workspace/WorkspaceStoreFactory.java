package com.gdin.inspection.gsw.workspace;

import com.gdin.inspection.gsw.models.Workspace;
import com.gdin.inspection.gsw.ontology.OntologyAggregator;
import com.gdin.inspection.gsw.resolve.EntityResolver;
import com.gdin.inspection.gsw.storage.WorkspaceStorage;
import com.gdin.inspection.gsw.update.BatchMergeService;
import lombok.extern.slf4j.Slf4j;

/**
 * Builds stores around workspaces loaded from durable storage. Every call to {@link #load(String)}
 * decodes the snapshot again, so the returned store shares nothing with earlier ones.
 */
@Slf4j
public class WorkspaceStoreFactory {

    private final WorkspaceStorage storage;
    private final EntityResolver resolver;
    private final BatchMergeService merger;
    private final OntologyAggregator ontology;
    private final int resolveConcurrency;

    public WorkspaceStoreFactory(WorkspaceStorage storage, EntityResolver resolver, BatchMergeService merger,
                                 OntologyAggregator ontology, int resolveConcurrency) {
        this.storage = storage;
        this.resolver = resolver;
        this.merger = merger;
        this.ontology = ontology;
        this.resolveConcurrency = resolveConcurrency;
    }

    /**
     * Store over the last durable snapshot of {@code domain}, or over an empty workspace when there is none.
     */
    public GlobalWorkspaceStore load(String domain) {
        Workspace ws = storage.load(domain)
                .map(WorkspaceSnapshotCodec::decode)
                .orElseGet(() -> new Workspace(domain));
        if (!domain.equals(ws.getDomain())) {
            throw new IllegalStateException("snapshot stored for " + domain + " belongs to " + ws.getDomain());
        }
        log.info("workspace loaded: domain={}, checkpoint={}, entities={}, events={}",
                domain, ws.getCheckpoint(), ws.getEntities().size(), ws.getEvents().size());
        return create(ws);
    }

    public GlobalWorkspaceStore create(Workspace workspace) {
        return new GlobalWorkspaceStore(workspace, resolver, merger, ontology, resolveConcurrency);
    }
}
