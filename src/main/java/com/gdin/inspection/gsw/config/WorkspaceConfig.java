package com.gdin.inspection.gsw.config;

import com.gdin.inspection.gsw.config.properties.WorkspaceProperties;
import com.gdin.inspection.gsw.mode.ModeController;
import com.gdin.inspection.gsw.ontology.OntologyAggregator;
import com.gdin.inspection.gsw.resolve.EmbeddingSimilarityOracle;
import com.gdin.inspection.gsw.resolve.EntityResolver;
import com.gdin.inspection.gsw.resolve.SimilarityOracle;
import com.gdin.inspection.gsw.state.CursorStore;
import com.gdin.inspection.gsw.state.FileCursorStore;
import com.gdin.inspection.gsw.storage.FileWorkspaceStorage;
import com.gdin.inspection.gsw.storage.WorkspaceStorage;
import com.gdin.inspection.gsw.update.BatchMergeService;
import com.gdin.inspection.gsw.update.EntityMergeService;
import com.gdin.inspection.gsw.workspace.WorkspaceStoreFactory;
import dev.langchain4j.model.embedding.EmbeddingModel;
import jakarta.annotation.Resource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

@Slf4j
@Configuration
public class WorkspaceConfig {
    @Resource
    private WorkspaceProperties workspaceProperties;

    @Bean
    public SimilarityOracle similarityOracle(ObjectProvider<EmbeddingModel> embeddingModel) {
        EmbeddingModel model = embeddingModel.getIfAvailable();
        if (model == null) {
            log.warn("no EmbeddingModel bean, entity resolution falls back to exact alias matching");
            return SimilarityOracle.unavailable();
        }
        return new EmbeddingSimilarityOracle(model, workspaceProperties.getResolve().getEmbeddingCacheSize());
    }

    @Bean
    public EntityResolver entityResolver(SimilarityOracle similarityOracle) {
        WorkspaceProperties.Resolve resolve = workspaceProperties.getResolve();
        return new EntityResolver(similarityOracle, resolve.getSimilarityThreshold(), resolve.getOracleTimeoutMillis());
    }

    @Bean
    public OntologyAggregator ontologyAggregator() {
        return new OntologyAggregator(workspaceProperties.getOntology().getCanonicalTerms());
    }

    @Bean
    public BatchMergeService batchMergeService() {
        return new BatchMergeService(new EntityMergeService(workspaceProperties.getResolve().getStateConflictPolicy()));
    }

    @Bean
    public WorkspaceStorage workspaceStorage() {
        return new FileWorkspaceStorage(Path.of(workspaceProperties.getStorageDir()));
    }

    @Bean
    public CursorStore cursorStore() {
        return new FileCursorStore(Path.of(workspaceProperties.getStorageDir()));
    }

    @Bean
    public WorkspaceStoreFactory workspaceStoreFactory(WorkspaceStorage workspaceStorage, EntityResolver entityResolver,
                                                       BatchMergeService batchMergeService,
                                                       OntologyAggregator ontologyAggregator) {
        return new WorkspaceStoreFactory(workspaceStorage, entityResolver, batchMergeService, ontologyAggregator,
                workspaceProperties.getResolve().getConcurrentRequests());
    }

    @Bean
    public ModeController modeController(WorkspaceStoreFactory workspaceStoreFactory, WorkspaceStorage workspaceStorage) {
        return new ModeController(workspaceStoreFactory, workspaceStorage);
    }
}
