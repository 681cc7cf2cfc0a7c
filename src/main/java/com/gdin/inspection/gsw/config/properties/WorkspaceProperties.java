package com.gdin.inspection.gsw.config.properties;

import com.gdin.inspection.gsw.update.StateConflictPolicy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.io.Serializable;
import java.util.LinkedHashMap;
import java.util.Map;

@Data
@ConfigurationProperties(prefix = "gsw.workspace")
@Component
public class WorkspaceProperties implements Serializable {
    // 快照与游标所在目录
    private String storageDir = "./workspace-data";

    private Resolve resolve = new Resolve();
    private Ingestion ingestion = new Ingestion();
    private Ontology ontology = new Ontology();

    @Data
    public static class Resolve implements Serializable {
        // 相似度严格大于该值才合并
        private Double similarityThreshold = 0.85;
        // 单个候选的 oracle 超时
        private Long oracleTimeoutMillis = 5000L;
        // resolve 阶段并发数
        private Integer concurrentRequests = 5;
        // 嵌入向量缓存的最大条目数
        private Long embeddingCacheSize = 1000L;
        private StateConflictPolicy stateConflictPolicy = StateConflictPolicy.EXTRACTION_ORDER;
    }

    @Data
    public static class Ingestion implements Serializable {
        private Integer batchSize = 10;
        // 单次运行最多处理的文档数，为空或 <= 0 表示不限
        private Integer limit;
    }

    @Data
    public static class Ontology implements Serializable {
        // 提供给抽取步骤的高频词条数
        private Integer topK = 20;
        // normalized term -> canonical term
        private Map<String, String> canonicalTerms = new LinkedHashMap<>();
    }
}
