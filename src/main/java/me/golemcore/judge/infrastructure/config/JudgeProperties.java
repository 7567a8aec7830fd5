package me.golemcore.judge.infrastructure.config;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * Centralized configuration properties for the judge, bound from
 * application.properties.
 *
 * <p>
 * All configuration is organized under the {@code judge.*} prefix:
 * <ul>
 * <li>{@link LlmProperties} - LLM provider settings</li>
 * <li>{@link EmbeddingProperties} - embedder model and vector dimension</li>
 * <li>{@link GraphProperties} - graph store selection and Neo4j connection</li>
 * <li>{@link MemoryProperties} - dedup thresholds, over-fetch factors and
 * confidence floors</li>
 * <li>{@link EvaluatorProperties} - evaluation goal and classification
 * model</li>
 * </ul>
 *
 * <p>
 * Every value can be overridden from the environment through Spring relaxed
 * binding, e.g. {@code JUDGE_MEMORY_POLICY_THRESHOLD=0.92}.
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "judge")
@Data
public class JudgeProperties {

    private LlmProperties llm = new LlmProperties();
    private EmbeddingProperties embedding = new EmbeddingProperties();
    private GraphProperties graph = new GraphProperties();
    private MemoryProperties memory = new MemoryProperties();
    private EvaluatorProperties evaluator = new EvaluatorProperties();

    // ==================== LLM ====================

    @Data
    public static class LlmProperties {
        /** Default model, optionally prefixed with its provider: "anthropic/claude-3-5-haiku-latest". */
        private String model = "gpt-4o-mini";
        private double temperature = 0.0;
        private long timeoutMs = 60000;
        private Map<String, ProviderProperties> providers = new HashMap<>();
    }

    @Data
    public static class ProviderProperties {
        private String apiKey;
        private String baseUrl;
    }

    // ==================== EMBEDDING ====================

    @Data
    public static class EmbeddingProperties {
        /** When false entities are stored without embeddings and dedup is skipped. */
        private boolean enabled = true;
        private String model = "text-embedding-3-small";
        private int dimension = 1536;
    }

    // ==================== GRAPH STORE ====================

    @Data
    public static class GraphProperties {
        /** "memory" (in-process, default) or "neo4j". */
        private String store = "memory";
        private Neo4jProperties neo4j = new Neo4jProperties();
    }

    @Data
    public static class Neo4jProperties {
        private String uri = "bolt://localhost:7687";
        private String username = "neo4j";
        private String password = "";
        private String database = "";
    }

    // ==================== MEMORY ====================

    @Data
    public static class MemoryProperties {
        /** Policies merge only on near-exact paraphrase. */
        private double policyThreshold = 0.9;

        /** Looser merging keeps near-duplicate root-cause labels from piling up. */
        private double semanticThreshold = 0.85;

        /** Attempt candidates fetched per requested item, before the outcome split. */
        private int contrastiveOverfetch = 4;

        /** Issue candidates fetched per requested pattern. */
        private int patternOverfetch = 3;

        /** Issues scoring below this are dropped before traversal. */
        private double patternIssueFloor = 0.85;

        private int contrastiveTopK = 3;
        private int patternTopK = 5;
        private int historySampleSize = 3;

        /** Minimum score of a successful precedent used as prompt context. */
        private double positiveFloor = 0.80;

        /** Minimum score of a failed precedent used as prompt context. */
        private double negativeFloor = 0.90;

        /** Minimum average similarity of a pattern used as prompt context. */
        private double patternConfidenceFloor = 0.85;

        /** Classify issues into semantic categories while recording a judgment. */
        private boolean classifyIssues = true;
    }

    // ==================== EVALUATOR ====================

    @Data
    public static class EvaluatorProperties {
        private String defaultGoal = "Evaluate if the code correctly solves the CORE requirement of the task. "
                + "Focus on functionality, not production-readiness (error handling, logging, etc.).";

        /** Model for issue classification, falls back to judge.llm.model when blank. */
        private String classifierModel;

        private long timeoutMs = 60000;
    }
}
