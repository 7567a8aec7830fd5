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

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Shared beans and startup logging.
 *
 * @since 1.0
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AutoConfiguration {

    private final JudgeProperties properties;

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @PostConstruct
    public void init() {
        JudgeProperties.MemoryProperties memory = properties.getMemory();
        log.info("GolemCore Judge starting...");
        log.info("LLM Model: {}", properties.getLlm().getModel());
        log.info("Embedding: {} ({} dims, enabled: {})", properties.getEmbedding().getModel(),
                properties.getEmbedding().getDimension(), properties.getEmbedding().isEnabled());
        log.info("Graph Store: {}", properties.getGraph().getStore());
        log.info("Dedup thresholds: policy={}, semantic={}", memory.getPolicyThreshold(),
                memory.getSemanticThreshold());
        log.info("Retrieval: contrastive k={} x{}, patterns k={} x{} (issue floor {})",
                memory.getContrastiveTopK(), memory.getContrastiveOverfetch(),
                memory.getPatternTopK(), memory.getPatternOverfetch(), memory.getPatternIssueFloor());
    }
}
