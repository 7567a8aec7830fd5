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

import lombok.extern.slf4j.Slf4j;
import org.neo4j.driver.AuthTokens;
import org.neo4j.driver.Driver;
import org.neo4j.driver.GraphDatabase;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Neo4j driver, created only when {@code judge.graph.store=neo4j}.
 */
@Configuration
@ConditionalOnProperty(prefix = "judge.graph", name = "store", havingValue = "neo4j")
@Slf4j
public class Neo4jConfiguration {

    @Bean(destroyMethod = "close")
    public Driver neo4jDriver(JudgeProperties properties) {
        JudgeProperties.Neo4jProperties neo4j = properties.getGraph().getNeo4j();
        log.info("[Neo4j] Connecting to {} as {}", neo4j.getUri(), neo4j.getUsername());
        return GraphDatabase.driver(neo4j.getUri(), AuthTokens.basic(neo4j.getUsername(), neo4j.getPassword()));
    }
}
