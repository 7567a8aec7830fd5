package me.golemcore.judge;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for GolemCore Judge.
 *
 * <p>
 * GolemCore Judge evaluates task attempts with an LLM and remembers what it
 * learned. Every judgment is stored in an experience graph of policies,
 * attempts, issues, fixes and semantic issue categories; later evaluations
 * retrieve similar precedent from that graph.
 *
 * <h2>Key Features</h2>
 * <ul>
 * <li><b>Deduplicated memory</b> - paraphrased tasks and near-identical issue
 * categories merge by embedding similarity</li>
 * <li><b>Contrastive retrieval</b> - nearest successful and failed attempts,
 * kept apart</li>
 * <li><b>Pattern aggregation</b> - recurring issue categories ranked by
 * frequency and confidence</li>
 * <li><b>Pluggable graph store</b> - in-process store or Neo4j vector
 * indexes</li>
 * </ul>
 *
 * <h2>Architecture</h2>
 *
 * <pre>
 * Input Layer        → JudgmentsController, MemoryController
 * Domain Layer       → JudgmentService, ExperienceRecorder, memory retrieval
 * Infrastructure     → Graph store, LLM and embedding adapters
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under {@code judge.*}
 * prefix.
 *
 * @version 1.0
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class JudgeApplication {

    public static void main(String[] args) {
        SpringApplication.run(JudgeApplication.class, args);
    }

}
