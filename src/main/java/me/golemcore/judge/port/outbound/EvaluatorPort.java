package me.golemcore.judge.port.outbound;

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

import me.golemcore.judge.domain.model.CategoryDecision;
import me.golemcore.judge.domain.model.Judgment;
import me.golemcore.judge.domain.model.Semantic;

import java.util.List;

/**
 * Port for the model that judges attempts and categorizes issues. Both calls
 * block until the evaluator answers.
 *
 * <p>
 * Implementations raise
 * {@link me.golemcore.judge.domain.exception.CollaboratorException} when the
 * evaluator fails, times out or answers with something unusable.
 */
public interface EvaluatorPort {

    /**
     * Judge one attempt.
     *
     * @param task
     *            task description
     * @param attemptText
     *            the agent output being judged
     * @param goal
     *            what the evaluation checks for
     * @param memoryContext
     *            rendered precedent, or null for a stateless judgment
     */
    Judgment evaluate(String task, String attemptText, String goal, String memoryContext);

    /**
     * Choose an existing category for an issue or propose a new one.
     *
     * @param issueDescription
     *            the issue text
     * @param existingCategories
     *            categories already in the graph (name and description are used)
     */
    CategoryDecision classifyIssue(String issueDescription, List<Semantic> existingCategories);
}
