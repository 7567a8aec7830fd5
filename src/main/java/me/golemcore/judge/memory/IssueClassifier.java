package me.golemcore.judge.memory;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.judge.domain.model.CategoryDecision;
import me.golemcore.judge.domain.model.ClassificationOutcome;
import me.golemcore.judge.domain.model.Issue;
import me.golemcore.judge.domain.model.Semantic;
import me.golemcore.judge.port.outbound.EvaluatorPort;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Assigns an issue to a semantic category.
 *
 * <p>
 * The choice itself comes from {@link EvaluatorPort#classifyIssue}. This class
 * reconciles that decision with the categories actually known: an "existing"
 * category is looked up by exact name, and a name that is not among them falls
 * back to a new category instead of failing. A proposed category is returned as
 * new without checking for near-duplicates; {@link EntityDeduplicator} makes
 * that call when it is persisted.
 *
 * @since 1.0
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class IssueClassifier {

    private final EvaluatorPort evaluatorPort;

    public ClassificationOutcome classify(Issue issue, List<Semantic> existingSemantics) {
        List<Semantic> known = existingSemantics != null ? existingSemantics : List.of();
        CategoryDecision decision = evaluatorPort.classifyIssue(issue.getDescription(), known);

        if (!decision.isNew()) {
            Optional<Semantic> match = known.stream()
                    .filter(semantic -> decision.name().equals(semantic.getName()))
                    .findFirst();
            if (match.isPresent()) {
                log.debug("[Classifier] Issue {} -> existing category '{}'", issue.getId(), decision.name());
                return new ClassificationOutcome(match.get(), false);
            }
            log.warn("[Classifier] Category '{}' reported as existing but not among {} known, creating it",
                    decision.name(), known.size());
        }

        String description = decision.description() != null && !decision.description().isBlank()
                ? decision.description()
                : issue.getDescription();
        Semantic created = Semantic.of(decision.name(), description);
        log.debug("[Classifier] Issue {} -> new category '{}'", issue.getId(), created.getName());
        return new ClassificationOutcome(created, true);
    }
}
