package me.golemcore.judge.domain.service;

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
import me.golemcore.judge.domain.model.Attempt;
import me.golemcore.judge.domain.model.ClassificationOutcome;
import me.golemcore.judge.domain.model.Finding;
import me.golemcore.judge.domain.model.Fix;
import me.golemcore.judge.domain.model.Issue;
import me.golemcore.judge.domain.model.JudgmentRecord;
import me.golemcore.judge.domain.model.Policy;
import me.golemcore.judge.domain.model.RecordedJudgment;
import me.golemcore.judge.domain.model.Semantic;
import me.golemcore.judge.domain.model.UpsertResult;
import me.golemcore.judge.infrastructure.config.JudgeProperties;
import me.golemcore.judge.memory.EntityDeduplicator;
import me.golemcore.judge.memory.IssueClassifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Writes a judgment into the experience graph.
 *
 * <p>
 * Order of writes:
 * <ol>
 * <li>policy, deduplicated against existing policies</li>
 * <li>attempt, linked SATISFIES to the policy</li>
 * <li>issues and fixes, linked CAUSES and RESOLVES</li>
 * <li>one semantic category per issue, deduplicated, linked ABSTRACTS_TO</li>
 * </ol>
 *
 * <p>
 * Recording is not transactional. A failure leaves the writes made so far in
 * place and propagates. Every write merges on identifier, so recording the same
 * {@link JudgmentRecord} again completes a partially recorded one. Issues
 * that already abstract to a category keep it and are not classified again.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ExperienceRecorder {

    private final ExperienceGraphService graphService;
    private final EntityEmbeddingService embeddingService;
    private final EntityDeduplicator deduplicator;
    private final IssueClassifier issueClassifier;
    private final JudgeProperties properties;

    public RecordedJudgment record(JudgmentRecord record) {
        Policy policy = embeddingService.embed(record.getPolicy());
        UpsertResult policyResult = deduplicator.getOrCreatePolicy(policy);

        Attempt attempt = embeddingService.embed(record.getAttempt());
        graphService.createAttempt(attempt);
        graphService.linkAttemptSatisfiesPolicy(attempt.getId(), policyResult.id());

        List<Issue> issues = embeddingService.embedAll(record.getFindings().stream().map(Finding::issue).toList());
        List<Fix> fixes = embeddingService.embedAll(record.getFindings().stream().map(Finding::fix).toList());
        List<String> issueIds = new ArrayList<>();
        List<String> fixIds = new ArrayList<>();
        for (int i = 0; i < issues.size(); i++) {
            Issue issue = issues.get(i);
            Fix fix = fixes.get(i);
            graphService.createIssue(issue);
            graphService.createFix(fix);
            graphService.linkAttemptCausesIssue(attempt.getId(), issue.getId());
            graphService.linkFixResolvesIssue(fix.getId(), issue.getId());
            issueIds.add(issue.getId());
            fixIds.add(fix.getId());
        }

        List<String> semanticIds = new ArrayList<>();
        int semanticsCreated = 0;
        if (properties.getMemory().isClassifyIssues() && !issues.isEmpty()) {
            List<Semantic> known = new ArrayList<>(graphService.listSemantics());
            for (Issue issue : issues) {
                List<Semantic> linked = graphService.findSemanticsForIssue(issue.getId());
                if (!linked.isEmpty()) {
                    log.debug("[Recorder] Issue {} already classified as '{}'", issue.getId(),
                            linked.get(0).getName());
                    semanticIds.add(linked.get(0).getId());
                    continue;
                }
                ClassificationOutcome outcome = issueClassifier.classify(issue, List.copyOf(known));
                String semanticId = outcome.semantic().getId();
                if (outcome.isNew()) {
                    Semantic candidate = embeddingService.embed(outcome.semantic());
                    UpsertResult upsert = deduplicator.getOrCreateSemantic(candidate);
                    semanticId = upsert.id();
                    if (upsert.created()) {
                        known.add(candidate);
                        semanticsCreated++;
                    }
                }
                graphService.linkIssueAbstractsToSemantic(issue.getId(), semanticId);
                semanticIds.add(semanticId);
            }
        }

        log.info("[Recorder] Recorded attempt {} for policy {} ({}): {} issues, {} new categories",
                attempt.getId(), policyResult.id(), policyResult.created() ? "new" : "reused",
                issueIds.size(), semanticsCreated);

        return RecordedJudgment.builder()
                .policyId(policyResult.id())
                .policyCreated(policyResult.created())
                .attemptId(attempt.getId())
                .issueIds(List.copyOf(issueIds))
                .fixIds(List.copyOf(fixIds))
                .semanticIds(List.copyOf(semanticIds))
                .semanticsCreated(semanticsCreated)
                .build();
    }
}
