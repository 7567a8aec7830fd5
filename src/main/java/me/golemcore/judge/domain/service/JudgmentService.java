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
import me.golemcore.judge.domain.model.Finding;
import me.golemcore.judge.domain.model.Fix;
import me.golemcore.judge.domain.model.Issue;
import me.golemcore.judge.domain.model.Judgment;
import me.golemcore.judge.domain.model.JudgmentRecord;
import me.golemcore.judge.domain.model.MemoryRetrieval;
import me.golemcore.judge.domain.model.MemoryUsage;
import me.golemcore.judge.domain.model.Policy;
import me.golemcore.judge.infrastructure.config.JudgeProperties;
import me.golemcore.judge.port.outbound.EvaluatorPort;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Judges a task attempt, with or without prior experience.
 *
 * <p>
 * The memory-assisted path embeds the attempt once, retrieves precedent with
 * that embedding and hands the same embedded attempt to the returned record,
 * so recording it does not embed it again. Without an embedding (embeddings
 * off or embedder unconfigured) it degrades to a stateless judgment.
 *
 * <p>
 * Nothing is written here; see {@link ExperienceRecorder}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class JudgmentService {

    private final EvaluatorPort evaluatorPort;
    private final EntityEmbeddingService embeddingService;
    private final MemoryRetrievalService memoryRetrievalService;
    private final MemoryContextFormatter contextFormatter;
    private final JudgeProperties properties;

    public JudgmentRecord judge(String task, String agentOutput, String goal, boolean useMemory) {
        return useMemory ? judgeWithMemory(task, agentOutput, goal) : judge(task, agentOutput, goal);
    }

    /**
     * Stateless judgment.
     */
    public JudgmentRecord judge(String task, String agentOutput, String goal) {
        requireText(task, "task");
        requireText(agentOutput, "agent output");
        Judgment judgment = evaluatorPort.evaluate(task, agentOutput, resolveGoal(goal), null);
        return toRecord(task, Attempt.of(agentOutput), judgment, MemoryUsage.none());
    }

    /**
     * Judgment with contrastive precedent and semantic patterns in the prompt.
     */
    public JudgmentRecord judgeWithMemory(String task, String agentOutput, String goal) {
        requireText(task, "task");
        requireText(agentOutput, "agent output");

        Attempt attempt = embeddingService.embed(Attempt.of(agentOutput));
        if (!attempt.getEmbedding().isPresent()) {
            log.warn("[Judge] No attempt embedding, judging without memory");
            Judgment judgment = evaluatorPort.evaluate(task, agentOutput, resolveGoal(goal), null);
            return toRecord(task, attempt, judgment, MemoryUsage.none());
        }

        MemoryRetrieval retrieval = memoryRetrievalService.retrieve(attempt.getEmbedding());
        String context = retrieval.isEmpty() ? null : contextFormatter.format(retrieval);
        Judgment judgment = evaluatorPort.evaluate(task, agentOutput, resolveGoal(goal), context);
        return toRecord(task, attempt, judgment, MemoryUsage.from(retrieval));
    }

    String resolveGoal(String goal) {
        return goal != null && !goal.isBlank() ? goal : properties.getEvaluator().getDefaultGoal();
    }

    private JudgmentRecord toRecord(String task, Attempt attempt, Judgment judgment, MemoryUsage memoryUsage) {
        List<Finding> findings = judgment.getIssueFixPairs().stream()
                .map(pair -> new Finding(Issue.of(pair.issue()), Fix.of(pair.fix())))
                .toList();
        log.info("[Judge] {} with {} findings (memory used: {})",
                judgment.isSuccessful() ? "SUCCESS" : "FAILURE", findings.size(), memoryUsage.isUsed());
        return JudgmentRecord.builder()
                .policy(Policy.of(task))
                .attempt(attempt.judged(judgment.isSuccessful(), judgment.getReasoning()))
                .findings(findings)
                .memoryUsage(memoryUsage)
                .build();
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("The " + name + " must not be blank");
        }
    }
}
