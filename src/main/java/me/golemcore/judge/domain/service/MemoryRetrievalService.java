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
import me.golemcore.judge.domain.model.ContrastiveExamples;
import me.golemcore.judge.domain.model.Embedding;
import me.golemcore.judge.domain.model.Fix;
import me.golemcore.judge.domain.model.Issue;
import me.golemcore.judge.domain.model.MemoryRetrieval;
import me.golemcore.judge.domain.model.SemanticHistoryPattern;
import me.golemcore.judge.domain.model.SemanticPattern;
import me.golemcore.judge.domain.model.SimilarityMatch;
import me.golemcore.judge.infrastructure.config.JudgeProperties;
import me.golemcore.judge.memory.ContrastiveRetriever;
import me.golemcore.judge.memory.SemanticPatternAggregator;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * Collects the precedent shown to the evaluator for a new attempt.
 *
 * <p>
 * Applies the consumer confidence floors on top of the raw retrieval:
 * successful precedent at {@code judge.memory.positive-floor}, failed precedent
 * at {@code judge.memory.negative-floor} and patterns at
 * {@code judge.memory.pattern-confidence-floor} average similarity.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MemoryRetrievalService {

    private final ContrastiveRetriever contrastiveRetriever;
    private final SemanticPatternAggregator patternAggregator;
    private final ExperienceGraphService graphService;
    private final JudgeProperties properties;

    public MemoryRetrieval retrieve(Embedding query) {
        if (!query.isPresent()) {
            return MemoryRetrieval.empty();
        }
        JudgeProperties.MemoryProperties memory = properties.getMemory();

        ContrastiveExamples examples = contrastiveRetriever.findContrastive(query);
        List<SimilarityMatch> positive = aboveFloor(examples.getPositive(), memory.getPositiveFloor());
        List<SimilarityMatch> negative = aboveFloor(examples.getNegative(), memory.getNegativeFloor());

        List<String> failedIds = negative.stream().map(SimilarityMatch::id).toList();
        Map<String, List<Issue>> failureIssues = graphService.findIssuesForAttempts(failedIds);
        List<String> issueIds = failureIssues.values().stream()
                .flatMap(List::stream)
                .map(Issue::getId)
                .toList();
        Map<String, List<Fix>> fixesByIssue = graphService.findFixesForIssues(issueIds);
        List<SemanticHistoryPattern> historyPatterns = patternAggregator.findHistoryPatterns(failedIds);

        List<SemanticPattern> patterns = patternAggregator.findPatterns(query).stream()
                .filter(pattern -> pattern.getAvgSimilarity() >= memory.getPatternConfidenceFloor())
                .toList();

        log.info("[Memory] Retrieved {} positive (of {}), {} negative (of {}), {} patterns, {} root causes",
                positive.size(), examples.getPositive().size(), negative.size(), examples.getNegative().size(),
                patterns.size(), historyPatterns.size());

        return MemoryRetrieval.builder()
                .positive(positive)
                .negative(negative)
                .failureIssues(failureIssues)
                .fixesByIssue(fixesByIssue)
                .historyPatterns(historyPatterns)
                .patterns(patterns)
                .build();
    }

    private static List<SimilarityMatch> aboveFloor(List<SimilarityMatch> matches, double floor) {
        return matches.stream().filter(match -> match.score() >= floor).toList();
    }
}
