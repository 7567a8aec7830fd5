package me.golemcore.judge.domain.service;

import me.golemcore.judge.domain.model.Attempt;
import me.golemcore.judge.domain.model.ContrastiveExamples;
import me.golemcore.judge.domain.model.Embedding;
import me.golemcore.judge.domain.model.Fix;
import me.golemcore.judge.domain.model.Issue;
import me.golemcore.judge.domain.model.MemoryRetrieval;
import me.golemcore.judge.domain.model.Semantic;
import me.golemcore.judge.domain.model.SemanticHistoryPattern;
import me.golemcore.judge.domain.model.SemanticPattern;
import me.golemcore.judge.domain.model.SimilarityMatch;
import me.golemcore.judge.infrastructure.config.JudgeProperties;
import me.golemcore.judge.memory.ContrastiveRetriever;
import me.golemcore.judge.memory.SemanticPatternAggregator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class MemoryRetrievalServiceTest {

    private static final Embedding QUERY = Embedding.of(new float[] { 1.0f, 0.0f });

    private ContrastiveRetriever contrastiveRetriever;
    private SemanticPatternAggregator patternAggregator;
    private ExperienceGraphService graphService;
    private MemoryRetrievalService service;

    @BeforeEach
    void setUp() {
        contrastiveRetriever = mock(ContrastiveRetriever.class);
        patternAggregator = mock(SemanticPatternAggregator.class);
        graphService = mock(ExperienceGraphService.class);
        service = new MemoryRetrievalService(contrastiveRetriever, patternAggregator, graphService,
                new JudgeProperties());
    }

    private static SimilarityMatch attempt(boolean successful, double score) {
        return new SimilarityMatch(Attempt.of("attempt " + score).judged(successful, "r"), score);
    }

    private static SemanticPattern pattern(String name, double avg) {
        return SemanticPattern.builder().semantic(Semantic.of(name, "d")).frequency(2).avgSimilarity(avg).build();
    }

    @Test
    void shouldReturnEmptyForAbsentQuery() {
        assertTrue(service.retrieve(Embedding.none()).isEmpty());
        verifyNoInteractions(contrastiveRetriever, patternAggregator, graphService);
    }

    @Test
    void shouldApplyConfidenceFloors() {
        SimilarityMatch strongPass = attempt(true, 0.85);
        SimilarityMatch weakPass = attempt(true, 0.79);
        SimilarityMatch strongFail = attempt(false, 0.92);
        SimilarityMatch weakFail = attempt(false, 0.88);
        when(contrastiveRetriever.findContrastive(QUERY)).thenReturn(ContrastiveExamples.builder()
                .positive(List.of(strongPass, weakPass))
                .negative(List.of(strongFail, weakFail))
                .build());
        when(patternAggregator.findPatterns(QUERY))
                .thenReturn(List.of(pattern("SQL Injection", 0.9), pattern("Weak Validation", 0.84)));

        MemoryRetrieval retrieval = service.retrieve(QUERY);

        assertEquals(List.of(strongPass), retrieval.getPositive());
        assertEquals(List.of(strongFail), retrieval.getNegative());
        assertEquals(1, retrieval.getPatterns().size());
        assertEquals("SQL Injection", retrieval.getPatterns().get(0).getSemantic().getName());
    }

    @Test
    void shouldExpandOnlyFailedPrecedentThatPassedFloor() {
        SimilarityMatch strongFail = attempt(false, 0.95);
        SimilarityMatch weakFail = attempt(false, 0.5);
        when(contrastiveRetriever.findContrastive(QUERY)).thenReturn(ContrastiveExamples.builder()
                .negative(List.of(strongFail, weakFail))
                .build());
        Issue issue = Issue.of("Accepts a@b");
        Fix fix = Fix.of("Require a TLD");
        when(graphService.findIssuesForAttempts(List.of(strongFail.id())))
                .thenReturn(Map.of(strongFail.id(), List.of(issue)));
        when(graphService.findFixesForIssues(List.of(issue.getId())))
                .thenReturn(Map.of(issue.getId(), List.of(fix)));
        SemanticHistoryPattern history = SemanticHistoryPattern.builder()
                .semantic(Semantic.of("Weak Validation", "d"))
                .issueCount(1)
                .sampleIssues(List.of("Accepts a@b"))
                .build();
        when(patternAggregator.findHistoryPatterns(List.of(strongFail.id()))).thenReturn(List.of(history));

        MemoryRetrieval retrieval = service.retrieve(QUERY);

        assertEquals(List.of(issue), retrieval.getFailureIssues().get(strongFail.id()));
        assertEquals(List.of(fix), retrieval.getFixesByIssue().get(issue.getId()));
        assertEquals(List.of(history), retrieval.getHistoryPatterns());
        verify(patternAggregator).findHistoryPatterns(List.of(strongFail.id()));
    }

    @Test
    void shouldBeEmptyWhenEverythingIsBelowFloors() {
        when(contrastiveRetriever.findContrastive(QUERY)).thenReturn(ContrastiveExamples.builder()
                .positive(List.of(attempt(true, 0.5)))
                .negative(List.of(attempt(false, 0.5)))
                .build());

        assertTrue(service.retrieve(QUERY).isEmpty());
    }
}
