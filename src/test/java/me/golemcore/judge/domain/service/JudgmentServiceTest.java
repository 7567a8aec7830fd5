package me.golemcore.judge.domain.service;

import me.golemcore.judge.domain.model.Attempt;
import me.golemcore.judge.domain.model.AttemptOutcome;
import me.golemcore.judge.domain.model.Embedding;
import me.golemcore.judge.domain.model.IssueFixPair;
import me.golemcore.judge.domain.model.Judgment;
import me.golemcore.judge.domain.model.JudgmentRecord;
import me.golemcore.judge.domain.model.MemoryRetrieval;
import me.golemcore.judge.domain.model.SimilarityMatch;
import me.golemcore.judge.infrastructure.config.JudgeProperties;
import me.golemcore.judge.port.outbound.EvaluatorPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class JudgmentServiceTest {

    private static final String TASK = "Write a function to validate email addresses";
    private static final String OUTPUT = "def validate(e): return '@' in e";
    private static final Embedding VECTOR = Embedding.of(new float[] { 1.0f, 0.0f, 0.0f });

    private EvaluatorPort evaluatorPort;
    private EntityEmbeddingService embeddingService;
    private MemoryRetrievalService retrievalService;
    private MemoryContextFormatter formatter;
    private JudgeProperties properties;
    private JudgmentService service;

    @BeforeEach
    void setUp() {
        evaluatorPort = mock(EvaluatorPort.class);
        embeddingService = mock(EntityEmbeddingService.class);
        retrievalService = mock(MemoryRetrievalService.class);
        formatter = mock(MemoryContextFormatter.class);
        properties = new JudgeProperties();
        service = new JudgmentService(evaluatorPort, embeddingService, retrievalService, formatter, properties);

        when(evaluatorPort.evaluate(anyString(), anyString(), anyString(), any())).thenReturn(Judgment.builder()
                .successful(false)
                .reasoning("Too permissive")
                .issueFixPairs(List.of(new IssueFixPair("Accepts a@b", "Require a TLD")))
                .build());
    }

    @Test
    void shouldJudgeStatelessWithDefaultGoal() {
        JudgmentRecord record = service.judge(TASK, OUTPUT, null, false);

        verify(evaluatorPort).evaluate(TASK, OUTPUT, properties.getEvaluator().getDefaultGoal(), null);
        verifyNoInteractions(embeddingService, retrievalService);
        assertEquals(TASK, record.getPolicy().getDescription());
        assertEquals(AttemptOutcome.FAILURE, record.getAttempt().getOutcome());
        assertEquals("Too permissive", record.getAttempt().getReasoning());
        assertEquals(1, record.getFindings().size());
        assertEquals("Accepts a@b", record.getFindings().get(0).issue().getDescription());
        assertEquals("Require a TLD", record.getFindings().get(0).fix().getDescription());
        assertFalse(record.getMemoryUsage().isUsed());
    }

    @Test
    void shouldPassMemoryContextAndKeepAttemptEmbedding() {
        when(embeddingService.embed(any(Attempt.class)))
                .thenAnswer(inv -> ((Attempt) inv.getArgument(0)).withEmbedding(VECTOR));
        Attempt precedent = Attempt.of("def validate(e): return True").judged(false, "Accepts anything");
        MemoryRetrieval retrieval = MemoryRetrieval.builder()
                .negative(List.of(new SimilarityMatch(precedent, 0.95)))
                .build();
        when(retrievalService.retrieve(VECTOR)).thenReturn(retrieval);
        when(formatter.format(retrieval)).thenReturn("FAILED SIMILAR ATTEMPTS:");

        JudgmentRecord record = service.judge(TASK, OUTPUT, "Check correctness", true);

        verify(evaluatorPort).evaluate(TASK, OUTPUT, "Check correctness", "FAILED SIMILAR ATTEMPTS:");
        assertEquals(VECTOR, record.getAttempt().getEmbedding());
        assertTrue(record.getMemoryUsage().isUsed());
        assertEquals(1, record.getMemoryUsage().getNegativeExamples());
    }

    @Test
    void shouldSendNoContextWhenNothingRetrieved() {
        when(embeddingService.embed(any(Attempt.class)))
                .thenAnswer(inv -> ((Attempt) inv.getArgument(0)).withEmbedding(VECTOR));
        when(retrievalService.retrieve(VECTOR)).thenReturn(MemoryRetrieval.empty());

        JudgmentRecord record = service.judgeWithMemory(TASK, OUTPUT, null);

        verify(evaluatorPort).evaluate(eq(TASK), eq(OUTPUT), anyString(), isNull());
        verifyNoInteractions(formatter);
        assertFalse(record.getMemoryUsage().isUsed());
    }

    @Test
    void shouldDegradeToStatelessWithoutEmbedding() {
        when(embeddingService.embed(any(Attempt.class))).thenAnswer(inv -> inv.getArgument(0));

        JudgmentRecord record = service.judge(TASK, OUTPUT, null, true);

        verifyNoInteractions(retrievalService);
        verify(evaluatorPort).evaluate(eq(TASK), eq(OUTPUT), anyString(), isNull());
        assertFalse(record.getMemoryUsage().isUsed());
    }

    @Test
    void shouldRejectBlankInput() {
        assertThrows(IllegalArgumentException.class, () -> service.judge(" ", OUTPUT, null, false));
        assertThrows(IllegalArgumentException.class, () -> service.judge(TASK, null, null, true));
        verifyNoInteractions(evaluatorPort);
    }

    @Test
    void shouldResolveBlankGoalToDefault() {
        assertEquals(properties.getEvaluator().getDefaultGoal(), service.resolveGoal("  "));
        assertEquals("Check security", service.resolveGoal("Check security"));
    }
}
