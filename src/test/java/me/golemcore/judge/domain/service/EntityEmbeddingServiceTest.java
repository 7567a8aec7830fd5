package me.golemcore.judge.domain.service;

import me.golemcore.judge.domain.exception.CollaboratorException;
import me.golemcore.judge.domain.model.Embedding;
import me.golemcore.judge.domain.model.Issue;
import me.golemcore.judge.domain.model.Policy;
import me.golemcore.judge.domain.model.Semantic;
import me.golemcore.judge.infrastructure.config.JudgeProperties;
import me.golemcore.judge.port.outbound.EmbeddingPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class EntityEmbeddingServiceTest {

    private EmbeddingPort embeddingPort;
    private JudgeProperties properties;
    private EntityEmbeddingService service;

    @BeforeEach
    void setUp() {
        embeddingPort = mock(EmbeddingPort.class);
        when(embeddingPort.isAvailable()).thenReturn(true);
        properties = new JudgeProperties();
        service = new EntityEmbeddingService(embeddingPort, properties);
    }

    @Test
    void shouldEmbedEntityDescription() {
        when(embeddingPort.embed("Validate email")).thenReturn(
                CompletableFuture.completedFuture(new float[] { 0.1f, 0.2f }));

        Policy embedded = service.embed(Policy.of("Validate email"));

        assertTrue(embedded.getEmbedding().isPresent());
        assertArrayEquals(new float[] { 0.1f, 0.2f }, embedded.getEmbedding().vector());
    }

    @Test
    void shouldEmbedSemanticByNameAndDescription() {
        Semantic semantic = Semantic.of("SQL Injection", "Unsanitized input");
        when(embeddingPort.embed(semantic.getEmbeddingText())).thenReturn(
                CompletableFuture.completedFuture(new float[] { 1f }));

        service.embed(semantic);

        verify(embeddingPort).embed(semantic.getEmbeddingText());
    }

    @Test
    void shouldNotReEmbedEmbeddedEntity() {
        Policy policy = Policy.of("task").withEmbedding(Embedding.of(new float[] { 1f }));

        assertSame(policy, service.embed(policy));
        verify(embeddingPort, never()).embed(anyString());
    }

    @Test
    void shouldLeaveEntityUnembeddedWhenDisabled() {
        properties.getEmbedding().setEnabled(false);

        Policy policy = service.embed(Policy.of("task"));

        assertFalse(policy.getEmbedding().isPresent());
        verifyNoInteractions(embeddingPort);
    }

    @Test
    void shouldLeaveEntityUnembeddedWhenEmbedderUnavailable() {
        when(embeddingPort.isAvailable()).thenReturn(false);

        assertFalse(service.isEnabled());
        assertFalse(service.embedText("query").isPresent());
        verify(embeddingPort, never()).embed(anyString());
    }

    @Test
    void shouldBatchOnlyMissingEmbeddingsInOrder() {
        Issue first = Issue.of("first");
        Issue already = Issue.of("already").withEmbedding(Embedding.of(new float[] { 9f }));
        Issue third = Issue.of("third");
        when(embeddingPort.embedBatch(List.of("first", "third"))).thenReturn(
                CompletableFuture.completedFuture(List.of(new float[] { 1f }, new float[] { 3f })));

        List<Issue> result = service.embedAll(List.of(first, already, third));

        assertEquals(3, result.size());
        assertEquals(first.getId(), result.get(0).getId());
        assertArrayEquals(new float[] { 1f }, result.get(0).getEmbedding().vector());
        assertSame(already, result.get(1));
        assertArrayEquals(new float[] { 3f }, result.get(2).getEmbedding().vector());
        verify(embeddingPort, times(1)).embedBatch(anyList());
    }

    @Test
    void shouldSkipBatchCallWhenNothingMissing() {
        assertTrue(service.embedAll(List.<Issue>of()).isEmpty());
        verify(embeddingPort, never()).embedBatch(anyList());
    }

    @Test
    void shouldRejectShortBatchReply() {
        when(embeddingPort.embedBatch(anyList())).thenReturn(
                CompletableFuture.completedFuture(List.of(new float[] { 1f })));

        assertThrows(CollaboratorException.class,
                () -> service.embedAll(List.of(Issue.of("a"), Issue.of("b"))));
    }

    @Test
    void shouldWrapEmbedderFailure() {
        when(embeddingPort.embed(anyString())).thenReturn(
                CompletableFuture.failedFuture(new IllegalStateException("quota exceeded")));

        CollaboratorException error = assertThrows(CollaboratorException.class,
                () -> service.embedText("query"));
        assertTrue(error.getMessage().contains("quota exceeded"));
    }
}
