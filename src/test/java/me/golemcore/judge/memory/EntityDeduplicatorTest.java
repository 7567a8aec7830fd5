package me.golemcore.judge.memory;

import me.golemcore.judge.adapter.outbound.graph.InMemoryGraphStoreAdapter;
import me.golemcore.judge.domain.model.Attempt;
import me.golemcore.judge.domain.model.Embedding;
import me.golemcore.judge.domain.model.NodeKind;
import me.golemcore.judge.domain.model.Policy;
import me.golemcore.judge.domain.model.Semantic;
import me.golemcore.judge.domain.model.UpsertResult;
import me.golemcore.judge.infrastructure.config.JudgeProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class EntityDeduplicatorTest {

    private JudgeProperties properties;
    private InMemoryGraphStoreAdapter graphStore;
    private EntityDeduplicator deduplicator;

    @BeforeEach
    void setUp() {
        properties = new JudgeProperties();
        properties.getEmbedding().setDimension(3);
        graphStore = new InMemoryGraphStoreAdapter(properties);
        deduplicator = new EntityDeduplicator(new SimilarityIndex(graphStore), graphStore, properties);
    }

    private static Embedding vec(float... values) {
        return Embedding.of(values);
    }

    // ===== policies =====

    @Test
    void shouldReuseParaphrasedPolicy() {
        Policy original = Policy.of("Write a function to validate email addresses")
                .withEmbedding(vec(1.0f, 0.05f, 0.0f));
        Policy paraphrase = Policy.of("Create an email validator")
                .withEmbedding(vec(0.98f, 0.1f, 0.0f));

        UpsertResult first = deduplicator.getOrCreatePolicy(original);
        UpsertResult second = deduplicator.getOrCreatePolicy(paraphrase);

        assertTrue(first.created());
        assertFalse(second.created());
        assertEquals(original.getId(), second.id());
        assertEquals(1, graphStore.countNodes(NodeKind.POLICY));
    }

    @Test
    void shouldCreatePolicyBelowThreshold() {
        Policy email = Policy.of("Validate email").withEmbedding(vec(1, 0, 0));
        Policy sql = Policy.of("Fetch user by id").withEmbedding(vec(0.6f, 0.8f, 0));

        deduplicator.getOrCreatePolicy(email);
        UpsertResult result = deduplicator.getOrCreatePolicy(sql);

        assertTrue(result.created());
        assertEquals(sql.getId(), result.id());
        assertEquals(2, graphStore.countNodes(NodeKind.POLICY));
    }

    @Test
    void shouldHonourPerCallThreshold() {
        deduplicator.getOrCreatePolicy(Policy.of("a").withEmbedding(vec(1, 0, 0)));

        // cosine 0.6: below the default, above an explicit 0.5
        UpsertResult strict = deduplicator.getOrCreatePolicy(Policy.of("b").withEmbedding(vec(0.6f, 0.8f, 0)));
        UpsertResult loose = deduplicator.getOrCreatePolicy(Policy.of("c").withEmbedding(vec(0.6f, 0.8f, 0)), 0.5);

        assertTrue(strict.created());
        assertFalse(loose.created());
    }

    @Test
    void shouldUseConfiguredThreshold() {
        properties.getMemory().setPolicyThreshold(0.5);
        Policy first = Policy.of("a").withEmbedding(vec(1, 0, 0));
        deduplicator.getOrCreatePolicy(first);

        UpsertResult result = deduplicator.getOrCreatePolicy(Policy.of("b").withEmbedding(vec(0.6f, 0.8f, 0)));

        assertFalse(result.created());
        assertEquals(first.getId(), result.id());
    }

    @Test
    void shouldCreateWithoutEmbeddingUnconditionally() {
        deduplicator.getOrCreatePolicy(Policy.of("Validate email").withEmbedding(vec(1, 0, 0)));

        UpsertResult first = deduplicator.getOrCreatePolicy(Policy.of("Validate email"));
        UpsertResult second = deduplicator.getOrCreatePolicy(Policy.of("Validate email"));

        assertTrue(first.created());
        assertTrue(second.created());
        assertEquals(3, graphStore.countNodes(NodeKind.POLICY));
    }

    // ===== semantics =====

    @Test
    void shouldMergeSemanticAtLooserThreshold() {
        Semantic existing = Semantic.of("SQL Injection", "Unsanitized input in queries")
                .withEmbedding(vec(1, 0, 0));
        // cosine ~0.87: merges as a semantic (0.85) but would not as a policy (0.9)
        Semantic candidate = Semantic.of("SQL Injection Vulnerability", "Query built from user input")
                .withEmbedding(vec(0.87f, 0.493f, 0));

        deduplicator.getOrCreateSemantic(existing);
        UpsertResult result = deduplicator.getOrCreateSemantic(candidate);

        assertFalse(result.created());
        assertEquals(existing.getId(), result.id());
        assertEquals(1, graphStore.countNodes(NodeKind.SEMANTIC));
    }

    @Test
    void shouldNotMatchAcrossKinds() {
        deduplicator.getOrCreatePolicy(Policy.of("SQL Injection").withEmbedding(vec(1, 0, 0)));

        UpsertResult result = deduplicator.getOrCreateSemantic(
                Semantic.of("SQL Injection", null).withEmbedding(vec(1, 0, 0)));

        assertTrue(result.created());
    }

    @Test
    void shouldRejectKindsThatAreNeverDeduplicated() {
        Attempt attempt = Attempt.of("attempt").withEmbedding(vec(1, 0, 0));

        assertThrows(IllegalArgumentException.class, () -> deduplicator.getOrCreate(attempt, 0.9));
    }

    @Test
    void shouldRejectThresholdOutOfRange() {
        Policy policy = Policy.of("policy").withEmbedding(vec(1, 0, 0));

        assertThrows(IllegalArgumentException.class, () -> deduplicator.getOrCreatePolicy(policy, 1.5));
    }

    // ===== concurrency =====

    @Test
    void shouldCreateSinglePolicyUnderConcurrentUpserts() throws Exception {
        int writers = 8;
        ExecutorService executor = Executors.newFixedThreadPool(writers);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<UpsertResult>> futures = new ArrayList<>();
            for (int i = 0; i < writers; i++) {
                Policy candidate = Policy.of("Validate email #" + i)
                        .withEmbedding(vec(1.0f, 0.01f * i, 0.0f));
                Callable<UpsertResult> task = () -> {
                    start.await();
                    return deduplicator.getOrCreatePolicy(candidate);
                };
                futures.add(executor.submit(task));
            }
            start.countDown();

            Set<String> ids = new HashSet<>();
            int created = 0;
            for (Future<UpsertResult> future : futures) {
                UpsertResult result = future.get(10, TimeUnit.SECONDS);
                ids.add(result.id());
                if (result.created()) {
                    created++;
                }
            }

            assertEquals(1, created);
            assertEquals(1, ids.size());
            assertEquals(1, graphStore.countNodes(NodeKind.POLICY));
        } finally {
            executor.shutdownNow();
        }
    }
}
