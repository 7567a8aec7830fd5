package me.golemcore.judge.memory;

import me.golemcore.judge.adapter.outbound.graph.InMemoryGraphStoreAdapter;
import me.golemcore.judge.domain.model.Attempt;
import me.golemcore.judge.domain.model.Embedding;
import me.golemcore.judge.domain.model.GraphEntity;
import me.golemcore.judge.domain.model.GraphLink;
import me.golemcore.judge.domain.model.Issue;
import me.golemcore.judge.domain.model.NodeKind;
import me.golemcore.judge.domain.model.RelationshipType;
import me.golemcore.judge.domain.model.Semantic;
import me.golemcore.judge.domain.model.SemanticHistoryPattern;
import me.golemcore.judge.domain.model.SemanticPattern;
import me.golemcore.judge.domain.model.SimilarityMatch;
import me.golemcore.judge.domain.model.TraversalDirection;
import me.golemcore.judge.infrastructure.config.JudgeProperties;
import me.golemcore.judge.port.outbound.GraphStorePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.Collection;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class SemanticPatternAggregatorTest {

    private static final Embedding QUERY = Embedding.of(new float[] { 1.0f, 0.0f, 0.0f });

    private JudgeProperties properties;
    private GraphStorePort graphStore;
    private SemanticPatternAggregator aggregator;

    @BeforeEach
    void setUp() {
        properties = new JudgeProperties();
        properties.getEmbedding().setDimension(3);
        graphStore = mock(GraphStorePort.class);
        aggregator = new SemanticPatternAggregator(new SimilarityIndex(graphStore), graphStore, properties);
    }

    // ===== Mode A: from a query vector =====

    @Test
    void shouldCountOnlyIssuesAboveFloor() {
        Semantic sqlInjection = Semantic.of("SQL Injection Vulnerability", "User input concatenated into SQL");
        Issue first = Issue.of("f-string in SELECT");
        Issue second = Issue.of("string concatenation in WHERE clause");
        Issue weak = Issue.of("raw query in ORM");
        when(graphStore.findNearest(NodeKind.ISSUE, QUERY, 15)).thenReturn(List.of(
                new SimilarityMatch(first, 0.9),
                new SimilarityMatch(second, 0.9),
                new SimilarityMatch(weak, 0.7)));
        when(graphStore.traverse(eq(RelationshipType.ABSTRACTS_TO), eq(TraversalDirection.OUTGOING),
                anyCollection())).thenReturn(List.of(
                        new GraphLink(first.getId(), sqlInjection),
                        new GraphLink(second.getId(), sqlInjection)));

        List<SemanticPattern> patterns = aggregator.findPatterns(QUERY, 5);

        assertEquals(1, patterns.size());
        assertEquals(sqlInjection, patterns.get(0).getSemantic());
        assertEquals(2, patterns.get(0).getFrequency());
        assertEquals(0.9, patterns.get(0).getAvgSimilarity(), 1e-9);
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldApplyFloorBeforeTraversal() {
        Issue strong = Issue.of("strong");
        Issue weak = Issue.of("weak");
        when(graphStore.findNearest(NodeKind.ISSUE, QUERY, 15)).thenReturn(List.of(
                new SimilarityMatch(strong, 0.92),
                new SimilarityMatch(weak, 0.5)));
        when(graphStore.traverse(any(), any(), anyCollection())).thenReturn(List.of());
        ArgumentCaptor<Collection<String>> anchors = ArgumentCaptor.forClass(Collection.class);

        aggregator.findPatterns(QUERY, 5);

        verify(graphStore).traverse(eq(RelationshipType.ABSTRACTS_TO), eq(TraversalDirection.OUTGOING),
                anchors.capture());
        assertEquals(List.of(strong.getId()), List.copyOf(anchors.getValue()));
    }

    @Test
    void shouldNotTraverseWhenNoIssuePassesFloor() {
        when(graphStore.findNearest(NodeKind.ISSUE, QUERY, 15)).thenReturn(List.of(
                new SimilarityMatch(Issue.of("weak"), 0.84)));

        assertTrue(aggregator.findPatterns(QUERY, 5).isEmpty());
        verify(graphStore, never()).traverse(any(), any(), anyCollection());
    }

    @Test
    void shouldOrderByFrequencyThenAverageSimilarity() {
        Semantic frequent = Semantic.of("Missing validation", null);
        Semantic fartherSingle = Semantic.of("Hardcoded secret", null);
        Semantic closerSingle = Semantic.of("Off by one", null);
        Issue i1 = Issue.of("i1");
        Issue i2 = Issue.of("i2");
        Issue i3 = Issue.of("i3");
        Issue i4 = Issue.of("i4");
        when(graphStore.findNearest(NodeKind.ISSUE, QUERY, 9)).thenReturn(List.of(
                new SimilarityMatch(i1, 0.99),
                new SimilarityMatch(i2, 0.95),
                new SimilarityMatch(i3, 0.88),
                new SimilarityMatch(i4, 0.86)));
        when(graphStore.traverse(eq(RelationshipType.ABSTRACTS_TO), eq(TraversalDirection.OUTGOING),
                anyCollection())).thenReturn(List.of(
                        new GraphLink(i1.getId(), closerSingle),
                        new GraphLink(i2.getId(), fartherSingle),
                        new GraphLink(i3.getId(), frequent),
                        new GraphLink(i4.getId(), frequent)));

        List<SemanticPattern> patterns = aggregator.findPatterns(QUERY, 3);

        assertEquals(List.of("Missing validation", "Off by one", "Hardcoded secret"),
                patterns.stream().map(p -> p.getSemantic().getName()).toList());
    }

    @Test
    void shouldReturnAtMostKPatterns() {
        Issue i1 = Issue.of("i1");
        Issue i2 = Issue.of("i2");
        when(graphStore.findNearest(NodeKind.ISSUE, QUERY, 3)).thenReturn(List.of(
                new SimilarityMatch(i1, 0.95),
                new SimilarityMatch(i2, 0.9)));
        when(graphStore.traverse(eq(RelationshipType.ABSTRACTS_TO), eq(TraversalDirection.OUTGOING),
                anyCollection())).thenReturn(List.of(
                        new GraphLink(i1.getId(), Semantic.of("A", null)),
                        new GraphLink(i2.getId(), Semantic.of("B", null))));

        List<SemanticPattern> patterns = aggregator.findPatterns(QUERY, 1);

        assertEquals(1, patterns.size());
        assertEquals("A", patterns.get(0).getSemantic().getName());
    }

    @Test
    void shouldSaturateIssueFetchForLargeK() {
        when(graphStore.findNearest(NodeKind.ISSUE, QUERY, Integer.MAX_VALUE)).thenReturn(List.of());

        assertTrue(aggregator.findPatterns(QUERY, Integer.MAX_VALUE).isEmpty());
        verify(graphStore).findNearest(NodeKind.ISSUE, QUERY, Integer.MAX_VALUE);
    }

    // ===== Mode B: from attempt ids =====

    @Test
    void shouldReturnEmptyHistoryWithoutTouchingStore() {
        assertTrue(aggregator.findHistoryPatterns(List.of()).isEmpty());
        verifyNoInteractions(graphStore);
    }

    @Test
    void shouldAggregateHistoryOverRealGraph() {
        InMemoryGraphStoreAdapter store = new InMemoryGraphStoreAdapter(properties);
        SemanticPatternAggregator realAggregator = new SemanticPatternAggregator(new SimilarityIndex(store), store,
                properties);

        Attempt a1 = Attempt.of("a1").judged(false, "bad");
        Attempt a2 = Attempt.of("a2").judged(false, "bad");
        Attempt other = Attempt.of("other").judged(false, "bad");
        Semantic sql = Semantic.of("SQL Injection", null);
        Semantic tld = Semantic.of("Incomplete email validation", null);
        List<Issue> sqlIssues = List.of(Issue.of("sql-1"), Issue.of("sql-2"), Issue.of("sql-3"), Issue.of("sql-4"));
        Issue tldIssue = Issue.of("no TLD check");
        Issue unrelated = Issue.of("unrelated");

        for (GraphEntity node : List.<GraphEntity>of(a1, a2, other, sql, tld, tldIssue, unrelated)) {
            store.createNode(node);
        }
        sqlIssues.forEach(store::createNode);
        store.createRelationship(RelationshipType.CAUSES, a1.getId(), sqlIssues.get(0).getId());
        store.createRelationship(RelationshipType.CAUSES, a1.getId(), sqlIssues.get(1).getId());
        store.createRelationship(RelationshipType.CAUSES, a2.getId(), sqlIssues.get(2).getId());
        store.createRelationship(RelationshipType.CAUSES, a2.getId(), sqlIssues.get(3).getId());
        store.createRelationship(RelationshipType.CAUSES, a2.getId(), tldIssue.getId());
        store.createRelationship(RelationshipType.CAUSES, other.getId(), unrelated.getId());
        for (Issue issue : sqlIssues) {
            store.createRelationship(RelationshipType.ABSTRACTS_TO, issue.getId(), sql.getId());
        }
        store.createRelationship(RelationshipType.ABSTRACTS_TO, tldIssue.getId(), tld.getId());
        store.createRelationship(RelationshipType.ABSTRACTS_TO, unrelated.getId(), tld.getId());

        List<SemanticHistoryPattern> patterns = realAggregator.findHistoryPatterns(List.of(a1.getId(), a2.getId()));

        assertEquals(2, patterns.size());
        assertEquals(sql, patterns.get(0).getSemantic());
        assertEquals(4, patterns.get(0).getIssueCount());
        assertEquals(List.of("sql-1", "sql-2", "sql-3"), patterns.get(0).getSampleIssues());
        assertEquals(tld, patterns.get(1).getSemantic());
        assertEquals(1, patterns.get(1).getIssueCount());
        assertEquals(List.of("no TLD check"), patterns.get(1).getSampleIssues());
    }

    @Test
    void shouldReturnEmptyHistoryWhenAttemptsHaveNoIssues() {
        when(graphStore.traverse(eq(RelationshipType.CAUSES), eq(TraversalDirection.OUTGOING), anyCollection()))
                .thenReturn(List.of());

        assertTrue(aggregator.findHistoryPatterns(List.of("a1")).isEmpty());
        verify(graphStore, never()).traverse(eq(RelationshipType.ABSTRACTS_TO), any(), anyCollection());
    }
}
