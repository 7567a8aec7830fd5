package me.golemcore.judge.domain.service;

import me.golemcore.judge.adapter.outbound.graph.InMemoryGraphStoreAdapter;
import me.golemcore.judge.domain.exception.EntityNotFoundException;
import me.golemcore.judge.domain.model.Attempt;
import me.golemcore.judge.domain.model.Fix;
import me.golemcore.judge.domain.model.Issue;
import me.golemcore.judge.domain.model.NodeKind;
import me.golemcore.judge.domain.model.Policy;
import me.golemcore.judge.domain.model.Semantic;
import me.golemcore.judge.infrastructure.config.JudgeProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ExperienceGraphServiceTest {

    private ExperienceGraphService service;

    private Policy policy;
    private Attempt attempt;
    private Issue tldIssue;
    private Issue atIssue;
    private Fix tldFix;

    @BeforeEach
    void setUp() {
        JudgeProperties properties = new JudgeProperties();
        properties.getEmbedding().setDimension(3);
        service = new ExperienceGraphService(new InMemoryGraphStoreAdapter(properties));

        policy = Policy.of("Validate email addresses");
        attempt = Attempt.of("def validate(e): return '@' in e").judged(false, "Too permissive");
        tldIssue = Issue.of("Accepts addresses without a TLD");
        atIssue = Issue.of("Accepts multiple @ signs");
        tldFix = Fix.of("Require a dot after the @");

        service.createNode(policy);
        service.createAttempt(attempt);
        service.createIssue(tldIssue);
        service.createIssue(atIssue);
        service.createFix(tldFix);
        service.linkAttemptSatisfiesPolicy(attempt.getId(), policy.getId());
        service.linkAttemptCausesIssue(attempt.getId(), tldIssue.getId());
        service.linkAttemptCausesIssue(attempt.getId(), atIssue.getId());
        service.linkFixResolvesIssue(tldFix.getId(), tldIssue.getId());
    }

    @Test
    void shouldReadBackTypedEntities() {
        assertEquals("Validate email addresses", service.getPolicy(policy.getId()).getDescription());
        assertEquals("Too permissive", service.getAttempt(attempt.getId()).getReasoning());
        assertEquals(tldIssue.getId(), service.getIssue(tldIssue.getId()).getId());
    }

    @Test
    void shouldThrowForMissingNode() {
        assertThrows(EntityNotFoundException.class, () -> service.getAttempt("missing"));
        assertThrows(EntityNotFoundException.class, () -> service.findAttemptsForPolicy("missing"));
    }

    @Test
    void shouldFollowRelationships() {
        assertEquals(List.of(attempt.getId()),
                service.findAttemptsForPolicy(policy.getId()).stream().map(Attempt::getId).toList());
        assertEquals(List.of(tldIssue.getId(), atIssue.getId()),
                service.findIssuesForAttempt(attempt.getId()).stream().map(Issue::getId).toList());
        assertEquals(List.of(tldFix.getId()),
                service.findFixesForIssue(tldIssue.getId()).stream().map(Fix::getId).toList());
        assertTrue(service.findFixesForIssue(atIssue.getId()).isEmpty());
    }

    @Test
    void shouldGroupFixesByIssueAndOmitIssuesWithout() {
        Map<String, List<Fix>> fixes = service.findFixesForIssues(List.of(tldIssue.getId(), atIssue.getId()));

        assertEquals(1, fixes.size());
        assertTrue(fixes.containsKey(tldIssue.getId()));
    }

    @Test
    void shouldReturnEmptyMapForNoAnchors() {
        assertTrue(service.findIssuesForAttempts(List.of()).isEmpty());
    }

    @Test
    void shouldLinkIssueToSemantic() {
        Semantic semantic = Semantic.of("Weak Validation", "Input checks too loose");
        service.createNode(semantic);
        service.linkIssueAbstractsToSemantic(tldIssue.getId(), semantic.getId());

        List<Semantic> semantics = service.findSemanticsForIssue(tldIssue.getId());

        assertEquals(1, semantics.size());
        assertEquals("Weak Validation", semantics.get(0).getName());
        assertEquals(1, service.listSemantics().size());
    }

    @Test
    void shouldRejectLinkToMissingEndpoint() {
        assertThrows(EntityNotFoundException.class,
                () -> service.linkFixResolvesIssue(tldFix.getId(), "missing"));
    }

    @Test
    void shouldCountAndWipe() {
        Map<NodeKind, Long> counts = service.countNodes();
        assertEquals(1L, counts.get(NodeKind.POLICY));
        assertEquals(2L, counts.get(NodeKind.ISSUE));
        assertEquals(0L, counts.get(NodeKind.SEMANTIC));

        service.clearAll();
        service.clearAll();

        assertTrue(service.countNodes().values().stream().allMatch(count -> count == 0L));
    }
}
