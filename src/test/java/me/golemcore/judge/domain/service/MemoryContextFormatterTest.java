package me.golemcore.judge.domain.service;

import me.golemcore.judge.domain.model.Attempt;
import me.golemcore.judge.domain.model.Fix;
import me.golemcore.judge.domain.model.Issue;
import me.golemcore.judge.domain.model.MemoryRetrieval;
import me.golemcore.judge.domain.model.Semantic;
import me.golemcore.judge.domain.model.SemanticHistoryPattern;
import me.golemcore.judge.domain.model.SemanticPattern;
import me.golemcore.judge.domain.model.SimilarityMatch;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MemoryContextFormatterTest {

    private final MemoryContextFormatter formatter = new MemoryContextFormatter();

    @Test
    void shouldRenderNothingForEmptyRetrieval() {
        assertEquals("", formatter.format(MemoryRetrieval.empty()));
    }

    @Test
    void shouldRenderAllSections() {
        Attempt passed = Attempt.of("uses a full regex").judged(true, "Handles TLDs");
        Attempt failed = Attempt.of("return '@' in e").judged(false, "Too permissive");
        Issue issue = Issue.of("Accepts a@b");
        Fix fix = Fix.of("Require a TLD");
        MemoryRetrieval retrieval = MemoryRetrieval.builder()
                .positive(List.of(new SimilarityMatch(passed, 0.83)))
                .negative(List.of(new SimilarityMatch(failed, 0.951)))
                .failureIssues(Map.of(failed.getId(), List.of(issue)))
                .fixesByIssue(Map.of(issue.getId(), List.of(fix)))
                .historyPatterns(List.of(SemanticHistoryPattern.builder()
                        .semantic(Semantic.of("Weak Validation", "Input checks too loose"))
                        .issueCount(4)
                        .sampleIssues(List.of("Accepts a@b", "No TLD check"))
                        .build()))
                .patterns(List.of(SemanticPattern.builder()
                        .semantic(Semantic.of("SQL Injection", "Unsanitized input in queries"))
                        .frequency(2)
                        .avgSimilarity(0.9)
                        .build()))
                .build();

        String context = formatter.format(retrieval);

        assertTrue(context.startsWith("SUCCESSFUL SIMILAR ATTEMPTS:"));
        assertTrue(context.contains("- (similarity 0.83) uses a full regex"));
        assertTrue(context.contains("  Why it passed: Handles TLDs"));
        assertTrue(context.contains("- (similarity 0.95) return '@' in e"));
        assertTrue(context.contains("  Why it failed: Too permissive"));
        assertTrue(context.contains("  Issue: Accepts a@b"));
        assertTrue(context.contains("    Fix: Require a TLD"));
        assertTrue(context.contains("- Weak Validation (4 issues): e.g. Accepts a@b; No TLD check"));
        assertTrue(context.contains("- SQL Injection: Unsanitized input in queries (seen in 2 similar issues, "
                + "avg similarity 0.90)"));
        assertTrue(context.indexOf("FAILED SIMILAR ATTEMPTS") < context.indexOf("PATTERNS TO CHECK"));
    }

    @Test
    void shouldTruncateLongAttempts() {
        Attempt longAttempt = Attempt.of("x".repeat(1000)).judged(false, null);
        MemoryRetrieval retrieval = MemoryRetrieval.builder()
                .negative(List.of(new SimilarityMatch(longAttempt, 0.99)))
                .build();

        String context = formatter.format(retrieval);

        assertTrue(context.contains("x".repeat(400) + "..."));
        assertFalse(context.contains("x".repeat(401)));
        assertFalse(context.contains("Why it failed"));
    }

    @Test
    void shouldRenderPatternsOnly() {
        MemoryRetrieval retrieval = MemoryRetrieval.builder()
                .patterns(List.of(SemanticPattern.builder()
                        .semantic(Semantic.of("Off By One", ""))
                        .frequency(1)
                        .avgSimilarity(0.875)
                        .build()))
                .build();

        String context = formatter.format(retrieval);

        assertTrue(context.startsWith("PATTERNS TO CHECK"));
        assertTrue(context.endsWith("- Off By One (seen in 1 similar issues, avg similarity 0.88)"));
    }
}
