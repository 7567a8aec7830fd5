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

import me.golemcore.judge.domain.model.Attempt;
import me.golemcore.judge.domain.model.Fix;
import me.golemcore.judge.domain.model.Issue;
import me.golemcore.judge.domain.model.MemoryRetrieval;
import me.golemcore.judge.domain.model.Semantic;
import me.golemcore.judge.domain.model.SemanticHistoryPattern;
import me.golemcore.judge.domain.model.SemanticPattern;
import me.golemcore.judge.domain.model.SimilarityMatch;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Renders retrieved precedent as plain text for the evaluator prompt.
 */
@Component
public class MemoryContextFormatter {

    private static final int MAX_ATTEMPT_CHARS = 400;

    public String format(MemoryRetrieval retrieval) {
        if (retrieval.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder();

        if (!retrieval.getPositive().isEmpty()) {
            sb.append("SUCCESSFUL SIMILAR ATTEMPTS:\n");
            for (SimilarityMatch match : retrieval.getPositive()) {
                appendAttempt(sb, match, "Why it passed");
            }
            sb.append('\n');
        }

        if (!retrieval.getNegative().isEmpty()) {
            sb.append("FAILED SIMILAR ATTEMPTS:\n");
            for (SimilarityMatch match : retrieval.getNegative()) {
                appendAttempt(sb, match, "Why it failed");
                for (Issue issue : retrieval.getFailureIssues().getOrDefault(match.id(), List.of())) {
                    sb.append("  Issue: ").append(issue.getDescription()).append('\n');
                    for (Fix fix : retrieval.getFixesByIssue().getOrDefault(issue.getId(), List.of())) {
                        sb.append("    Fix: ").append(fix.getDescription()).append('\n');
                    }
                }
            }
            sb.append('\n');
        }

        if (!retrieval.getHistoryPatterns().isEmpty()) {
            sb.append("RECURRING ROOT CAUSES IN FAILED ATTEMPTS:\n");
            for (SemanticHistoryPattern pattern : retrieval.getHistoryPatterns()) {
                sb.append("- ").append(pattern.getSemantic().getName())
                        .append(" (").append(pattern.getIssueCount()).append(" issues)");
                if (!pattern.getSampleIssues().isEmpty()) {
                    sb.append(": e.g. ").append(String.join("; ", pattern.getSampleIssues()));
                }
                sb.append('\n');
            }
            sb.append('\n');
        }

        if (!retrieval.getPatterns().isEmpty()) {
            sb.append("PATTERNS TO CHECK (check if applicable, these are signals, not verdicts):\n");
            for (SemanticPattern pattern : retrieval.getPatterns()) {
                Semantic semantic = pattern.getSemantic();
                sb.append("- ").append(semantic.getName());
                if (semantic.getDescription() != null && !semantic.getDescription().isBlank()) {
                    sb.append(": ").append(semantic.getDescription());
                }
                sb.append(String.format(Locale.ROOT, " (seen in %d similar issues, avg similarity %.2f)%n",
                        pattern.getFrequency(), pattern.getAvgSimilarity()));
            }
        }

        return sb.toString().trim();
    }

    private void appendAttempt(StringBuilder sb, SimilarityMatch match, String reasonLabel) {
        Attempt attempt = match.entityAs(Attempt.class);
        sb.append(String.format(Locale.ROOT, "- (similarity %.2f) ", match.score()))
                .append(truncate(attempt.getDescription()))
                .append('\n');
        if (attempt.getReasoning() != null && !attempt.getReasoning().isBlank()) {
            sb.append("  ").append(reasonLabel).append(": ").append(attempt.getReasoning()).append('\n');
        }
    }

    private String truncate(String text) {
        if (text == null)
            return "";
        if (text.length() <= MAX_ATTEMPT_CHARS)
            return text;
        return text.substring(0, MAX_ATTEMPT_CHARS) + "...";
    }
}
