package me.golemcore.judge.adapter.outbound.evaluator;

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

import me.golemcore.judge.domain.exception.CollaboratorException;
import me.golemcore.judge.domain.model.CategoryDecision;
import me.golemcore.judge.domain.model.IssueFixPair;
import me.golemcore.judge.domain.model.Judgment;
import me.golemcore.judge.domain.model.LlmRequest;
import me.golemcore.judge.domain.model.LlmResponse;
import me.golemcore.judge.domain.model.Message;
import me.golemcore.judge.domain.model.Semantic;
import me.golemcore.judge.infrastructure.config.JudgeProperties;
import me.golemcore.judge.port.outbound.EvaluatorPort;
import me.golemcore.judge.port.outbound.LlmPort;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Evaluator backed by an LLM.
 *
 * <p>
 * Two calls are made through {@link LlmPort}:
 * <ul>
 * <li>a verdict for a task attempt, optionally with memory context from prior
 * evaluations</li>
 * <li>a category decision for a single issue, given the known categories</li>
 * </ul>
 *
 * <p>
 * Both expect a JSON object in the reply, bare or inside a markdown code block.
 * An unreachable model, a timeout or an unparseable reply surfaces as
 * {@link CollaboratorException}; there is no fallback verdict.
 *
 * @since 1.0
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LlmEvaluatorAdapter implements EvaluatorPort {

    private final LlmPort llmPort;
    private final JudgeProperties properties;
    private final ObjectMapper objectMapper;

    private static final Pattern JSON_PATTERN = Pattern.compile("```(?:json)?\\s*(\\{.*?})\\s*```", Pattern.DOTALL);
    private static final Pattern RAW_JSON_PATTERN = Pattern.compile("(\\{.*})", Pattern.DOTALL);

    private static final String JUDGE_SYSTEM_PROMPT = """
            You are an expert AI Judge who evaluates code solutions.
            You have deep knowledge of software engineering best practices, security vulnerabilities, and code quality.
            """;

    private static final String OUTPUT_SCHEMA = """
            Return your evaluation:
            1. is_successful: true if the output achieves the GOAL, false otherwise
            2. reasoning: explanation of why the attempt succeeded or failed
            3. issue_fix_pairs: list of {issue, fix} pairs (empty if successful)

            Respond ONLY with valid JSON:
            {"is_successful": false, "reasoning": "...", "issue_fix_pairs": [{"issue": "...", "fix": "..."}]}
            """;

    private static final String MEMORY_GUIDANCE = """
            How to use this context:
            - These are SIMILAR patterns, not identical situations
            - Use them as reference points, but judge THIS on its own merits
            - A pattern being similar to a failed attempt does NOT mean this fails
            - A pattern being similar to a successful attempt does NOT mean this succeeds
            - Look for the SPECIFIC issue or fix that applies, not just similarity
            """;

    private static final String CLASSIFIER_SYSTEM_PROMPT = """
            You group code review issues into root-cause categories.

            ## Instructions:
            1. Read the issue and the list of existing categories
            2. If an existing category describes the same root cause, choose it and copy its name EXACTLY
            3. Otherwise propose a new short category name (2-5 words) with a one-sentence description
            4. Respond ONLY with valid JSON (no markdown, no explanation):
            {"category": "Category Name", "description": "One sentence", "is_new": false}
            """;

    @Override
    public Judgment evaluate(String task, String attemptText, String goal, String memoryContext) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("GOAL: ").append(goal).append("\n\n");
        prompt.append("TASK: ").append(task).append("\n\n");
        prompt.append("AGENT OUTPUT:\n").append(attemptText).append("\n\n");
        if (memoryContext != null && !memoryContext.isBlank()) {
            prompt.append("MEMORY CONTEXT (similar code patterns from past evaluations):\n");
            prompt.append(memoryContext).append("\n\n");
            prompt.append(MEMORY_GUIDANCE).append("\n");
        }
        prompt.append(OUTPUT_SCHEMA);

        String content = call("Judge", null, JUDGE_SYSTEM_PROMPT, prompt.toString());
        JsonNode node = parseJson(content);
        if (!node.has("is_successful")) {
            throw new CollaboratorException("Evaluator reply has no is_successful field");
        }

        List<IssueFixPair> pairs = new ArrayList<>();
        JsonNode pairsNode = node.path("issue_fix_pairs");
        if (pairsNode.isArray()) {
            for (JsonNode pair : pairsNode) {
                String issue = pair.path("issue").asText("");
                if (!issue.isBlank()) {
                    pairs.add(new IssueFixPair(issue, pair.path("fix").asText("")));
                }
            }
        }

        Judgment judgment = Judgment.builder()
                .successful(node.get("is_successful").asBoolean())
                .reasoning(node.path("reasoning").asText(""))
                .issueFixPairs(List.copyOf(pairs))
                .build();
        log.info("[Judge] Verdict: {} ({} issues)", judgment.isSuccessful() ? "SUCCESS" : "FAILURE", pairs.size());
        return judgment;
    }

    @Override
    public CategoryDecision classifyIssue(String issueDescription, List<Semantic> existingCategories) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("## Existing Categories:\n\n");
        if (existingCategories.isEmpty()) {
            prompt.append("(none yet)\n");
        }
        for (int i = 0; i < existingCategories.size(); i++) {
            Semantic semantic = existingCategories.get(i);
            prompt.append(String.format("%d. **%s**: %s%n", i + 1, semantic.getName(),
                    semantic.getDescription() != null ? semantic.getDescription() : ""));
        }
        prompt.append("\n## Issue:\n").append(issueDescription);
        prompt.append("\n\nChoose a category and respond with JSON only.");

        String classifierModel = properties.getEvaluator().getClassifierModel();
        String content = call("Classifier", classifierModel, CLASSIFIER_SYSTEM_PROMPT, prompt.toString());
        JsonNode node = parseJson(content);

        String category = node.path("category").asText("").trim();
        if (category.isEmpty()) {
            throw new CollaboratorException("Classifier reply has no category");
        }
        boolean isNew = node.path("is_new").asBoolean(true);
        String description = node.path("description").asText(null);
        log.debug("[Classifier] Decision: '{}' (new: {})", category, isNew);
        return new CategoryDecision(category, description, isNew);
    }

    private String call(String tag, String model, String systemPrompt, String userPrompt) {
        LlmRequest request = LlmRequest.builder()
                .model(model != null && !model.isBlank() ? model : null)
                .systemPrompt(systemPrompt)
                .messages(List.of(Message.user(userPrompt)))
                .temperature(properties.getLlm().getTemperature())
                .build();

        long timeoutMs = properties.getEvaluator().getTimeoutMs();
        log.debug("[{}] Sending request to LLM (timeout: {}ms)...", tag, timeoutMs);
        long startMs = System.currentTimeMillis();
        try {
            LlmResponse response = llmPort.chat(request).get(timeoutMs, TimeUnit.MILLISECONDS);
            log.debug("[{}] LLM responded in {}ms", tag, System.currentTimeMillis() - startMs);
            if (response == null || response.getContent() == null || response.getContent().isBlank()) {
                throw new CollaboratorException("Empty reply from LLM");
            }
            return response.getContent();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CollaboratorException("Interrupted while waiting for LLM", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new CollaboratorException("LLM call failed: " + cause.getMessage(), cause);
        } catch (TimeoutException e) {
            throw new CollaboratorException("LLM call timed out after " + timeoutMs + "ms", e);
        }
    }

    private JsonNode parseJson(String content) {
        try {
            JsonNode node = objectMapper.readTree(extractJson(content));
            if (node == null || !node.isObject()) {
                throw new CollaboratorException("LLM reply is not a JSON object");
            }
            return node;
        } catch (JsonProcessingException e) {
            log.warn("Failed to parse LLM response: {}", e.getMessage());
            throw new CollaboratorException("Unparseable LLM reply: " + e.getOriginalMessage(), e);
        }
    }

    private String extractJson(String response) {
        // Try to extract from markdown code block
        Matcher mdMatcher = JSON_PATTERN.matcher(response);
        if (mdMatcher.find()) {
            return mdMatcher.group(1);
        }

        // Outermost braces
        Matcher rawMatcher = RAW_JSON_PATTERN.matcher(response);
        if (rawMatcher.find()) {
            return rawMatcher.group(1);
        }

        return response.trim();
    }
}
