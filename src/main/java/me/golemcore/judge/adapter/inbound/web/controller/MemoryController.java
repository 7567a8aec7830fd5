package me.golemcore.judge.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.judge.adapter.inbound.web.dto.ContrastiveDto;
import me.golemcore.judge.adapter.inbound.web.dto.EntityDto;
import me.golemcore.judge.adapter.inbound.web.dto.HistoryPatternRequest;
import me.golemcore.judge.adapter.inbound.web.dto.RetrievalRequest;
import me.golemcore.judge.adapter.inbound.web.dto.SemanticHistoryPatternDto;
import me.golemcore.judge.adapter.inbound.web.dto.SemanticPatternDto;
import me.golemcore.judge.adapter.inbound.web.dto.SimilarityMatchDto;
import me.golemcore.judge.domain.model.Attempt;
import me.golemcore.judge.domain.model.ContrastiveExamples;
import me.golemcore.judge.domain.model.Embedding;
import me.golemcore.judge.domain.model.GraphEntity;
import me.golemcore.judge.domain.model.Semantic;
import me.golemcore.judge.domain.model.SemanticHistoryPattern;
import me.golemcore.judge.domain.model.SemanticPattern;
import me.golemcore.judge.domain.model.SimilarityMatch;
import me.golemcore.judge.domain.service.EntityEmbeddingService;
import me.golemcore.judge.domain.service.ExperienceGraphService;
import me.golemcore.judge.memory.ContrastiveRetriever;
import me.golemcore.judge.memory.SemanticPatternAggregator;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read, retrieval and wipe operations on the experience graph.
 */
@RestController
@RequestMapping("/api/memory")
@RequiredArgsConstructor
@Slf4j
public class MemoryController {

    private final ExperienceGraphService graphService;
    private final EntityEmbeddingService embeddingService;
    private final ContrastiveRetriever contrastiveRetriever;
    private final SemanticPatternAggregator patternAggregator;

    // ==================== READS ====================

    @GetMapping("/stats")
    public Mono<ResponseEntity<Map<String, Long>>> getStats() {
        return Mono.fromCallable(() -> {
            Map<String, Long> stats = new LinkedHashMap<>();
            graphService.countNodes().forEach((kind, count) -> stats.put(kind.getLabel(), count));
            return ResponseEntity.ok(stats);
        });
    }

    @GetMapping("/policies/{id}/attempts")
    public Mono<ResponseEntity<List<EntityDto>>> getAttemptsForPolicy(@PathVariable String id) {
        return Mono.fromCallable(() -> ResponseEntity.ok(toDtos(graphService.findAttemptsForPolicy(id))));
    }

    @GetMapping("/attempts/{id}/issues")
    public Mono<ResponseEntity<List<EntityDto>>> getIssuesForAttempt(@PathVariable String id) {
        return Mono.fromCallable(() -> ResponseEntity.ok(toDtos(graphService.findIssuesForAttempt(id))));
    }

    @GetMapping("/issues/{id}/fixes")
    public Mono<ResponseEntity<List<EntityDto>>> getFixesForIssue(@PathVariable String id) {
        return Mono.fromCallable(() -> ResponseEntity.ok(toDtos(graphService.findFixesForIssue(id))));
    }

    @GetMapping("/issues/{id}/semantics")
    public Mono<ResponseEntity<List<EntityDto>>> getSemanticsForIssue(@PathVariable String id) {
        return Mono.fromCallable(() -> ResponseEntity.ok(toDtos(graphService.findSemanticsForIssue(id))));
    }

    @GetMapping("/semantics")
    public Mono<ResponseEntity<List<EntityDto>>> getSemantics() {
        return Mono.fromCallable(() -> ResponseEntity.ok(toDtos(graphService.listSemantics())));
    }

    // ==================== RETRIEVAL ====================

    @PostMapping("/contrastive")
    public Mono<ResponseEntity<ContrastiveDto>> findContrastive(@RequestBody RetrievalRequest request) {
        return Mono.fromCallable(() -> {
            Embedding query = resolveQuery(request);
            ContrastiveExamples examples = request.getK() != null
                    ? contrastiveRetriever.findContrastive(query, request.getK())
                    : contrastiveRetriever.findContrastive(query);
            ContrastiveDto dto = ContrastiveDto.builder()
                    .positive(examples.getPositive().stream().map(MemoryController::toMatchDto).toList())
                    .negative(examples.getNegative().stream().map(MemoryController::toMatchDto).toList())
                    .build();
            return ResponseEntity.ok(dto);
        });
    }

    @PostMapping("/patterns")
    public Mono<ResponseEntity<List<SemanticPatternDto>>> findPatterns(@RequestBody RetrievalRequest request) {
        return Mono.fromCallable(() -> {
            Embedding query = resolveQuery(request);
            List<SemanticPattern> patterns = request.getK() != null
                    ? patternAggregator.findPatterns(query, request.getK())
                    : patternAggregator.findPatterns(query);
            return ResponseEntity.ok(patterns.stream().map(MemoryController::toPatternDto).toList());
        });
    }

    @PostMapping("/patterns/history")
    public Mono<ResponseEntity<List<SemanticHistoryPatternDto>>> findHistoryPatterns(
            @RequestBody HistoryPatternRequest request) {
        return Mono.fromCallable(() -> {
            List<String> attemptIds = request.getAttemptIds() != null ? request.getAttemptIds() : List.of();
            List<SemanticHistoryPattern> patterns = patternAggregator.findHistoryPatterns(attemptIds);
            return ResponseEntity.ok(patterns.stream().map(MemoryController::toHistoryDto).toList());
        });
    }

    // ==================== WIPE ====================

    @DeleteMapping
    public Mono<ResponseEntity<Void>> clearAll() {
        return Mono.fromCallable(() -> {
            graphService.clearAll();
            log.info("[API] Experience graph wiped");
            return ResponseEntity.noContent().<Void>build();
        });
    }

    private Embedding resolveQuery(RetrievalRequest request) {
        if (request.getEmbedding() != null && !request.getEmbedding().isEmpty()) {
            return Embedding.of(request.getEmbedding());
        }
        if (request.getText() == null || request.getText().isBlank()) {
            throw new IllegalArgumentException("Either 'text' or 'embedding' is required");
        }
        Embedding query = embeddingService.embedText(request.getText());
        if (!query.isPresent()) {
            throw new IllegalStateException("Embeddings are disabled, pass 'embedding' explicitly");
        }
        return query;
    }

    private static List<EntityDto> toDtos(List<? extends GraphEntity> entities) {
        return entities.stream().map(MemoryController::toEntityDto).toList();
    }

    private static EntityDto toEntityDto(GraphEntity entity) {
        EntityDto.EntityDtoBuilder builder = EntityDto.builder()
                .id(entity.getId())
                .kind(entity.getKind().getLabel())
                .description(entity.getDescription())
                .embedded(entity.getEmbedding().isPresent());
        if (entity instanceof Semantic semantic) {
            builder.name(semantic.getName());
        }
        if (entity instanceof Attempt attempt) {
            builder.outcome(attempt.getOutcome().name())
                    .reasoning(attempt.getReasoning());
        }
        return builder.build();
    }

    private static SimilarityMatchDto toMatchDto(SimilarityMatch match) {
        return SimilarityMatchDto.builder()
                .entity(toEntityDto(match.entity()))
                .score(match.score())
                .build();
    }

    private static SemanticPatternDto toPatternDto(SemanticPattern pattern) {
        return SemanticPatternDto.builder()
                .semanticId(pattern.getSemantic().getId())
                .name(pattern.getSemantic().getName())
                .description(pattern.getSemantic().getDescription())
                .frequency(pattern.getFrequency())
                .avgSimilarity(pattern.getAvgSimilarity())
                .build();
    }

    private static SemanticHistoryPatternDto toHistoryDto(SemanticHistoryPattern pattern) {
        return SemanticHistoryPatternDto.builder()
                .semanticId(pattern.getSemantic().getId())
                .name(pattern.getSemantic().getName())
                .description(pattern.getSemantic().getDescription())
                .issueCount(pattern.getIssueCount())
                .sampleIssues(pattern.getSampleIssues())
                .build();
    }
}
