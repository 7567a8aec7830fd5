package me.golemcore.judge.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.judge.adapter.inbound.web.dto.JudgeRequest;
import me.golemcore.judge.adapter.inbound.web.dto.JudgmentDto;
import me.golemcore.judge.domain.model.AttemptOutcome;
import me.golemcore.judge.domain.model.Finding;
import me.golemcore.judge.domain.model.JudgmentRecord;
import me.golemcore.judge.domain.model.MemoryUsage;
import me.golemcore.judge.domain.model.RecordedJudgment;
import me.golemcore.judge.domain.service.ExperienceRecorder;
import me.golemcore.judge.domain.service.JudgmentService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;

/**
 * Judges attempts and, unless told otherwise, records them as experience.
 */
@RestController
@RequestMapping("/api/judgments")
@RequiredArgsConstructor
@Slf4j
public class JudgmentsController {

    private final JudgmentService judgmentService;
    private final ExperienceRecorder experienceRecorder;

    @PostMapping
    public Mono<ResponseEntity<JudgmentDto>> judge(@RequestBody JudgeRequest request) {
        return Mono.fromCallable(() -> {
            boolean useMemory = !Boolean.FALSE.equals(request.getUseMemory());
            boolean record = !Boolean.FALSE.equals(request.getRecord());

            JudgmentRecord judgment = judgmentService.judge(request.getTask(), request.getAgentOutput(),
                    request.getGoal(), useMemory);
            RecordedJudgment recorded = record ? experienceRecorder.record(judgment) : null;

            log.info("[API] Judgment {} (memory: {}, recorded: {})",
                    judgment.getAttempt().getOutcome(), useMemory, record);
            return ResponseEntity.ok(toDto(judgment, recorded));
        }).subscribeOn(Schedulers.boundedElastic());
    }

    private static JudgmentDto toDto(JudgmentRecord judgment, RecordedJudgment recorded) {
        List<JudgmentDto.IssueFixPairDto> pairs = judgment.getFindings().stream()
                .map(JudgmentsController::toPairDto)
                .toList();
        MemoryUsage usage = judgment.getMemoryUsage();

        JudgmentDto.JudgmentDtoBuilder builder = JudgmentDto.builder()
                .successful(judgment.getAttempt().getOutcome() == AttemptOutcome.SUCCESS)
                .reasoning(judgment.getAttempt().getReasoning())
                .issueFixPairs(pairs)
                .attemptId(judgment.getAttempt().getId())
                .memoryUsage(JudgmentDto.MemoryUsageDto.builder()
                        .used(usage.isUsed())
                        .positiveExamples(usage.getPositiveExamples())
                        .negativeExamples(usage.getNegativeExamples())
                        .patterns(usage.getPatterns())
                        .build());

        if (recorded != null) {
            builder.recorded(true)
                    .policyId(recorded.getPolicyId())
                    .policyCreated(recorded.isPolicyCreated())
                    .attemptId(recorded.getAttemptId())
                    .issueIds(recorded.getIssueIds())
                    .fixIds(recorded.getFixIds())
                    .semanticIds(recorded.getSemanticIds())
                    .semanticsCreated(recorded.getSemanticsCreated());
        }
        return builder.build();
    }

    private static JudgmentDto.IssueFixPairDto toPairDto(Finding finding) {
        return JudgmentDto.IssueFixPairDto.builder()
                .issue(finding.issue().getDescription())
                .fix(finding.fix().getDescription())
                .build();
    }
}
