package me.golemcore.judge.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JudgmentDto {
    private boolean successful;
    private String reasoning;
    private List<IssueFixPairDto> issueFixPairs;
    private boolean recorded;
    private String policyId;
    private boolean policyCreated;
    private String attemptId;
    private List<String> issueIds;
    private List<String> fixIds;
    private List<String> semanticIds;
    private int semanticsCreated;
    private MemoryUsageDto memoryUsage;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class IssueFixPairDto {
        private String issue;
        private String fix;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class MemoryUsageDto {
        private boolean used;
        private int positiveExamples;
        private int negativeExamples;
        private int patterns;
    }
}
