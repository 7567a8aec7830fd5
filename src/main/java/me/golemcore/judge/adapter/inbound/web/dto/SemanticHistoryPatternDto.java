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
public class SemanticHistoryPatternDto {
    private String semanticId;
    private String name;
    private String description;
    private int issueCount;
    private List<String> sampleIssues;
}
