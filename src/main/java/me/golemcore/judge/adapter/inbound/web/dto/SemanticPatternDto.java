package me.golemcore.judge.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SemanticPatternDto {
    private String semanticId;
    private String name;
    private String description;
    private int frequency;
    private double avgSimilarity;
}
