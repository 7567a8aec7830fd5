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
public class ContrastiveDto {
    private List<SimilarityMatchDto> positive;
    private List<SimilarityMatchDto> negative;
}
