package me.golemcore.judge.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request to judge one attempt at a task.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JudgeRequest {
    private String task;
    private String agentOutput;
    private String goal;
    @Builder.Default
    private Boolean useMemory = true;
    @Builder.Default
    private Boolean record = true;
}
