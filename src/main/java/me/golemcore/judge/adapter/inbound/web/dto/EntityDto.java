package me.golemcore.judge.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EntityDto {
    private String id;
    private String kind;
    private String name;
    private String description;
    private String outcome;
    private String reasoning;
    private boolean embedded;
}
