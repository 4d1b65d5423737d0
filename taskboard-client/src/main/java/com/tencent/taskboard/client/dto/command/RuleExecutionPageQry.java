package com.tencent.taskboard.client.dto.command;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * RuleExecutionPageQry - 规则执行记录分页查询
 *
 * @author taskboard
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RuleExecutionPageQry {

    @NotNull
    @Positive
    private Long ruleId;

    @NotNull
    private Instant from;

    @NotNull
    private Instant to;

    @Min(1)
    @Builder.Default
    private int pageIndex = 1;

    @Min(1)
    @Max(200)
    @Builder.Default
    private int pageSize = 20;
}
