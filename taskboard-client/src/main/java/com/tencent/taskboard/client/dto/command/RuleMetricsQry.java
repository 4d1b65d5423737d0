package com.tencent.taskboard.client.dto.command;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * RuleMetricsQry - 规则执行指标查询（闭区间时间窗口）
 *
 * @author taskboard
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RuleMetricsQry {

    /**
     * 规则ID或项目ID，取决于调用的接口
     */
    @NotNull
    @Positive
    private Long targetId;

    @NotNull(message = "起始时间不能为空")
    private Instant from;

    @NotNull(message = "结束时间不能为空")
    private Instant to;
}
