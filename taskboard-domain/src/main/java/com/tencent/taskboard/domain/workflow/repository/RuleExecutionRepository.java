package com.tencent.taskboard.domain.workflow.repository;

import com.tencent.taskboard.domain.workflow.ExecutionPage;
import com.tencent.taskboard.domain.workflow.ResourceType;
import com.tencent.taskboard.domain.workflow.RuleExecution;
import com.tencent.taskboard.domain.workflow.RuleMetrics;
import com.tencent.taskboard.domain.workflow.WorkflowMetrics;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * RuleExecutionRepository - 规则评估记录仓储，只追加不更新
 *
 * @author taskboard
 */
public interface RuleExecutionRepository {

    /**
     * 追加一条评估记录
     *
     * @param execution 不含 ID 的记录
     * @return 带 ID 的记录
     */
    RuleExecution append(@NotNull RuleExecution execution);

    /**
     * 同一来源是否已经应用过该规则
     */
    boolean existsApplied(@Positive long ruleId, @NotNull ResourceType originType, @Positive long originId);

    /**
     * 单条规则在 [from, to] 内的统计
     *
     * @return 规则不存在时为空
     */
    Optional<RuleMetrics> metricsForRule(@Positive long ruleId, @NotNull Instant from, @NotNull Instant to);

    /**
     * 项目级工作流在 [from, to] 内的统计，按名称排序
     */
    List<WorkflowMetrics> metricsForProject(@Positive long projectId, @NotNull Instant from, @NotNull Instant to);

    /**
     * 分页查询评估记录，按时间倒序
     */
    ExecutionPage page(@Positive long ruleId, @NotNull Instant from, @NotNull Instant to,
                       @Min(1) int pageIndex, @Min(1) @Max(200) int pageSize);
}
