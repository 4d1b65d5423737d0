package com.tencent.taskboard.infrastructure.persistence.workflow.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.baomidou.mybatisplus.core.metadata.IPage;
import com.tencent.taskboard.infrastructure.persistence.workflow.entity.RuleExecutionDO;
import com.tencent.taskboard.infrastructure.persistence.workflow.entity.RuleExecutionViewDO;
import com.tencent.taskboard.infrastructure.persistence.workflow.entity.RuleMetricsDO;
import com.tencent.taskboard.infrastructure.persistence.workflow.entity.WorkflowMetricsDO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.time.Instant;
import java.util.List;

/**
 * RuleExecutionMapper - 规则评估记录Mapper
 * <p>
 * 统计窗口为闭区间 [from, to]
 * </p>
 *
 * @author taskboard
 */
@Mapper
public interface RuleExecutionMapper extends BaseMapper<RuleExecutionDO> {

    @Select("SELECT r.id AS rule_id, r.name AS rule_name, "
        + "COUNT(e.id) AS evaluated, "
        + "COALESCE(SUM(CASE WHEN e.outcome = 'applied' THEN 1 ELSE 0 END), 0) AS applied, "
        + "COALESCE(SUM(CASE WHEN e.outcome = 'suppressed' THEN 1 ELSE 0 END), 0) AS suppressed, "
        + "COALESCE(SUM(CASE WHEN e.suppression_reason = 'idempotent' THEN 1 ELSE 0 END), 0) AS suppressed_idempotent, "
        + "COALESCE(SUM(CASE WHEN e.suppression_reason = 'not_user_triggered' THEN 1 ELSE 0 END), 0) "
        + "AS suppressed_not_user_triggered, "
        + "COALESCE(SUM(CASE WHEN e.suppression_reason = 'not_matching' THEN 1 ELSE 0 END), 0) AS suppressed_not_matching, "
        + "COALESCE(SUM(CASE WHEN e.suppression_reason = 'inactive' THEN 1 ELSE 0 END), 0) AS suppressed_inactive "
        + "FROM rules r "
        + "LEFT JOIN rule_executions e ON e.rule_id = r.id "
        + "AND e.created_at >= #{from} AND e.created_at <= #{to} "
        + "WHERE r.id = #{ruleId} "
        + "GROUP BY r.id, r.name")
    RuleMetricsDO selectRuleMetrics(@Param("ruleId") long ruleId,
                                    @Param("from") Instant from,
                                    @Param("to") Instant to);

    @Select("SELECT w.id AS workflow_id, w.name AS workflow_name, "
        + "COUNT(DISTINCT r.id) AS rule_count, "
        + "COUNT(e.id) AS evaluated, "
        + "COALESCE(SUM(CASE WHEN e.outcome = 'applied' THEN 1 ELSE 0 END), 0) AS applied, "
        + "COALESCE(SUM(CASE WHEN e.outcome = 'suppressed' THEN 1 ELSE 0 END), 0) AS suppressed "
        + "FROM workflows w "
        + "LEFT JOIN rules r ON r.workflow_id = w.id "
        + "LEFT JOIN rule_executions e ON e.rule_id = r.id "
        + "AND e.created_at >= #{from} AND e.created_at <= #{to} "
        + "WHERE w.project_id = #{projectId} "
        + "GROUP BY w.id, w.name "
        + "ORDER BY w.name, w.id")
    List<WorkflowMetricsDO> selectProjectMetrics(@Param("projectId") long projectId,
                                                 @Param("from") Instant from,
                                                 @Param("to") Instant to);

    /**
     * 分页由 PaginationInnerInterceptor 完成
     */
    @Select("SELECT e.id, e.rule_id, e.origin_type, e.origin_id, e.outcome, e.suppression_reason, "
        + "e.user_id, u.email AS user_email, e.created_at "
        + "FROM rule_executions e "
        + "LEFT JOIN users u ON u.id = e.user_id "
        + "WHERE e.rule_id = #{ruleId} AND e.created_at >= #{from} AND e.created_at <= #{to} "
        + "ORDER BY e.created_at DESC, e.id DESC")
    IPage<RuleExecutionViewDO> selectPageByRule(IPage<RuleExecutionViewDO> page,
                                                @Param("ruleId") long ruleId,
                                                @Param("from") Instant from,
                                                @Param("to") Instant to);
}
