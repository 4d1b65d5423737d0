package com.tencent.taskboard.infrastructure.persistence.workflow.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.tencent.taskboard.infrastructure.persistence.workflow.entity.RuleDO;
import com.tencent.taskboard.infrastructure.persistence.workflow.entity.RuleViewDO;
import com.tencent.taskboard.infrastructure.persistence.workflow.entity.TaskTemplateDO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.util.List;

/**
 * RuleMapper - 工作流规则Mapper
 *
 * @author taskboard
 */
@Mapper
public interface RuleMapper extends BaseMapper<RuleDO> {

    /**
     * 候选规则：项目级工作流在前，组织级在后，各自按规则ID升序
     */
    @Select("<script>"
        + "SELECT r.id, r.workflow_id, r.name, r.goal, r.resource_type, r.task_type_id, r.to_state, "
        + "r.active, r.user_triggered_only, r.condition_expr, r.created_at, "
        + "w.project_id AS workflow_project_id, w.created_by AS workflow_created_by "
        + "FROM rules r "
        + "JOIN workflows w ON w.id = r.workflow_id "
        + "JOIN projects p ON p.org_id = w.org_id "
        + "WHERE p.id = #{projectId} "
        + "AND r.active = TRUE AND w.active = TRUE "
        + "AND (w.project_id IS NULL OR w.project_id = p.id) "
        + "AND r.resource_type = #{resourceType} "
        + "AND r.to_state = #{toState} "
        + "<if test='taskEvent'>"
        + "AND (r.task_type_id IS NULL OR r.task_type_id = #{taskTypeId,jdbcType=BIGINT}) "
        + "</if>"
        + "ORDER BY CASE WHEN w.project_id IS NULL THEN 1 ELSE 0 END, r.id"
        + "</script>")
    List<RuleViewDO> selectMatching(@Param("projectId") long projectId,
                                    @Param("resourceType") String resourceType,
                                    @Param("toState") String toState,
                                    @Param("taskEvent") boolean taskEvent,
                                    @Param("taskTypeId") Long taskTypeId);

    @Select("SELECT COUNT(*) FROM rules r JOIN workflows w ON w.id = r.workflow_id "
        + "WHERE r.id = #{ruleId} AND r.active = TRUE AND w.active = TRUE")
    int countActive(@Param("ruleId") long ruleId);

    @Select("SELECT t.id, t.org_id, t.project_id, t.name, t.description, t.type_id, t.priority, "
        + "t.created_by, t.created_at, rt.execution_order "
        + "FROM rule_templates rt "
        + "JOIN task_templates t ON t.id = rt.template_id "
        + "WHERE rt.rule_id = #{ruleId} "
        + "ORDER BY rt.execution_order, t.id")
    List<TaskTemplateDO> selectTemplates(@Param("ruleId") long ruleId);
}
