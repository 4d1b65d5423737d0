package com.tencent.taskboard.domain.workflow.repository;

import com.tencent.taskboard.domain.workflow.Rule;
import com.tencent.taskboard.domain.workflow.TaskTemplate;
import com.tencent.taskboard.domain.workflow.TransitionEvent;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.util.List;

/**
 * RuleRepository - 工作流规则仓储接口
 *
 * @author taskboard
 */
public interface RuleRepository {

    /**
     * 查找候选规则：规则与工作流均启用，工作流属于项目所在组织且为组织级或该项目，
     * 资源类型与目标状态一致，任务事件还需满足任务类型过滤。
     *
     * @param event 迁移事件
     * @return 项目级工作流优先，其次按规则 ID 升序
     */
    List<Rule> findMatching(@NotNull TransitionEvent event);

    /**
     * 重新读取规则与所属工作流的启用状态
     *
     * @param ruleId 规则 ID
     * @return 两者都启用时为 true，规则不存在时为 false
     */
    boolean isActive(@Positive long ruleId);

    /**
     * 规则挂载的模板
     *
     * @param ruleId 规则 ID
     * @return 按 execution_order、模板 ID 升序
     */
    List<TaskTemplate> findTemplates(@Positive long ruleId);
}
