package com.tencent.taskboard.domain.workflow;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Rule - 工作流规则
 * <p>
 * 规则属于一个工作流，工作流可以是组织级（projectId 为空）或项目级。
 * 规则命中后按顺序实例化挂载的任务模板。
 * </p>
 *
 * @author taskboard
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Rule {

    private Long id;

    private Long workflowId;

    /**
     * 所属工作流的项目，组织级工作流为空
     */
    private Long workflowProjectId;

    /**
     * 所属工作流的创建人，级联触发时作为生成任务的创建人
     */
    private Long workflowCreatedBy;

    private String name;

    private String goal;

    private RuleTarget target;

    private boolean active;

    /**
     * 是否只响应用户操作
     */
    @Builder.Default
    private boolean userTriggeredOnly = true;

    /**
     * 可选的 SpEL 条件，为空表示总是满足
     */
    private String condition;
}
