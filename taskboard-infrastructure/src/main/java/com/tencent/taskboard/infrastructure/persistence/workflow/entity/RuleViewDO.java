package com.tencent.taskboard.infrastructure.persistence.workflow.entity;

import lombok.Data;
import lombok.EqualsAndHashCode;

/**
 * RuleViewDO - 规则及所属工作流的作用域信息
 *
 * @author taskboard
 */
@Data
@EqualsAndHashCode(callSuper = true)
public class RuleViewDO extends RuleDO {

    private Long workflowProjectId;

    private Long workflowCreatedBy;
}
