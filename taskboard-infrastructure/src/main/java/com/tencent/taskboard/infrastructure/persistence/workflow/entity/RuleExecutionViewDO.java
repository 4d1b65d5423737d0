package com.tencent.taskboard.infrastructure.persistence.workflow.entity;

import lombok.Data;
import lombok.EqualsAndHashCode;

/**
 * RuleExecutionViewDO - 带触发用户邮箱的评估记录
 *
 * @author taskboard
 */
@Data
@EqualsAndHashCode(callSuper = true)
public class RuleExecutionViewDO extends RuleExecutionDO {

    private String userEmail;
}
