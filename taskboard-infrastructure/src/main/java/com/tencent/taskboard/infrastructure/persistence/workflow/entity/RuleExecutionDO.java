package com.tencent.taskboard.infrastructure.persistence.workflow.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.Data;

import java.time.Instant;

/**
 * RuleExecutionDO - 规则评估记录（只追加，不更新）
 *
 * @author taskboard
 */
@Data
@TableName("rule_executions")
public class RuleExecutionDO {

    @TableId(type = IdType.AUTO)
    private Long id;

    private Long ruleId;

    private String originType;

    private Long originId;

    /**
     * applied / suppressed
     */
    private String outcome;

    private String suppressionReason;

    /**
     * 触发用户，级联触发时为空
     */
    private Long userId;

    private Instant createdAt;
}
