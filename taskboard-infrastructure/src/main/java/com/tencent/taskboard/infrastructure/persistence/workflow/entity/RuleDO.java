package com.tencent.taskboard.infrastructure.persistence.workflow.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.Data;

import java.time.Instant;

/**
 * RuleDO - 工作流规则数据对象
 *
 * @author taskboard
 */
@Data
@TableName("rules")
public class RuleDO {

    @TableId(type = IdType.AUTO)
    private Long id;

    private Long workflowId;

    private String name;

    /**
     * 规则目的说明
     */
    private String goal;

    /**
     * task / card
     */
    private String resourceType;

    /**
     * 仅对任务事件生效的类型过滤，null 表示不限
     */
    private Long taskTypeId;

    private String toState;

    private Boolean active;

    private Boolean userTriggeredOnly;

    /**
     * SpEL 条件表达式
     */
    private String conditionExpr;

    private Instant createdAt;
}
