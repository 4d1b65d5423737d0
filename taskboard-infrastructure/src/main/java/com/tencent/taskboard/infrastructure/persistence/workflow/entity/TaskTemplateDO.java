package com.tencent.taskboard.infrastructure.persistence.workflow.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.Data;

import java.time.Instant;

/**
 * TaskTemplateDO - 任务模板数据对象
 *
 * @author taskboard
 */
@Data
@TableName("task_templates")
public class TaskTemplateDO {

    @TableId(type = IdType.AUTO)
    private Long id;

    private Long orgId;

    private Long projectId;

    private String name;

    private String description;

    private Long typeId;

    private Integer priority;

    private Long createdBy;

    private Instant createdAt;

    /**
     * 来自 rule_templates 关联表
     */
    @TableField(exist = false)
    private Integer executionOrder;
}
