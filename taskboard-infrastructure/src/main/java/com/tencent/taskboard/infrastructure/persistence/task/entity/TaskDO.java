package com.tencent.taskboard.infrastructure.persistence.task.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.Data;

import java.time.Instant;

/**
 * TaskDO - 任务数据对象
 *
 * @author taskboard
 */
@Data
@TableName("tasks")
public class TaskDO {

    /**
     * 主键ID
     */
    @TableId(type = IdType.AUTO)
    private Long id;

    private Long projectId;

    private Long typeId;

    /**
     * 所属卡片，与 milestoneId 互斥
     */
    private Long cardId;

    /**
     * 直接挂载的里程碑（无卡片时）
     */
    private Long milestoneId;

    private String title;

    private String description;

    private Integer priority;

    /**
     * available / claimed / completed
     */
    private String status;

    private Long claimedBy;

    private Instant claimedAt;

    private Instant completedAt;

    private Long createdBy;

    private Instant createdAt;

    /**
     * 由规则生成时记录规则ID
     */
    private Long createdFromRuleId;

    /**
     * 乐观锁版本号
     */
    private Integer version;
}
