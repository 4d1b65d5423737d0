package com.tencent.taskboard.infrastructure.persistence.task.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.Data;

import java.time.Instant;

/**
 * TaskEventDO - 任务事件数据对象（只追加）
 *
 * @author taskboard
 */
@Data
@TableName("task_events")
public class TaskEventDO {

    @TableId(type = IdType.AUTO)
    private Long id;

    private Long orgId;

    private Long projectId;

    private Long taskId;

    private Long actorUserId;

    private String eventType;

    private Instant createdAt;
}
