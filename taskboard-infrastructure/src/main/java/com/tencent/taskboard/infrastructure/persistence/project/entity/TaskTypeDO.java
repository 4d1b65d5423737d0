package com.tencent.taskboard.infrastructure.persistence.project.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.Data;

import java.time.Instant;

/**
 * TaskTypeDO - 任务类型数据对象（项目级）
 *
 * @author taskboard
 */
@Data
@TableName("task_types")
public class TaskTypeDO {

    @TableId(type = IdType.AUTO)
    private Long id;

    private Long projectId;

    private String name;

    private Instant createdAt;
}
