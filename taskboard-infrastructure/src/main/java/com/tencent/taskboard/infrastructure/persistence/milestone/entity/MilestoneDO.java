package com.tencent.taskboard.infrastructure.persistence.milestone.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.Data;

import java.time.Instant;

/**
 * MilestoneDO - 里程碑数据对象
 *
 * @author taskboard
 */
@Data
@TableName("milestones")
public class MilestoneDO {

    @TableId(type = IdType.AUTO)
    private Long id;

    private Long projectId;

    private String name;

    private String description;

    /**
     * ready / active / completed
     */
    private String state;

    /**
     * 看板中的排列顺序
     */
    private Integer position;

    private Long createdBy;

    private Instant createdAt;

    private Instant activatedAt;

    private Instant completedAt;
}
