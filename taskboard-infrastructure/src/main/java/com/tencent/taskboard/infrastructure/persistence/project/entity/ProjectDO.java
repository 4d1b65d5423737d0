package com.tencent.taskboard.infrastructure.persistence.project.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.Data;

import java.time.Instant;

/**
 * ProjectDO - 项目数据对象
 *
 * @author taskboard
 */
@Data
@TableName("projects")
public class ProjectDO {

    @TableId(type = IdType.AUTO)
    private Long id;

    private Long orgId;

    private String name;

    private Instant createdAt;
}
