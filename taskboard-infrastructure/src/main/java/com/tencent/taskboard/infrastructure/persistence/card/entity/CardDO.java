package com.tencent.taskboard.infrastructure.persistence.card.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.Data;

import java.time.Instant;

/**
 * CardDO - 卡片数据对象
 *
 * @author taskboard
 */
@Data
@TableName("cards")
public class CardDO {

    @TableId(type = IdType.AUTO)
    private Long id;

    private Long projectId;

    /**
     * null 表示在需求池
     */
    private Long milestoneId;

    private String title;

    private String description;

    private Integer version;

    private Long createdBy;

    private Instant createdAt;
}
