package com.tencent.taskboard.infrastructure.persistence.milestone.entity;

import lombok.Data;

/**
 * MilestoneProgressDO - 里程碑内容完成度统计
 *
 * @author taskboard
 */
@Data
public class MilestoneProgressDO {

    private Integer cardsTotal;

    private Integer cardsClosed;

    /**
     * 仅统计不属于任何卡片、直接挂在里程碑下的任务
     */
    private Integer tasksTotal;

    private Integer tasksCompleted;
}
