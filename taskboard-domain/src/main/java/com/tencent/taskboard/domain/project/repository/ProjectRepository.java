package com.tencent.taskboard.domain.project.repository;

import jakarta.validation.constraints.Positive;

/**
 * ProjectRepository - 项目仓储接口
 * <p>
 * 项目本身的增删改不在本仓库范围内，这里只提供核心流程需要的锁与归属校验
 * </p>
 *
 * @author taskboard
 */
public interface ProjectRepository {

    /**
     * {@code SELECT ... FOR UPDATE} 锁定项目行，直到当前事务结束
     *
     * @param projectId 项目 ID
     * @return 项目是否存在
     */
    boolean lockForUpdate(@Positive long projectId);

    /**
     * 任务类型是否属于该项目
     */
    boolean taskTypeBelongsTo(@Positive long typeId, @Positive long projectId);
}
