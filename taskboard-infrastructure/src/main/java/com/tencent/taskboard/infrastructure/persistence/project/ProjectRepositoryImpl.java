package com.tencent.taskboard.infrastructure.persistence.project;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.tencent.taskboard.domain.project.repository.ProjectRepository;
import com.tencent.taskboard.infrastructure.persistence.project.entity.TaskTypeDO;
import com.tencent.taskboard.infrastructure.persistence.project.mapper.ProjectMapper;
import com.tencent.taskboard.infrastructure.persistence.project.mapper.TaskTypeMapper;
import org.springframework.stereotype.Repository;
import org.springframework.validation.annotation.Validated;

/**
 * ProjectRepositoryImpl - 项目仓储实现
 *
 * @author taskboard
 */
@Repository
@Validated
public class ProjectRepositoryImpl implements ProjectRepository {

    private final ProjectMapper projectMapper;
    private final TaskTypeMapper taskTypeMapper;

    public ProjectRepositoryImpl(ProjectMapper projectMapper, TaskTypeMapper taskTypeMapper) {
        this.projectMapper = projectMapper;
        this.taskTypeMapper = taskTypeMapper;
    }

    @Override
    public boolean lockForUpdate(long projectId) {
        return projectMapper.lockById(projectId) != null;
    }

    @Override
    public boolean taskTypeBelongsTo(long typeId, long projectId) {
        Long count = taskTypeMapper.selectCount(
            new LambdaQueryWrapper<TaskTypeDO>()
                .eq(TaskTypeDO::getId, typeId)
                .eq(TaskTypeDO::getProjectId, projectId)
        );
        return count != null && count > 0;
    }
}
