package com.tencent.taskboard.infrastructure.persistence.task;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.core.conditions.update.LambdaUpdateWrapper;
import com.tencent.taskboard.domain.task.Task;
import com.tencent.taskboard.domain.task.TaskMutation;
import com.tencent.taskboard.domain.task.TaskStatus;
import com.tencent.taskboard.domain.task.repository.TaskRepository;
import com.tencent.taskboard.infrastructure.persistence.task.converter.TaskConverter;
import com.tencent.taskboard.infrastructure.persistence.task.entity.TaskDO;
import com.tencent.taskboard.infrastructure.persistence.task.mapper.TaskMapper;
import org.springframework.stereotype.Repository;
import org.springframework.validation.annotation.Validated;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * TaskRepositoryImpl - 任务仓储实现
 * <p>
 * 使用 @Validated 注解启用方法参数校验
 * </p>
 *
 * @author taskboard
 */
@Repository
@Validated
public class TaskRepositoryImpl implements TaskRepository {

    private final TaskMapper taskMapper;

    public TaskRepositoryImpl(TaskMapper taskMapper) {
        this.taskMapper = taskMapper;
    }

    @Override
    public Optional<Task> findById(long taskId) {
        return Optional.ofNullable(TaskConverter.toDomain(taskMapper.selectById(taskId)));
    }

    @Override
    public Task insert(Task task) {
        TaskDO taskDO = TaskConverter.toDataObject(task);
        taskDO.setId(null);
        taskDO.setVersion(1);
        if (taskDO.getStatus() == null) {
            taskDO.setStatus(TaskStatus.AVAILABLE.getCode());
        }
        if (taskDO.getCreatedAt() == null) {
            taskDO.setCreatedAt(Instant.now());
        }
        taskMapper.insert(taskDO);
        return TaskConverter.toDomain(taskDO);
    }

    @Override
    public Optional<Task> updateIfVersion(long id, int expectedVersion, TaskMutation mutation) {
        // 单条条件写：版本不匹配、行不存在都表现为 0 行
        int updated = taskMapper.update(null, new LambdaUpdateWrapper<TaskDO>()
            .set(TaskDO::getStatus, mutation.getStatus().getCode())
            .set(TaskDO::getClaimedBy, mutation.getClaimedBy(), "jdbcType=BIGINT")
            .set(TaskDO::getClaimedAt, mutation.getClaimedAt(), "jdbcType=TIMESTAMP")
            .set(TaskDO::getCompletedAt, mutation.getCompletedAt(), "jdbcType=TIMESTAMP")
            .setSql("version = version + 1")
            .eq(TaskDO::getId, id)
            .eq(TaskDO::getVersion, expectedVersion));
        if (updated == 0) {
            return Optional.empty();
        }
        return findById(id);
    }

    @Override
    public List<Task> lockClaimedBy(long projectId, long userId) {
        List<TaskDO> taskDOs = taskMapper.selectList(
            new LambdaQueryWrapper<TaskDO>()
                .eq(TaskDO::getProjectId, projectId)
                .eq(TaskDO::getClaimedBy, userId)
                .eq(TaskDO::getStatus, TaskStatus.CLAIMED.getCode())
                .orderByAsc(TaskDO::getId)
                .last("FOR UPDATE")
        );
        return taskDOs.stream()
            .map(TaskConverter::toDomain)
            .collect(Collectors.toList());
    }
}
