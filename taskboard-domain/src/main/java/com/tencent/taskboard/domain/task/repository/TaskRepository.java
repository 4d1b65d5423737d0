package com.tencent.taskboard.domain.task.repository;

import com.tencent.taskboard.domain.repository.VersionedEntityStore;
import com.tencent.taskboard.domain.task.Task;
import com.tencent.taskboard.domain.task.TaskMutation;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.util.List;
import java.util.Optional;

/**
 * TaskRepository - 任务仓储接口
 *
 * @author taskboard
 */
public interface TaskRepository extends VersionedEntityStore<Task, TaskMutation> {

    /**
     * 根据 ID 查找任务
     *
     * @param taskId 任务 ID
     * @return 任务的 Optional
     */
    Optional<Task> findById(@Positive long taskId);

    /**
     * 新建任务，版本号从 1 开始
     *
     * @param task 待保存的任务，ID 由数据库生成
     * @return 带 ID 的任务
     */
    Task insert(@NotNull Task task);

    /**
     * 查找用户在项目中持有的全部任务并加行锁
     *
     * @param projectId 项目 ID
     * @param userId 用户 ID
     * @return 按任务 ID 升序
     */
    List<Task> lockClaimedBy(@Positive long projectId, @Positive long userId);
}
