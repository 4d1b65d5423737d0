package com.tencent.taskboard.domain.task.repository;

import com.tencent.taskboard.domain.task.TaskEvent;
import jakarta.validation.constraints.NotNull;

/**
 * TaskEventRepository - 任务审计事件仓储，只追加
 *
 * @author taskboard
 */
public interface TaskEventRepository {

    void append(@NotNull TaskEvent event);
}
