package com.tencent.taskboard.app.task.executor;

import com.tencent.taskboard.app.assembler.TaskAssembler;
import com.tencent.taskboard.client.dto.command.TaskTransitionCmd;
import com.tencent.taskboard.client.dto.data.TaskDTO;
import com.tencent.taskboard.domain.task.TaskTransition;
import com.tencent.taskboard.domain.task.TaskTransitionResult;
import com.tencent.taskboard.domain.task.service.TaskLifecycleService;
import com.tencent.taskboard.domain.task.service.TaskTransitionDispatcher;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * TaskTransitionCmdExe - 认领/释放/完成
 * <p>
 * 条件写与其触发的自动化在同一事务内提交或回滚
 * </p>
 *
 * @author taskboard
 */
@Component
@RequiredArgsConstructor
public class TaskTransitionCmdExe {

    private final TaskLifecycleService taskLifecycleService;
    private final TaskTransitionDispatcher taskTransitionDispatcher;

    @Transactional(rollbackFor = Exception.class)
    public TaskDTO execute(TaskTransition transition, TaskTransitionCmd cmd) {
        TaskTransitionResult result = taskLifecycleService.transition(
            transition, cmd.getTaskId(), cmd.getActorId(), cmd.getExpectedVersion());
        taskTransitionDispatcher.dispatch(result);
        return TaskAssembler.toDTO(result.getTask());
    }
}
