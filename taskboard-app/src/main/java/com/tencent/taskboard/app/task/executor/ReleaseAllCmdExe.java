package com.tencent.taskboard.app.task.executor;

import com.tencent.taskboard.app.assembler.TaskAssembler;
import com.tencent.taskboard.client.dto.command.ReleaseAllCmd;
import com.tencent.taskboard.client.dto.data.TaskDTO;
import com.tencent.taskboard.domain.task.TaskTransitionResult;
import com.tencent.taskboard.domain.task.service.TaskLifecycleService;
import com.tencent.taskboard.domain.task.service.TaskTransitionDispatcher;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.stream.Collectors;

/**
 * ReleaseAllCmdExe - 成员移出项目时释放其全部任务
 *
 * @author taskboard
 */
@Component
@RequiredArgsConstructor
public class ReleaseAllCmdExe {

    private final TaskLifecycleService taskLifecycleService;
    private final TaskTransitionDispatcher taskTransitionDispatcher;

    @Transactional(rollbackFor = Exception.class)
    public List<TaskDTO> execute(ReleaseAllCmd cmd) {
        List<TaskTransitionResult> results = taskLifecycleService.releaseAllForUser(
            cmd.getProjectId(), cmd.getUserId(), taskTransitionDispatcher::dispatch);
        return results.stream()
            .map(TaskTransitionResult::getTask)
            .map(TaskAssembler::toDTO)
            .collect(Collectors.toList());
    }
}
