package com.tencent.taskboard.app.task;

import com.tencent.taskboard.app.common.FacadeTemplate;
import com.tencent.taskboard.app.task.executor.ReleaseAllCmdExe;
import com.tencent.taskboard.app.task.executor.TaskTransitionCmdExe;
import com.tencent.taskboard.client.api.TaskLifecycleServiceI;
import com.tencent.taskboard.client.dto.MultiResponse;
import com.tencent.taskboard.client.dto.SingleResponse;
import com.tencent.taskboard.client.dto.command.ReleaseAllCmd;
import com.tencent.taskboard.client.dto.command.TaskTransitionCmd;
import com.tencent.taskboard.client.dto.data.TaskDTO;
import com.tencent.taskboard.domain.task.TaskTransition;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * TaskLifecycleServiceImpl - 任务生命周期门面实现
 * <p>
 * 领取、释放、完成与批量释放统一经 {@link FacadeTemplate} 校验参数并把领域异常映射为错误码。
 * </p>
 *
 * @author taskboard
 */
@Service
@RequiredArgsConstructor
public class TaskLifecycleServiceImpl implements TaskLifecycleServiceI {

    private final FacadeTemplate facadeTemplate;
    private final TaskTransitionCmdExe taskTransitionCmdExe;
    private final ReleaseAllCmdExe releaseAllCmdExe;

    @Override
    public SingleResponse<TaskDTO> claim(TaskTransitionCmd cmd) {
        return facadeTemplate.single(cmd, () -> taskTransitionCmdExe.execute(TaskTransition.CLAIM, cmd));
    }

    @Override
    public SingleResponse<TaskDTO> release(TaskTransitionCmd cmd) {
        return facadeTemplate.single(cmd, () -> taskTransitionCmdExe.execute(TaskTransition.RELEASE, cmd));
    }

    @Override
    public SingleResponse<TaskDTO> complete(TaskTransitionCmd cmd) {
        return facadeTemplate.single(cmd, () -> taskTransitionCmdExe.execute(TaskTransition.COMPLETE, cmd));
    }

    @Override
    public MultiResponse<TaskDTO> releaseAllForUser(ReleaseAllCmd cmd) {
        return facadeTemplate.multi(cmd, () -> releaseAllCmdExe.execute(cmd));
    }
}
