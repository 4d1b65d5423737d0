package com.tencent.taskboard.client.api;

import com.tencent.taskboard.client.dto.MultiResponse;
import com.tencent.taskboard.client.dto.SingleResponse;
import com.tencent.taskboard.client.dto.command.ReleaseAllCmd;
import com.tencent.taskboard.client.dto.command.TaskTransitionCmd;
import com.tencent.taskboard.client.dto.data.TaskDTO;

/**
 * 任务生命周期门面。成功时返回的任务版本号恰好为 expectedVersion + 1。
 */
public interface TaskLifecycleServiceI {

    SingleResponse<TaskDTO> claim(TaskTransitionCmd cmd);

    SingleResponse<TaskDTO> release(TaskTransitionCmd cmd);

    SingleResponse<TaskDTO> complete(TaskTransitionCmd cmd);

    MultiResponse<TaskDTO> releaseAllForUser(ReleaseAllCmd cmd);
}
