package com.tencent.taskboard.client.dto.command;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * TaskTransitionCmd - 任务认领/释放/完成命令
 * <p>
 * 对应 API: POST /api/v1/tasks/{taskId}/claim|release|complete
 * 客户端必须携带读取时的版本号（乐观锁）
 * </p>
 *
 * @author taskboard
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskTransitionCmd {

    @NotNull(message = "任务ID不能为空")
    @Positive(message = "任务ID必须为正数")
    private Long taskId;

    /**
     * 操作人（已通过鉴权的用户）
     */
    @NotNull(message = "操作人不能为空")
    @Positive(message = "操作人ID必须为正数")
    private Long actorId;

    /**
     * 客户端持有的版本号
     */
    @NotNull(message = "版本号不能为空")
    @Min(value = 1, message = "版本号从 1 开始")
    private Integer expectedVersion;
}
