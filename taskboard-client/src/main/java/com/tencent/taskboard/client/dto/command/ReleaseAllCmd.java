package com.tencent.taskboard.client.dto.command;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * ReleaseAllCmd - 释放某成员在项目中认领的全部任务
 * <p>
 * 由成员移除流程触发，属于系统级联操作，不视为用户直接触发。
 * </p>
 *
 * @author taskboard
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReleaseAllCmd {

    @NotNull(message = "项目ID不能为空")
    @Positive
    private Long projectId;

    @NotNull(message = "用户ID不能为空")
    @Positive
    private Long userId;
}
