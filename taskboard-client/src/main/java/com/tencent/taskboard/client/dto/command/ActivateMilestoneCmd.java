package com.tencent.taskboard.client.dto.command;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * ActivateMilestoneCmd - 激活里程碑命令
 * <p>
 * 对应 API: POST /api/v1/projects/{projectId}/milestones/{milestoneId}/activate
 * </p>
 *
 * @author taskboard
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ActivateMilestoneCmd {

    @NotNull(message = "里程碑ID不能为空")
    @Positive
    private Long milestoneId;

    @NotNull(message = "项目ID不能为空")
    @Positive
    private Long projectId;
}
