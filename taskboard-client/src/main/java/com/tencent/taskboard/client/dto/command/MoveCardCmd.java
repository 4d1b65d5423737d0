package com.tencent.taskboard.client.dto.command;

import com.tencent.taskboard.client.dto.FieldPatch;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * MoveCardCmd - 调整卡片所属里程碑
 * <p>
 * milestoneId 未提供表示不变，显式置空表示移回需求池（编辑路径不允许）。
 * </p>
 *
 * @author taskboard
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MoveCardCmd {

    @NotNull(message = "卡片ID不能为空")
    @Positive
    private Long cardId;

    @NotNull(message = "版本号不能为空")
    @Min(1)
    private Integer expectedVersion;

    @NotNull
    @Builder.Default
    private FieldPatch<Long> milestoneId = FieldPatch.absent();
}
