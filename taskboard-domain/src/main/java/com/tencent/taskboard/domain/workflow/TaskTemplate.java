package com.tencent.taskboard.domain.workflow;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * TaskTemplate - 任务模板，规则命中时据此生成任务
 *
 * @author taskboard
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskTemplate {

    private Long id;

    private Long projectId;

    private String name;

    private String description;

    private Long typeId;

    private Integer priority;

    /**
     * 在规则中的执行顺序，相同时按模板 ID
     */
    private Integer executionOrder;
}
