package com.tencent.taskboard.domain.workflow;

import lombok.Value;

/**
 * RuleTarget - 规则监听的目标：资源类型、目标状态以及可选的任务类型过滤
 *
 * @author taskboard
 */
@Value
public class RuleTarget {

    ResourceType resourceType;

    /**
     * 仅对任务事件生效，为空表示不过滤
     */
    Long taskTypeId;

    String toState;

    public boolean matches(TransitionEvent event) {
        if (resourceType != event.getResourceType() || !toState.equals(event.getToState())) {
            return false;
        }
        return !event.isTaskEvent() || taskTypeId == null || taskTypeId.equals(event.getTaskTypeId());
    }
}
