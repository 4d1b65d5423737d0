package com.tencent.taskboard.infrastructure.persistence.task.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.tencent.taskboard.infrastructure.persistence.task.entity.TaskEventDO;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Mapper;

/**
 * TaskEventMapper - 任务事件Mapper
 *
 * @author taskboard
 */
@Mapper
public interface TaskEventMapper extends BaseMapper<TaskEventDO> {

    /**
     * 组织ID取自项目行，调用方无需携带
     *
     * @return 写入行数，项目不存在时为 0
     */
    @Insert("INSERT INTO task_events (org_id, project_id, task_id, actor_user_id, event_type, created_at) "
        + "SELECT p.org_id, p.id, #{taskId}, #{actorUserId}, #{eventType}, #{createdAt} "
        + "FROM projects p WHERE p.id = #{projectId}")
    int insertForProject(TaskEventDO event);
}
