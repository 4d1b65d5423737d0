package com.tencent.taskboard.infrastructure.persistence.task.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.tencent.taskboard.infrastructure.persistence.task.entity.TaskDO;
import org.apache.ibatis.annotations.Mapper;

/**
 * TaskMapper - 任务Mapper
 *
 * @author taskboard
 */
@Mapper
public interface TaskMapper extends BaseMapper<TaskDO> {
}
