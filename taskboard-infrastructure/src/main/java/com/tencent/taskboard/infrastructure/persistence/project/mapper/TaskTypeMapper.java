package com.tencent.taskboard.infrastructure.persistence.project.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.tencent.taskboard.infrastructure.persistence.project.entity.TaskTypeDO;
import org.apache.ibatis.annotations.Mapper;

/**
 * TaskTypeMapper - 任务类型Mapper
 *
 * @author taskboard
 */
@Mapper
public interface TaskTypeMapper extends BaseMapper<TaskTypeDO> {
}
