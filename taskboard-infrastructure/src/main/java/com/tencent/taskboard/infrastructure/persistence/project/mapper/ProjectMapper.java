package com.tencent.taskboard.infrastructure.persistence.project.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.tencent.taskboard.infrastructure.persistence.project.entity.ProjectDO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

/**
 * ProjectMapper - 项目Mapper
 *
 * @author taskboard
 */
@Mapper
public interface ProjectMapper extends BaseMapper<ProjectDO> {

    /**
     * 行锁持有到事务结束
     */
    @Select("SELECT id FROM projects WHERE id = #{projectId} FOR UPDATE")
    Long lockById(@Param("projectId") long projectId);
}
