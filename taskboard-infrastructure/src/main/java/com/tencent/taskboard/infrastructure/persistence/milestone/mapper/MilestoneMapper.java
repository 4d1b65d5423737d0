package com.tencent.taskboard.infrastructure.persistence.milestone.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.tencent.taskboard.infrastructure.persistence.milestone.entity.MilestoneDO;
import com.tencent.taskboard.infrastructure.persistence.milestone.entity.MilestoneProgressDO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

/**
 * MilestoneMapper - 里程碑Mapper
 *
 * @author taskboard
 */
@Mapper
public interface MilestoneMapper extends BaseMapper<MilestoneDO> {

    /**
     * 任务自身的 milestone_id 优先，否则取卡片的 milestone_id
     */
    @Select("SELECT m.* FROM tasks t "
        + "LEFT JOIN cards c ON c.id = t.card_id "
        + "JOIN milestones m ON m.id = COALESCE(t.milestone_id, c.milestone_id) "
        + "WHERE t.id = #{taskId}")
    MilestoneDO selectEffectiveForTask(@Param("taskId") long taskId);

    @Select("SELECT COUNT(*) FROM cards WHERE milestone_id = #{milestoneId}")
    int countCards(@Param("milestoneId") long milestoneId);

    @Select("SELECT COUNT(*) FROM tasks t "
        + "LEFT JOIN cards c ON c.id = t.card_id "
        + "WHERE COALESCE(t.milestone_id, c.milestone_id) = #{milestoneId}")
    int countTasks(@Param("milestoneId") long milestoneId);

    /**
     * 卡片关闭：至少一个任务且全部完成
     */
    @Select("SELECT "
        + "(SELECT COUNT(*) FROM cards c WHERE c.milestone_id = #{milestoneId}) AS cards_total, "
        + "(SELECT COUNT(*) FROM cards c WHERE c.milestone_id = #{milestoneId} "
        + "   AND EXISTS (SELECT 1 FROM tasks t WHERE t.card_id = c.id) "
        + "   AND NOT EXISTS (SELECT 1 FROM tasks t WHERE t.card_id = c.id AND t.status <> 'completed')) AS cards_closed, "
        + "(SELECT COUNT(*) FROM tasks t WHERE t.card_id IS NULL AND t.milestone_id = #{milestoneId}) AS tasks_total, "
        + "(SELECT COUNT(*) FROM tasks t WHERE t.card_id IS NULL AND t.milestone_id = #{milestoneId} "
        + "   AND t.status = 'completed') AS tasks_completed")
    MilestoneProgressDO selectProgress(@Param("milestoneId") long milestoneId);

    @Select("SELECT id FROM milestones WHERE id = #{milestoneId} FOR UPDATE")
    Long lockById(@Param("milestoneId") long milestoneId);
}
