package com.tencent.taskboard.infrastructure.persistence.card.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.tencent.taskboard.infrastructure.persistence.card.entity.CardDO;
import com.tencent.taskboard.infrastructure.persistence.card.entity.CardViewDO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

/**
 * CardMapper - 卡片Mapper
 *
 * @author taskboard
 */
@Mapper
public interface CardMapper extends BaseMapper<CardDO> {

    @Select("SELECT c.id, c.project_id, c.milestone_id, c.title, c.description, c.version, "
        + "c.created_by, c.created_at, "
        + "(SELECT COUNT(*) FROM tasks t WHERE t.card_id = c.id) AS task_count, "
        + "(SELECT COUNT(*) FROM tasks t WHERE t.card_id = c.id AND t.status = 'available') AS available_count, "
        + "(SELECT COUNT(*) FROM tasks t WHERE t.card_id = c.id AND t.status = 'completed') AS completed_count "
        + "FROM cards c WHERE c.id = #{cardId}")
    CardViewDO selectViewById(@Param("cardId") long cardId);

    /**
     * 行锁持有到事务结束
     */
    @Select("SELECT id FROM cards WHERE id = #{cardId} FOR UPDATE")
    Long lockById(@Param("cardId") long cardId);
}
