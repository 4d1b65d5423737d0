package com.tencent.taskboard.domain.card.repository;

import com.tencent.taskboard.domain.card.Card;
import com.tencent.taskboard.domain.card.CardMutation;
import com.tencent.taskboard.domain.repository.VersionedEntityStore;
import jakarta.validation.constraints.Positive;

import java.util.Optional;

/**
 * CardRepository - 卡片仓储接口
 *
 * @author taskboard
 */
public interface CardRepository extends VersionedEntityStore<Card, CardMutation> {

    /**
     * 根据 ID 查找卡片，同时带出任务计数
     *
     * @param cardId 卡片 ID
     * @return 卡片的 Optional
     */
    Optional<Card> findById(@Positive long cardId);

    /**
     * {@code SELECT ... FOR UPDATE} 锁定卡片行，直到当前事务结束
     *
     * @param cardId 卡片 ID
     * @return 卡片是否存在
     */
    boolean lockForUpdate(@Positive long cardId);
}
