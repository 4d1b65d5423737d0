package com.tencent.taskboard.infrastructure.persistence.card;

import com.baomidou.mybatisplus.core.conditions.update.LambdaUpdateWrapper;
import com.tencent.taskboard.domain.card.Card;
import com.tencent.taskboard.domain.card.CardMutation;
import com.tencent.taskboard.domain.card.repository.CardRepository;
import com.tencent.taskboard.infrastructure.persistence.card.converter.CardConverter;
import com.tencent.taskboard.infrastructure.persistence.card.entity.CardDO;
import com.tencent.taskboard.infrastructure.persistence.card.mapper.CardMapper;
import org.springframework.stereotype.Repository;
import org.springframework.validation.annotation.Validated;

import java.util.Optional;

/**
 * CardRepositoryImpl - 卡片仓储实现
 *
 * @author taskboard
 */
@Repository
@Validated
public class CardRepositoryImpl implements CardRepository {

    private final CardMapper cardMapper;

    public CardRepositoryImpl(CardMapper cardMapper) {
        this.cardMapper = cardMapper;
    }

    @Override
    public Optional<Card> findById(long cardId) {
        return Optional.ofNullable(CardConverter.toDomain(cardMapper.selectViewById(cardId)));
    }

    @Override
    public boolean lockForUpdate(long cardId) {
        return cardMapper.lockById(cardId) != null;
    }

    @Override
    public Optional<Card> updateIfVersion(long id, int expectedVersion, CardMutation mutation) {
        int updated = cardMapper.update(null, new LambdaUpdateWrapper<CardDO>()
            .set(CardDO::getMilestoneId, mutation.getMilestoneId(), "jdbcType=BIGINT")
            .setSql("version = version + 1")
            .eq(CardDO::getId, id)
            .eq(CardDO::getVersion, expectedVersion));
        if (updated == 0) {
            return Optional.empty();
        }
        return findById(id);
    }
}
