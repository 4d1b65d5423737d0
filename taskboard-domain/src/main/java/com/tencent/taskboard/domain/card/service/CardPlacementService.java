package com.tencent.taskboard.domain.card.service;

import com.tencent.taskboard.domain.card.Card;
import com.tencent.taskboard.domain.card.CardMutation;
import com.tencent.taskboard.domain.card.CardPlacement;
import com.tencent.taskboard.domain.card.PlacementError;
import com.tencent.taskboard.domain.card.PlacementException;
import com.tencent.taskboard.domain.card.repository.CardRepository;
import com.tencent.taskboard.domain.milestone.Milestone;
import com.tencent.taskboard.domain.milestone.repository.MilestoneRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * CardPlacementService - 在需求池与里程碑之间移动卡片
 * <p>
 * 规则：
 * <ul>
 *   <li>需求池 -> 里程碑：目标必须属于同一项目且处于 ready</li>
 *   <li>里程碑 -> 里程碑：目标不能是 completed，当前里程碑也不能是 completed</li>
 *   <li>里程碑 -> 需求池：不允许通过编辑路径完成</li>
 * </ul>
 * </p>
 *
 * @author taskboard
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CardPlacementService {

    private final CardRepository cardRepository;
    private final MilestoneRepository milestoneRepository;

    public Card move(long cardId, int expectedVersion, CardPlacement placement) {
        Card card = cardRepository.findById(cardId)
            .orElseThrow(() -> new PlacementException(PlacementError.NOT_FOUND, "Card not found: " + cardId));
        if (placement.getKind() == CardPlacement.Kind.KEEP) {
            return card;
        }
        if (placement.getKind() == CardPlacement.Kind.POOL) {
            if (!card.isInPool()) {
                throw new PlacementException(PlacementError.INVALID_PLACEMENT,
                    "Card " + cardId + " cannot be moved back to the pool");
            }
            return card;
        }

        long targetId = placement.getMilestoneId().orElseThrow();
        if (!card.isInPool() && card.getMilestoneId() == targetId) {
            return card;
        }
        checkTarget(card, targetId);

        Card moved = cardRepository.updateIfVersion(cardId, expectedVersion, new CardMutation(targetId))
            .orElseThrow(() -> classifyConflict(cardId));
        log.info("Moved card [{}] from {} to milestone [{}]", cardId,
            card.isInPool() ? "pool" : "milestone [" + card.getMilestoneId() + "]", targetId);
        return moved;
    }

    private void checkTarget(Card card, long targetId) {
        Milestone target = milestoneRepository.findById(targetId)
            .filter(m -> m.belongsTo(card.getProjectId()))
            .orElseThrow(() -> new PlacementException(PlacementError.INVALID_PLACEMENT,
                "Milestone " + targetId + " not found in project " + card.getProjectId()));

        if (card.isInPool()) {
            if (!target.isReady()) {
                throw new PlacementException(PlacementError.INVALID_PLACEMENT,
                    "Cards can only be planned into a ready milestone, milestone " + targetId
                        + " is " + target.getState().getCode());
            }
            return;
        }

        if (target.isCompleted()) {
            throw new PlacementException(PlacementError.INVALID_PLACEMENT,
                "Milestone " + targetId + " is completed");
        }
        boolean sourceCompleted = milestoneRepository.findById(card.getMilestoneId())
            .map(Milestone::isCompleted)
            .orElse(false);
        if (sourceCompleted) {
            throw new PlacementException(PlacementError.INVALID_PLACEMENT,
                "Card " + card.getId() + " belongs to a completed milestone");
        }
    }

    private PlacementException classifyConflict(long cardId) {
        if (cardRepository.findById(cardId).isEmpty()) {
            return new PlacementException(PlacementError.NOT_FOUND, "Card not found: " + cardId);
        }
        return new PlacementException(PlacementError.VERSION_CONFLICT,
            "Card " + cardId + " was modified concurrently");
    }
}
