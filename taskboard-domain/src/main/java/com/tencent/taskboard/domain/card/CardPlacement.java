package com.tencent.taskboard.domain.card;

import java.util.Optional;

/**
 * CardPlacement - 卡片位置变更请求：保持不变、移回需求池或移到某个里程碑
 *
 * @author taskboard
 */
public final class CardPlacement {

    private static final CardPlacement KEEP = new CardPlacement(Kind.KEEP, null);
    private static final CardPlacement POOL = new CardPlacement(Kind.POOL, null);

    public enum Kind {
        KEEP,
        POOL,
        MILESTONE
    }

    private final Kind kind;
    private final Long milestoneId;

    private CardPlacement(Kind kind, Long milestoneId) {
        this.kind = kind;
        this.milestoneId = milestoneId;
    }

    public static CardPlacement keep() {
        return KEEP;
    }

    public static CardPlacement pool() {
        return POOL;
    }

    public static CardPlacement milestone(long milestoneId) {
        return new CardPlacement(Kind.MILESTONE, milestoneId);
    }

    public Kind getKind() {
        return kind;
    }

    public Optional<Long> getMilestoneId() {
        return Optional.ofNullable(milestoneId);
    }

    @Override
    public String toString() {
        return kind == Kind.MILESTONE ? "milestone(" + milestoneId + ")" : kind.name().toLowerCase();
    }
}
