package com.tencent.taskboard.domain.repository;

import com.tencent.taskboard.domain.card.Card;
import com.tencent.taskboard.domain.card.CardState;
import com.tencent.taskboard.domain.milestone.ActivationWrite;
import com.tencent.taskboard.domain.milestone.Milestone;
import com.tencent.taskboard.domain.milestone.MilestoneProgress;
import com.tencent.taskboard.domain.milestone.MilestoneState;
import com.tencent.taskboard.domain.milestone.repository.MilestoneRepository;
import com.tencent.taskboard.domain.task.Task;
import com.tencent.taskboard.domain.task.TaskStatus;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

public class InMemoryMilestoneRepository implements MilestoneRepository {

    private final InMemoryBoard board;
    private final InMemoryCardRepository cardRepository;

    public InMemoryMilestoneRepository(InMemoryBoard board) {
        this.board = board;
        this.cardRepository = new InMemoryCardRepository(board);
    }

    @Override
    public Optional<Milestone> findById(long milestoneId) {
        return Optional.ofNullable(board.milestones.get(milestoneId)).map(m -> m.toBuilder().build());
    }

    @Override
    public Optional<Milestone> findEffectiveForTask(long taskId) {
        Task task = board.tasks.get(taskId);
        if (task == null) {
            return Optional.empty();
        }
        Long milestoneId = effectiveMilestoneId(task);
        return milestoneId == null ? Optional.empty() : findById(milestoneId);
    }

    @Override
    public boolean lockForUpdate(long milestoneId) {
        return board.milestones.containsKey(milestoneId);
    }

    @Override
    public boolean existsOtherActive(long projectId, long milestoneId) {
        return board.milestones.values().stream()
            .anyMatch(m -> m.getProjectId() == projectId && m.getId() != milestoneId && m.isActive());
    }

    @Override
    public synchronized ActivationWrite markActive(long milestoneId, long projectId, Instant now) {
        Milestone current = board.milestones.get(milestoneId);
        if (current == null || current.getProjectId() != projectId || !current.isReady()) {
            return ActivationWrite.NOT_MATCHED;
        }
        if (existsOtherActive(projectId, milestoneId)) {
            return ActivationWrite.ACTIVE_SLOT_TAKEN;
        }
        board.milestones.put(milestoneId, current.toBuilder()
            .state(MilestoneState.ACTIVE)
            .activatedAt(now)
            .build());
        return ActivationWrite.ACTIVATED;
    }

    @Override
    public synchronized boolean markCompleted(long milestoneId, Instant now) {
        Milestone current = board.milestones.get(milestoneId);
        if (current == null || !current.isActive()) {
            return false;
        }
        board.milestones.put(milestoneId, current.toBuilder()
            .state(MilestoneState.COMPLETED)
            .completedAt(now)
            .build());
        return true;
    }

    @Override
    public int countCards(long milestoneId) {
        return cardsIn(milestoneId).size();
    }

    @Override
    public int countTasks(long milestoneId) {
        return (int) board.tasks.values().stream()
            .filter(t -> Objects.equals(effectiveMilestoneId(t), milestoneId))
            .count();
    }

    @Override
    public MilestoneProgress progressOf(long milestoneId) {
        List<Card> cards = cardsIn(milestoneId);
        int cardsClosed = (int) cards.stream()
            .map(c -> cardRepository.findById(c.getId()).orElseThrow())
            .filter(c -> c.getState() == CardState.CLOSED)
            .count();
        List<Task> loose = board.tasks.values().stream()
            .filter(t -> t.getCardId() == null && Objects.equals(t.getMilestoneId(), milestoneId))
            .collect(Collectors.toList());
        int looseCompleted = (int) loose.stream().filter(t -> t.getStatus() == TaskStatus.COMPLETED).count();
        return new MilestoneProgress(cards.size(), cardsClosed, loose.size(), looseCompleted);
    }

    private List<Card> cardsIn(long milestoneId) {
        return board.cards.values().stream()
            .filter(c -> Objects.equals(c.getMilestoneId(), milestoneId))
            .collect(Collectors.toList());
    }

    private Long effectiveMilestoneId(Task task) {
        if (task.getMilestoneId() != null) {
            return task.getMilestoneId();
        }
        if (task.getCardId() == null) {
            return null;
        }
        Card card = board.cards.get(task.getCardId());
        return card == null ? null : card.getMilestoneId();
    }
}
