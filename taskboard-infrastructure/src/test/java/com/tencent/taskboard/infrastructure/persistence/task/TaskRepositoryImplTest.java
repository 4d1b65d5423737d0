package com.tencent.taskboard.infrastructure.persistence.task;

import com.tencent.taskboard.domain.task.Task;
import com.tencent.taskboard.domain.task.TaskEvent;
import com.tencent.taskboard.domain.task.TaskMutation;
import com.tencent.taskboard.domain.task.TaskStatus;
import com.tencent.taskboard.domain.task.repository.TaskEventRepository;
import com.tencent.taskboard.domain.task.repository.TaskRepository;
import com.tencent.taskboard.infrastructure.PersistenceFixture;
import jakarta.validation.ConstraintViolationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * TaskRepositoryImpl 集成测试
 */
@SpringBootTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.ANY)
@ActiveProfiles("test")
@Transactional
class TaskRepositoryImplTest {

    @Autowired
    private TaskRepository taskRepository;

    @Autowired
    private TaskEventRepository taskEventRepository;

    @Autowired
    private PersistenceFixture fixture;

    private long projectId;
    private long typeId;
    private long alice;
    private long bob;

    @BeforeEach
    void setUp() {
        long orgId = fixture.organization();
        alice = fixture.user(orgId, "alice@example.com");
        bob = fixture.user(orgId, "bob@example.com");
        projectId = fixture.project(orgId);
        typeId = fixture.taskType(projectId);
    }

    @Test
    void testInsertStartsAtVersionOne() {
        Task saved = taskRepository.insert(Task.builder()
            .projectId(projectId)
            .typeId(typeId)
            .title("write docs")
            .priority(2)
            .createdBy(alice)
            .build());

        assertThat(saved.getId()).isNotNull();
        Optional<Task> found = taskRepository.findById(saved.getId());
        assertThat(found).isPresent();
        assertThat(found.get().getVersion()).isEqualTo(1);
        assertThat(found.get().getStatus()).isEqualTo(TaskStatus.AVAILABLE);
        assertThat(found.get().getTitle()).isEqualTo("write docs");
        assertThat(found.get().getCreatedAt()).isNotNull();
    }

    @Test
    void testUpdateIfVersionAppliesMutationAndBumpsVersion() {
        long taskId = fixture.task(projectId, typeId, null, null, alice);
        Instant now = Instant.now().truncatedTo(ChronoUnit.MILLIS);

        Optional<Task> claimed = taskRepository.updateIfVersion(taskId, 1, TaskMutation.builder()
            .status(TaskStatus.CLAIMED)
            .claimedBy(bob)
            .claimedAt(now)
            .build());

        assertThat(claimed).isPresent();
        assertThat(claimed.get().getVersion()).isEqualTo(2);
        assertThat(claimed.get().getStatus()).isEqualTo(TaskStatus.CLAIMED);
        assertThat(claimed.get().getClaimedBy()).isEqualTo(bob);
        assertThat(claimed.get().getClaimedAt()).isEqualTo(now);
    }

    @Test
    void testUpdateIfVersionClearsNullableColumns() {
        long taskId = fixture.task(projectId, typeId, null, null, alice, "claimed", bob);

        Optional<Task> released = taskRepository.updateIfVersion(taskId, 1, TaskMutation.builder()
            .status(TaskStatus.AVAILABLE)
            .build());

        assertThat(released).isPresent();
        assertThat(released.get().getClaimedBy()).isNull();
        assertThat(released.get().getClaimedAt()).isNull();
        assertThat(released.get().getVersion()).isEqualTo(2);
    }

    @Test
    void testStaleVersionWritesNothing() {
        long taskId = fixture.task(projectId, typeId, null, null, alice);
        TaskMutation claim = TaskMutation.builder()
            .status(TaskStatus.CLAIMED)
            .claimedBy(bob)
            .claimedAt(Instant.now())
            .build();

        assertThat(taskRepository.updateIfVersion(taskId, 1, claim)).isPresent();
        assertThat(taskRepository.updateIfVersion(taskId, 1, claim)).isEmpty();
        assertThat(taskRepository.findById(taskId).get().getVersion()).isEqualTo(2);
    }

    @Test
    void testUpdateIfVersionOnMissingRowIsEmpty() {
        Optional<Task> result = taskRepository.updateIfVersion(987654L, 1, TaskMutation.builder()
            .status(TaskStatus.AVAILABLE)
            .build());

        assertThat(result).isEmpty();
    }

    @Test
    void testRejectsNonPositiveIdentifiers() {
        assertThatThrownBy(() -> taskRepository.findById(0L))
            .isInstanceOf(ConstraintViolationException.class);
        assertThatThrownBy(() -> taskRepository.lockClaimedBy(projectId, -1L))
            .isInstanceOf(ConstraintViolationException.class);
    }

    @Test
    void testLockClaimedByReturnsOnlyUsersClaimsInIdOrder() {
        long second = fixture.task(projectId, typeId, null, null, alice, "claimed", bob);
        long first = fixture.task(projectId, typeId, null, null, alice, "claimed", bob);
        fixture.task(projectId, typeId, null, null, alice, "claimed", alice);
        fixture.task(projectId, typeId, null, null, alice);

        List<Task> locked = taskRepository.lockClaimedBy(projectId, bob);

        assertThat(locked).extracting(Task::getId)
            .containsExactly(Math.min(first, second), Math.max(first, second));
    }

    @Test
    void testAppendEventResolvesOrganization() {
        long taskId = fixture.task(projectId, typeId, null, null, alice, "claimed", bob);

        taskEventRepository.append(TaskEvent.builder()
            .projectId(projectId)
            .taskId(taskId)
            .actorUserId(bob)
            .eventType("task_claimed")
            .createdAt(Instant.now())
            .build());

        assertThat(fixture.count("task_events")).isEqualTo(1);
    }
}
