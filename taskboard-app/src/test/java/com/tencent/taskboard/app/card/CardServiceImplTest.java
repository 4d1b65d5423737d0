package com.tencent.taskboard.app.card;

import com.tencent.taskboard.app.BoardFixture;
import com.tencent.taskboard.client.api.CardServiceI;
import com.tencent.taskboard.client.dto.ErrorCode;
import com.tencent.taskboard.client.dto.FieldPatch;
import com.tencent.taskboard.client.dto.SingleResponse;
import com.tencent.taskboard.client.dto.command.MoveCardCmd;
import com.tencent.taskboard.client.dto.data.CardDTO;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * 卡片编辑路径的里程碑调整
 */
@SpringBootTest
@ActiveProfiles("test")
class CardServiceImplTest {

    @Autowired
    private CardServiceI cardService;

    @Autowired
    private BoardFixture fixture;

    private long owner;
    private long projectId;
    private long typeId;

    @BeforeEach
    void setUp() {
        long orgId = fixture.organization();
        owner = fixture.user(orgId);
        projectId = fixture.project(orgId);
        typeId = fixture.taskType(projectId);
    }

    @Test
    void testPlanPoolCardIntoReadyMilestone() {
        long milestoneId = fixture.milestone(projectId, "ready", owner);
        long cardId = fixture.card(projectId, null, owner);
        fixture.task(projectId, typeId, cardId, null, owner);

        SingleResponse<CardDTO> response = cardService.moveCard(move(cardId, 1, FieldPatch.of(milestoneId)));

        assertThat(response.isSuccess()).isTrue();
        assertThat(response.getData().getMilestoneId()).isEqualTo(milestoneId);
        assertThat(response.getData().getVersion()).isEqualTo(2);
        assertThat(response.getData().getState()).isEqualTo("pending");
        assertThat(response.getData().getTaskCount()).isEqualTo(1);
    }

    @Test
    void testAbsentMilestoneLeavesCardUnchanged() {
        long milestoneId = fixture.milestone(projectId, "ready", owner);
        long cardId = fixture.card(projectId, milestoneId, owner);

        SingleResponse<CardDTO> response = cardService.moveCard(move(cardId, 1, FieldPatch.absent()));

        assertThat(response.isSuccess()).isTrue();
        assertThat(response.getData().getMilestoneId()).isEqualTo(milestoneId);
        assertThat(response.getData().getVersion()).isEqualTo(1);
    }

    @Test
    void testClearingMilestoneIsRejected() {
        long milestoneId = fixture.milestone(projectId, "active", owner);
        long cardId = fixture.card(projectId, milestoneId, owner);

        SingleResponse<CardDTO> response = cardService.moveCard(move(cardId, 1, FieldPatch.cleared()));

        assertThat(response.errorCode()).isEqualTo(ErrorCode.VALIDATION_ERROR);
    }

    @Test
    void testMoveBetweenOpenMilestones() {
        long active = fixture.milestone(projectId, "active", owner);
        long ready = fixture.milestone(projectId, "ready", owner);
        long cardId = fixture.card(projectId, active, owner);

        SingleResponse<CardDTO> response = cardService.moveCard(move(cardId, 1, FieldPatch.of(ready)));

        assertThat(response.isSuccess()).isTrue();
        assertThat(response.getData().getMilestoneId()).isEqualTo(ready);
    }

    @Test
    void testPlacementErrors() {
        long completed = fixture.milestone(projectId, "completed", owner);
        long active = fixture.milestone(projectId, "active", owner);
        long poolCard = fixture.card(projectId, null, owner);

        assertThat(cardService.moveCard(move(poolCard, 1, FieldPatch.of(active))).errorCode())
            .isEqualTo(ErrorCode.VALIDATION_ERROR);
        assertThat(cardService.moveCard(move(poolCard, 1, FieldPatch.of(completed))).errorCode())
            .isEqualTo(ErrorCode.VALIDATION_ERROR);
        assertThat(cardService.moveCard(move(Long.MAX_VALUE, 1, FieldPatch.absent())).errorCode())
            .isEqualTo(ErrorCode.NOT_FOUND);
        assertThat(cardService.moveCard(move(poolCard, 0, FieldPatch.absent())).errorCode())
            .isEqualTo(ErrorCode.VALIDATION_ERROR);
    }

    @Test
    void testStaleVersionIsVersionConflict() {
        long first = fixture.milestone(projectId, "ready", owner);
        long second = fixture.milestone(projectId, "ready", owner);
        long cardId = fixture.card(projectId, null, owner);
        cardService.moveCard(move(cardId, 1, FieldPatch.of(first)));

        SingleResponse<CardDTO> response = cardService.moveCard(move(cardId, 1, FieldPatch.of(second)));

        assertThat(response.errorCode()).isEqualTo(ErrorCode.VERSION_CONFLICT);
    }

    private MoveCardCmd move(long cardId, int expectedVersion, FieldPatch<Long> milestoneId) {
        return MoveCardCmd.builder()
            .cardId(cardId)
            .expectedVersion(expectedVersion)
            .milestoneId(milestoneId)
            .build();
    }
}
