package com.tencent.taskboard.app.common;

import com.tencent.taskboard.client.dto.ErrorCode;
import com.tencent.taskboard.domain.card.PlacementError;
import com.tencent.taskboard.domain.milestone.ActivationError;
import com.tencent.taskboard.domain.task.LifecycleError;
import com.tencent.taskboard.domain.workflow.AutomationError;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ErrorCodesTest {

    @Test
    void testLifecycleErrorsMapOneToOne() {
        for (LifecycleError error : LifecycleError.values()) {
            assertThat(ErrorCodes.of(error)).isEqualTo(ErrorCode.valueOf(error.name()));
        }
    }

    @Test
    void testActivationErrors() {
        assertThat(ErrorCodes.of(ActivationError.NOT_FOUND)).isEqualTo(ErrorCode.NOT_FOUND);
        assertThat(ErrorCodes.of(ActivationError.INVALID_TRANSITION)).isEqualTo(ErrorCode.INVALID_TRANSITION);
        assertThat(ErrorCodes.of(ActivationError.ALREADY_ACTIVE)).isEqualTo(ErrorCode.ALREADY_ACTIVE);
    }

    @Test
    void testPlacementAndAutomationErrors() {
        assertThat(ErrorCodes.of(PlacementError.NOT_FOUND)).isEqualTo(ErrorCode.NOT_FOUND);
        assertThat(ErrorCodes.of(PlacementError.INVALID_PLACEMENT)).isEqualTo(ErrorCode.VALIDATION_ERROR);
        assertThat(ErrorCodes.of(PlacementError.VERSION_CONFLICT)).isEqualTo(ErrorCode.VERSION_CONFLICT);
        assertThat(ErrorCodes.of(AutomationError.INVALID_TEMPLATE)).isEqualTo(ErrorCode.VALIDATION_ERROR);
    }
}
