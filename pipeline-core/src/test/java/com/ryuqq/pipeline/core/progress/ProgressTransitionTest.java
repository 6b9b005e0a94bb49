package com.ryuqq.pipeline.core.progress;

import org.junit.jupiter.api.Test;

import static com.ryuqq.pipeline.core.progress.ProgressKind.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * ProgressTransition 테스트.
 *
 * <ul>
 *   <li>첫 이벤트는 START만 허용</li>
 *   <li>START/PROGRESS 이후 PROGRESS 또는 종료 이벤트 허용</li>
 *   <li>종료 이벤트 이후 어떤 이벤트도 불가</li>
 * </ul>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
class ProgressTransitionTest {

    private static final StepKey KEY = new StepKey("draft-content", 1);

    // ========== 정상 전이 테스트 ==========

    @Test
    void validate_NothingToStart_Succeeds() {
        assertDoesNotThrow(() -> ProgressTransition.validate(KEY, null, START));
    }

    @Test
    void validate_StartToProgress_Succeeds() {
        assertDoesNotThrow(() -> ProgressTransition.validate(KEY, START, PROGRESS));
    }

    @Test
    void validate_ProgressToProgress_Succeeds() {
        assertDoesNotThrow(() -> ProgressTransition.validate(KEY, PROGRESS, PROGRESS));
    }

    @Test
    void isAllowed_StartOrProgressToEveryTerminal_ReturnsTrue() {
        for (ProgressKind last : new ProgressKind[]{START, PROGRESS}) {
            assertTrue(ProgressTransition.isAllowed(last, COMPLETE));
            assertTrue(ProgressTransition.isAllowed(last, ERROR));
            assertTrue(ProgressTransition.isAllowed(last, CANCELLED));
        }
    }

    // ========== 비정상 전이 테스트 ==========

    @Test
    void validate_ProgressBeforeStart_ThrowsException() {
        IllegalStateException exception = assertThrows(
            IllegalStateException.class,
            () -> ProgressTransition.validate(KEY, null, PROGRESS)
        );
        assertTrue(exception.getMessage().contains("draft-content#1"));
    }

    @Test
    void validate_SecondStart_ThrowsException() {
        assertThrows(IllegalStateException.class, () -> ProgressTransition.validate(KEY, PROGRESS, START));
    }

    @Test
    void isAllowed_AnythingAfterTerminal_ReturnsFalse() {
        for (ProgressKind terminal : new ProgressKind[]{COMPLETE, ERROR, CANCELLED}) {
            for (ProgressKind next : ProgressKind.values()) {
                assertFalse(ProgressTransition.isAllowed(terminal, next), terminal + " -> " + next);
            }
        }
    }

    @Test
    void isAllowed_NullNext_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> ProgressTransition.isAllowed(START, null));
    }

    @Test
    void isTerminal_OnlyCompleteErrorCancelled() {
        assertFalse(START.isTerminal());
        assertFalse(PROGRESS.isTerminal());
        assertTrue(COMPLETE.isTerminal());
        assertTrue(ERROR.isTerminal());
        assertTrue(CANCELLED.isTerminal());
    }
}
