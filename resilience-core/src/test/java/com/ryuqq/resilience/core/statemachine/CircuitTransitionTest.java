package com.ryuqq.resilience.core.statemachine;

import com.ryuqq.resilience.core.protection.CircuitBreakerState;
import org.junit.jupiter.api.Test;

import static com.ryuqq.resilience.core.protection.CircuitBreakerState.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * CircuitTransition 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class CircuitTransitionTest {

    // ========== 정상 전이 테스트 ==========

    @Test
    void validate_ClosedToOpen_Succeeds() {
        assertDoesNotThrow(() -> CircuitTransition.validate(CLOSED, OPEN));
    }

    @Test
    void validate_OpenToHalfOpen_Succeeds() {
        assertDoesNotThrow(() -> CircuitTransition.validate(OPEN, HALF_OPEN));
    }

    @Test
    void validate_HalfOpenToClosedOrOpen_Succeeds() {
        assertDoesNotThrow(() -> CircuitTransition.validate(HALF_OPEN, CLOSED));
        assertDoesNotThrow(() -> CircuitTransition.validate(HALF_OPEN, OPEN));
    }

    @Test
    void transition_FullCycle_ReturnsToClosed() {
        // Given
        CircuitBreakerState state = CLOSED;

        // When
        state = CircuitTransition.transition(state, OPEN);
        state = CircuitTransition.transition(state, HALF_OPEN);
        state = CircuitTransition.transition(state, CLOSED);

        // Then
        assertEquals(CLOSED, state);
    }

    // ========== 비정상 전이 테스트 ==========

    @Test
    void validate_OpenToClosed_ThrowsException() {
        IllegalStateException exception = assertThrows(
            IllegalStateException.class,
            () -> CircuitTransition.validate(OPEN, CLOSED)
        );
        assertTrue(exception.getMessage().contains("Invalid circuit transition"));
    }

    @Test
    void validate_ClosedToHalfOpen_ThrowsException() {
        assertThrows(IllegalStateException.class, () -> CircuitTransition.validate(CLOSED, HALF_OPEN));
    }

    @Test
    void validate_SameState_ThrowsException() {
        assertThrows(IllegalStateException.class, () -> CircuitTransition.validate(OPEN, OPEN));
    }

    @Test
    void validate_Null_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> CircuitTransition.validate(null, OPEN));
        assertThrows(IllegalArgumentException.class, () -> CircuitTransition.validate(CLOSED, null));
    }

    @Test
    void reset_AnyState_ReturnsClosed() {
        assertEquals(CLOSED, CircuitTransition.reset(OPEN));
        assertEquals(CLOSED, CircuitTransition.reset(HALF_OPEN));
        assertEquals(CLOSED, CircuitTransition.reset(CLOSED));
    }
}
