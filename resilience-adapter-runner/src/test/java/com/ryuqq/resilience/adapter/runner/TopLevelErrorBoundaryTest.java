package com.ryuqq.resilience.adapter.runner;

import com.ryuqq.resilience.core.error.ErrorKind;
import com.ryuqq.resilience.core.model.SystemEvent;
import com.ryuqq.resilience.core.outcome.Fail;
import com.ryuqq.resilience.core.outcome.Ok;
import com.ryuqq.resilience.core.outcome.Outcome;
import com.ryuqq.resilience.core.spi.ResilienceMetrics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

/**
 * TopLevelErrorBoundary 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class TopLevelErrorBoundaryTest {

    @Mock
    private ResilienceMetrics metrics;

    private MutableClock clock;
    private List<Integer> exitCodes;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
        exitCodes = new ArrayList<>();
    }

    private TopLevelErrorBoundary boundary(FailurePolicy policy) {
        return new TopLevelErrorBoundary(policy, metrics, exitCodes::add, clock);
    }

    @Test
    void 정상_작업은_Ok() {
        Outcome<String> outcome = boundary(FailurePolicy.CONTINUE).run(() -> "done");

        assertThat(outcome).isInstanceOf(Ok.class);
        assertThat(((Ok<String>) outcome).value()).isEqualTo("done");
        verifyNoInteractions(metrics);
    }

    @Test
    void 오류는_분류된_Fail로_반환하고_이벤트_기록() {
        // when
        Outcome<String> outcome = boundary(FailurePolicy.CONTINUE).run(() -> {
            throw new IllegalArgumentException("missing tenant id");
        });

        // then
        assertThat(outcome.isFail()).isTrue();
        Fail<String> fail = (Fail<String>) outcome;
        assertThat(fail.kind()).isEqualTo(ErrorKind.CLIENT_VALIDATION);
        assertThat(fail.message()).isEqualTo("missing tenant id");

        ArgumentCaptor<SystemEvent> captor = ArgumentCaptor.forClass(SystemEvent.class);
        verify(metrics).recordSystemEvent(captor.capture());
        SystemEvent event = captor.getValue();
        assertThat(event.type()).isEqualTo(SystemEvent.UNCAUGHT_EXCEPTION);
        assertThat(event.occurredAt()).isEqualTo(clock.instant());
        assertThat(event.attributes())
            .containsEntry("kind", "CLIENT_VALIDATION")
            .containsEntry("errorType", IllegalArgumentException.class.getName());
        assertThat(exitCodes).isEmpty();
    }

    @Test
    void Error_계열도_잡아서_Fail로_반환() {
        Outcome<Object> outcome = boundary(FailurePolicy.CONTINUE).run(() -> {
            throw new StackOverflowError();
        });

        assertThat(outcome.isFail()).isTrue();
        assertThat(((Fail<Object>) outcome).message()).isEqualTo("StackOverflowError");
    }

    @Test
    void EXIT_정책이면_종료_코드_1로_종료_훅_호출() {
        boundary(FailurePolicy.EXIT).run(() -> {
            throw new IllegalStateException("unrecoverable");
        });

        assertThat(exitCodes).containsExactly(1);
    }

    @Test
    void UncaughtExceptionHandler로_사용() {
        Thread.UncaughtExceptionHandler handler = boundary(FailurePolicy.EXIT).asUncaughtExceptionHandler();

        handler.uncaughtException(new Thread("worker-1"), new IllegalStateException("worker crashed"));

        ArgumentCaptor<SystemEvent> captor = ArgumentCaptor.forClass(SystemEvent.class);
        verify(metrics).recordSystemEvent(captor.capture());
        assertThat(captor.getValue().attributes()).containsEntry("thread", "worker-1");
        assertThat(exitCodes).containsExactly(1);
    }
}
