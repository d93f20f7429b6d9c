package com.ryuqq.resilience.core.spi.noop;

import com.ryuqq.resilience.core.error.ErrorKind;
import com.ryuqq.resilience.core.model.SystemEvent;
import com.ryuqq.resilience.core.model.UserMessage;
import com.ryuqq.resilience.core.spi.MessageCatalog;
import com.ryuqq.resilience.core.spi.ResilienceMetrics;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * NoOp SPI 구현 유닛 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@DisplayName("NoOp SPI 테스트")
class NoOpSpiTest {

    @Test
    @DisplayName("NoOpMessageCatalog 는 언어와 오류 종류에 관계없이 일반 메시지를 반환한다")
    void messageCatalog_일반_메시지() {
        // given
        MessageCatalog catalog = new NoOpMessageCatalog();

        // when
        UserMessage timeout = catalog.lookup(ErrorKind.TIMEOUT, "fr");
        UserMessage unknown = catalog.lookup(ErrorKind.UNKNOWN, null);

        // then
        assertSame(timeout, unknown);
        assertEquals("Error", timeout.title());
        assertEquals("en", catalog.defaultLanguage());
    }

    @Test
    void metrics_기록_무시() {
        // given
        ResilienceMetrics metrics = new NoOpResilienceMetrics();

        // when & then
        assertDoesNotThrow(() -> {
            metrics.recordOperationSuccess("database", 12);
            metrics.recordOperationFailure("database", ErrorKind.TIMEOUT);
            metrics.recordSystemEvent(SystemEvent.of(SystemEvent.SHUTDOWN, Instant.EPOCH, Map.of()));
        });
    }
}
