package com.ryuqq.resilience.core.spi.noop;

import com.ryuqq.resilience.core.error.ErrorKind;
import com.ryuqq.resilience.core.model.UserMessage;
import com.ryuqq.resilience.core.spi.MessageCatalog;

/**
 * MessageCatalog NoOp 구현.
 *
 * <p>언어와 오류 종류에 관계없이 동일한 영문 일반 메시지를 반환합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class NoOpMessageCatalog implements MessageCatalog {

    static final UserMessage GENERIC = new UserMessage(
        "Error",
        "An unexpected error occurred.",
        "Please try again"
    );

    @Override
    public UserMessage lookup(ErrorKind kind, String languageTag) {
        return GENERIC;
    }

    @Override
    public String defaultLanguage() {
        return "en";
    }
}
