package com.ryuqq.resilience.core.spi;

import com.ryuqq.resilience.core.error.ErrorKind;
import com.ryuqq.resilience.core.model.UserMessage;

/**
 * 사용자용 오류 메시지 카탈로그 SPI.
 *
 * <p>실패한 호출의 오류를 사용자가 읽을 수 있는 메시지로 장식할 때만 사용됩니다.
 * 조회 결과가 재시도, 차단, Fallback 판단에 영향을 주어서는 안 됩니다.</p>
 *
 * <p><strong>구현 규칙:</strong></p>
 * <ul>
 *   <li>지원하지 않는 언어 → 기본 언어로 대체</li>
 *   <li>등록되지 않은 오류 종류 → 일반 오류 메시지</li>
 *   <li>null 반환 금지</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface MessageCatalog {

    /**
     * 오류 종류에 해당하는 사용자 메시지 조회.
     *
     * @param kind 오류 종류
     * @param languageTag 언어 태그 (예: "fr", "mg"). null이면 기본 언어
     * @return 사용자 메시지 (null 아님)
     */
    UserMessage lookup(ErrorKind kind, String languageTag);

    /**
     * 기본 언어 태그.
     *
     * @return 언어 태그
     */
    String defaultLanguage();
}
