/**
 * 부가 관심사 SPI 패키지.
 *
 * <ul>
 *   <li>{@link com.ryuqq.resilience.core.spi.MessageCatalog}: 오류 종류별 다국어 사용자 메시지</li>
 *   <li>{@link com.ryuqq.resilience.core.spi.ResilienceMetrics}: 호출 결과 및 시스템 이벤트 기록</li>
 * </ul>
 *
 * <p>구현체는 {@code resilience-adapter-inmemory} 모듈에 있으며,
 * {@code noop} 하위 패키지는 기능을 끈 상태의 기본값입니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.resilience.core.spi;
