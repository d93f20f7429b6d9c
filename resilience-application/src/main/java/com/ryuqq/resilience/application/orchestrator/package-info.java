/**
 * Resilience Application Layer - 의존성 호출 조정 API.
 *
 * <p>이 패키지는 클라이언트가 외부 의존성을 호출하는 단일 진입점과,
 * 시스템 전체 헬스 조회 모델을 정의합니다.</p>
 *
 * <h2>핵심 인터페이스</h2>
 * <ul>
 *   <li>{@link com.ryuqq.resilience.application.orchestrator.ResilienceOrchestrator} - 의존성 호출 조정자</li>
 *   <li>{@link com.ryuqq.resilience.application.orchestrator.SystemHealth} - 시스템 헬스 스냅샷</li>
 * </ul>
 *
 * <h2>설계 원칙</h2>
 * <ul>
 *   <li><strong>헥사고날 아키텍처:</strong> 포트(인터페이스)와 어댑터 분리</li>
 *   <li><strong>의존성 역전:</strong> 구현체는 adapter-runner 모듈에 위치</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.resilience.application.orchestrator;
