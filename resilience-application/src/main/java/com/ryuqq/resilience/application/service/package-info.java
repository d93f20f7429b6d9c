/**
 * 의존성 단위 보호 계층 API.
 *
 * <ul>
 *   <li>{@link com.ryuqq.resilience.application.service.ResilientService} - 의존성 하나의 보호 계층 Façade</li>
 *   <li>{@link com.ryuqq.resilience.application.service.ServiceHealth} - Circuit Breaker 및 설정 조회 모델</li>
 * </ul>
 *
 * <p>구현체는 adapter-runner 모듈에 위치합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.resilience.application.service;
