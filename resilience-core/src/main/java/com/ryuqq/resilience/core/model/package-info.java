/**
 * 복원력 계층의 값 객체 패키지.
 *
 * <p>의존성 설정, 호출 옵션과 결과, 헬스 상태, 성능 저하 단계 등
 * 모든 모듈이 공유하는 불변 모델을 정의합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.resilience.core.model;
