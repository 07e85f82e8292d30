/**
 * Runner - 재시도 루프와 백오프.
 *
 * <p>이 패키지는 core의 정책과 분류기를 사용해 실제로 작업을 실행하고 재시도합니다.</p>
 *
 * <h2>구성 요소</h2>
 * <ul>
 *   <li>{@link com.ryuqq.storeguard.runner.RetryExecutor} - 재시도 루프</li>
 *   <li>{@link com.ryuqq.storeguard.runner.BackoffScheduler} - 결정적 지수 백오프 계산</li>
 *   <li>{@link com.ryuqq.storeguard.runner.Sleeper} - 백오프 대기 SPI</li>
 *   <li>{@link com.ryuqq.storeguard.runner.StoreRetries} - 프리셋 래퍼</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * adapter-jdbc (JdbcStoreTemplate)
 *   ↓ depends on
 * runner (RetryExecutor, BackoffScheduler)
 *   ↓ depends on
 * core (RetryPolicy, ErrorClassifier, FailureCategory, StoreOperation)
 * </pre>
 *
 * @author StoreGuard Team
 * @since 1.0.0
 */
package com.ryuqq.storeguard.runner;
