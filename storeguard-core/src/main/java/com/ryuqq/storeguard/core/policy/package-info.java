/**
 * Retry Policy - 재시도 예산, 백오프 파라미터, 재시도 대상 카테고리.
 *
 * <h2>핵심 타입</h2>
 * <ul>
 *   <li>{@link com.ryuqq.storeguard.core.policy.RetryPolicy} - 불변 정책 record</li>
 *   <li>{@link com.ryuqq.storeguard.core.policy.RetryPresets} - 트랜잭션/커넥션 범위 프리셋</li>
 * </ul>
 *
 * @author StoreGuard Team
 * @since 1.0.0
 */
package com.ryuqq.storeguard.core.policy;
