/**
 * Failure Taxonomy - 저장소 실패 분류 체계.
 *
 * <p>잡힌 실패를 두 단계로 분류합니다:</p>
 * <ul>
 *   <li>{@link com.ryuqq.storeguard.core.failure.FailureCategory} - 예외 타입 수준 카테고리 (계층형)</li>
 *   <li>{@link com.ryuqq.storeguard.core.failure.ErrorKind} - 카테고리 + 메시지 기반 실패별 판정</li>
 * </ul>
 *
 * <h2>SPI</h2>
 * <ul>
 *   <li>{@link com.ryuqq.storeguard.core.failure.FailureCategorizer} - 실패 → 카테고리 매핑</li>
 *   <li>{@link com.ryuqq.storeguard.core.failure.SqlFailureCategorizer} - JDBC 예외 계층 기본 구현</li>
 * </ul>
 *
 * @author StoreGuard Team
 * @since 1.0.0
 */
package com.ryuqq.storeguard.core.failure;
