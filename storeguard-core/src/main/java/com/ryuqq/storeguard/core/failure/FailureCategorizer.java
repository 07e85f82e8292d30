package com.ryuqq.storeguard.core.failure;

/**
 * Failure Categorizer SPI.
 *
 * <p>잡힌 실패를 {@link FailureCategory}로 매핑합니다.
 * 구현체는 순수 함수여야 합니다: I/O 없음, 상태 변경 없음, 같은 입력에 같은 결과.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * FailureCategorizer categorizer = new SqlFailureCategorizer();
 * FailureCategory category = categorizer.categorize(sqlException);
 * }</pre>
 *
 * @author StoreGuard Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface FailureCategorizer {

    /**
     * 실패의 카테고리 결정.
     *
     * @param failure 잡힌 실패 (null 불가)
     * @return 카테고리 (null 반환 불가)
     */
    FailureCategory categorize(Throwable failure);
}
