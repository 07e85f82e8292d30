package com.ryuqq.storeguard.core.policy;

import com.ryuqq.storeguard.core.failure.FailureCategory;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * 재시도 정책 (불변 record).
 *
 * <p>생성 후 변경되지 않으므로 여러 스레드의 동시 호출에서 잠금 없이 공유할 수 있습니다.</p>
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>maxRetries: 첫 시도 이후 최대 재시도 횟수 (기본 5, 총 시도는 maxRetries + 1)</li>
 *   <li>baseDelay: 첫 재시도 전 대기 시간 (기본 100ms)</li>
 *   <li>maxDelay: 대기 시간 상한 (기본 2s)</li>
 *   <li>backoffFactor: 지수 백오프 배율 (기본 2.0)</li>
 *   <li>retryableCategories: 재시도 대상 카테고리 (기본 OPERATIONAL)</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * RetryPolicy policy = new RetryPolicy()
 *     .withMaxRetries(2)
 *     .withBaseDelay(Duration.ofMillis(100));
 * }</pre>
 *
 * @author StoreGuard Team
 * @since 1.0.0
 * @param maxRetries 최대 재시도 횟수 (0 이상)
 * @param baseDelay 기본 대기 시간 (양수)
 * @param maxDelay 최대 대기 시간 (baseDelay 이상, {@link #MAX_SUPPORTED_DELAY} 이하)
 * @param backoffFactor 백오프 배율 (1.0 이상)
 * @param retryableCategories 재시도 대상 카테고리 (비어 있을 수 없음)
 */
public record RetryPolicy(
    int maxRetries,
    Duration baseDelay,
    Duration maxDelay,
    double backoffFactor,
    Set<FailureCategory> retryableCategories
) {

    public static final int DEFAULT_MAX_RETRIES = 5;
    public static final Duration DEFAULT_BASE_DELAY = Duration.ofMillis(100);
    public static final Duration DEFAULT_MAX_DELAY = Duration.ofSeconds(2);
    public static final double DEFAULT_BACKOFF_FACTOR = 2.0;

    /** 나노초(long)로 표현 가능한 최대 대기 시간. */
    public static final Duration MAX_SUPPORTED_DELAY = Duration.ofNanos(Long.MAX_VALUE);

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: maxRetries=5, baseDelay=100ms, maxDelay=2s, backoffFactor=2.0,
     * retryableCategories={OPERATIONAL}</p>
     */
    public RetryPolicy() {
        this(DEFAULT_MAX_RETRIES, DEFAULT_BASE_DELAY, DEFAULT_MAX_DELAY, DEFAULT_BACKOFF_FACTOR,
            EnumSet.of(FailureCategory.OPERATIONAL));
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public RetryPolicy {
        if (maxRetries < 0) {
            throw new IllegalArgumentException(
                "maxRetries must be non-negative (current: " + maxRetries + ")"
            );
        }
        if (baseDelay == null) {
            throw new IllegalArgumentException("baseDelay cannot be null");
        }
        if (maxDelay == null) {
            throw new IllegalArgumentException("maxDelay cannot be null");
        }
        if (baseDelay.isNegative() || baseDelay.isZero()) {
            throw new IllegalArgumentException(
                "baseDelay must be positive (current: " + baseDelay + ")"
            );
        }
        if (maxDelay.compareTo(MAX_SUPPORTED_DELAY) > 0) {
            throw new IllegalArgumentException(
                "maxDelay must be <= " + MAX_SUPPORTED_DELAY + " (current: " + maxDelay + ")"
            );
        }
        if (maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException(
                "maxDelay must be >= baseDelay (base: " + baseDelay + ", max: " + maxDelay + ")"
            );
        }
        if (Double.isNaN(backoffFactor) || Double.isInfinite(backoffFactor) || backoffFactor < 1.0) {
            throw new IllegalArgumentException(
                "backoffFactor must be >= 1.0 (current: " + backoffFactor + ")"
            );
        }
        if (retryableCategories == null || retryableCategories.isEmpty()) {
            throw new IllegalArgumentException("retryableCategories cannot be null or empty");
        }
        if (retryableCategories.contains(null)) {
            throw new IllegalArgumentException("retryableCategories cannot contain null");
        }
        retryableCategories = Collections.unmodifiableSet(EnumSet.copyOf(retryableCategories));
    }

    /**
     * 총 시도 가능 횟수 (첫 시도 포함).
     *
     * @return maxRetries + 1
     */
    public int maxAttempts() {
        return maxRetries + 1;
    }

    /**
     * 카테고리가 재시도 대상인지 확인 (계층 매칭).
     *
     * <p>카테고리가 재시도 대상 집합의 어느 원소와 같거나 그 하위이면 대상입니다.</p>
     *
     * @param category 실패 카테고리
     * @return 재시도 대상이면 true
     * @throws IllegalArgumentException category가 null인 경우
     */
    public boolean isRetryableCategory(FailureCategory category) {
        if (category == null) {
            throw new IllegalArgumentException("category cannot be null");
        }
        for (FailureCategory retryable : retryableCategories) {
            if (category.isA(retryable)) {
                return true;
            }
        }
        return false;
    }

    /**
     * maxRetries만 변경한 새 인스턴스 생성.
     */
    public RetryPolicy withMaxRetries(int maxRetries) {
        return new RetryPolicy(maxRetries, baseDelay, maxDelay, backoffFactor, retryableCategories);
    }

    /**
     * baseDelay만 변경한 새 인스턴스 생성.
     */
    public RetryPolicy withBaseDelay(Duration baseDelay) {
        return new RetryPolicy(maxRetries, baseDelay, maxDelay, backoffFactor, retryableCategories);
    }

    /**
     * maxDelay만 변경한 새 인스턴스 생성.
     */
    public RetryPolicy withMaxDelay(Duration maxDelay) {
        return new RetryPolicy(maxRetries, baseDelay, maxDelay, backoffFactor, retryableCategories);
    }

    /**
     * backoffFactor만 변경한 새 인스턴스 생성.
     */
    public RetryPolicy withBackoffFactor(double backoffFactor) {
        return new RetryPolicy(maxRetries, baseDelay, maxDelay, backoffFactor, retryableCategories);
    }

    /**
     * retryableCategories만 변경한 새 인스턴스 생성.
     */
    public RetryPolicy withRetryableCategories(Set<FailureCategory> retryableCategories) {
        return new RetryPolicy(maxRetries, baseDelay, maxDelay, backoffFactor, retryableCategories);
    }
}
