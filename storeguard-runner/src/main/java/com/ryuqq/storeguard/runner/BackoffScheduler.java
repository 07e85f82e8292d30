package com.ryuqq.storeguard.runner;

import com.ryuqq.storeguard.core.policy.RetryPolicy;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Exponential Backoff 계산기 (jitter 없음).
 *
 * <p>방금 실패한 시도의 인덱스로 다음 시도 전 대기 시간을 계산합니다.</p>
 *
 * <p><strong>알고리즘:</strong></p>
 * <pre>
 * delay = min(baseDelay * backoffFactor^attemptIndex, maxDelay)
 * </pre>
 *
 * <p><strong>예시 (baseDelay=100ms, backoffFactor=2.0, maxDelay=2s):</strong></p>
 * <ul>
 *   <li>attemptIndex=0: 100ms</li>
 *   <li>attemptIndex=1: 200ms</li>
 *   <li>attemptIndex=4: 1600ms</li>
 *   <li>attemptIndex=5: 3200ms (capped at maxDelay=2000ms)</li>
 * </ul>
 *
 * <p>결정적 백오프입니다. jitter가 필요한 호출자는 이 계산기 바깥에서 직접 무작위화를 조합해야 합니다.</p>
 *
 * @author StoreGuard Team
 * @since 1.0.0
 */
public final class BackoffScheduler {

    private final long baseDelayNanos;
    private final long maxDelayNanos;
    private final double backoffFactor;

    /**
     * 정책의 백오프 파라미터로 생성.
     *
     * @param policy 재시도 정책
     * @throws IllegalArgumentException policy가 null인 경우
     * @throws ArithmeticException 지연 시간이 나노초 long 범위를 넘는 경우
     */
    public BackoffScheduler(RetryPolicy policy) {
        if (policy == null) {
            throw new IllegalArgumentException("policy cannot be null");
        }
        this.baseDelayNanos = policy.baseDelay().toNanos();
        this.maxDelayNanos = policy.maxDelay().toNanos();
        this.backoffFactor = policy.backoffFactor();
    }

    /**
     * 재시도 전 대기 시간 계산.
     *
     * <p>attemptIndex에 대해 단조 비감소이며 maxDelay를 넘지 않고 음수가 되지 않습니다.
     * 지수가 커서 double이 무한대가 되어도 maxDelay로 고정됩니다.</p>
     *
     * @param attemptIndex 방금 실패한 시도의 인덱스 (0부터 시작)
     * @return 대기 시간
     * @throws IllegalArgumentException attemptIndex가 음수인 경우
     */
    public Duration delayFor(int attemptIndex) {
        if (attemptIndex < 0) {
            throw new IllegalArgumentException(
                "attemptIndex must be non-negative (current: " + attemptIndex + ")"
            );
        }

        double exponential = baseDelayNanos * Math.pow(backoffFactor, attemptIndex);
        if (exponential >= maxDelayNanos) {
            return Duration.ofNanos(maxDelayNanos);
        }
        return Duration.ofNanos(Math.round(exponential));
    }

    /**
     * 정책의 재시도 예산 전체에 대한 대기 시간 목록.
     *
     * <p>i번째 원소는 i번째 시도가 실패한 뒤의 대기 시간입니다. 마지막 시도 뒤에는 대기가 없으므로
     * 목록 길이는 maxRetries입니다.</p>
     *
     * @param maxRetries 재시도 횟수
     * @return 불변 대기 시간 목록
     * @throws IllegalArgumentException maxRetries가 음수인 경우
     */
    public List<Duration> plannedDelays(int maxRetries) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException(
                "maxRetries must be non-negative (current: " + maxRetries + ")"
            );
        }
        List<Duration> delays = new ArrayList<>(maxRetries);
        for (int attemptIndex = 0; attemptIndex < maxRetries; attemptIndex++) {
            delays.add(delayFor(attemptIndex));
        }
        return Collections.unmodifiableList(delays);
    }
}
