package com.ryuqq.storeguard.core.policy;

import com.ryuqq.storeguard.core.failure.FailureCategory;

import java.time.Duration;
import java.util.EnumSet;

/**
 * 사전 튜닝된 재시도 정책.
 *
 * <p>두 프리셋은 로직이 아닌 튜닝 값만 다릅니다.</p>
 *
 * <table>
 *   <caption>프리셋 비교</caption>
 *   <tr><th></th><th>transactionScope</th><th>connectionScope</th></tr>
 *   <tr><td>maxRetries</td><td>8</td><td>5</td></tr>
 *   <tr><td>baseDelay</td><td>50ms</td><td>100ms</td></tr>
 *   <tr><td>backoffFactor</td><td>1.5</td><td>2.0</td></tr>
 *   <tr><td>maxDelay</td><td>1s</td><td>2s</td></tr>
 *   <tr><td>categories</td><td>OPERATIONAL, DATABASE</td><td>OPERATIONAL</td></tr>
 * </table>
 *
 * <p>트랜잭션 커밋 경합은 흔하고 대개 빨리 해소되므로 짧은 간격으로 더 많이 재시도합니다.
 * 커넥션 수준 실패는 드물고 실제 장애일 가능성이 높으므로 더 보수적으로 물러나고
 * 낯선 실패에서 더 빨리 포기합니다.</p>
 *
 * @author StoreGuard Team
 * @since 1.0.0
 */
public final class RetryPresets {

    private static final RetryPolicy TRANSACTION_SCOPE = new RetryPolicy(
        8,
        Duration.ofMillis(50),
        Duration.ofSeconds(1),
        1.5,
        EnumSet.of(FailureCategory.OPERATIONAL, FailureCategory.DATABASE)
    );

    private static final RetryPolicy CONNECTION_SCOPE = new RetryPolicy(
        5,
        Duration.ofMillis(100),
        Duration.ofSeconds(2),
        2.0,
        EnumSet.of(FailureCategory.OPERATIONAL)
    );

    private RetryPresets() {
    }

    /**
     * 트랜잭션 범위 프리셋.
     *
     * @return 트랜잭션 범위 정책
     */
    public static RetryPolicy transactionScope() {
        return TRANSACTION_SCOPE;
    }

    /**
     * 커넥션 범위 프리셋.
     *
     * @return 커넥션 범위 정책
     */
    public static RetryPolicy connectionScope() {
        return CONNECTION_SCOPE;
    }
}
