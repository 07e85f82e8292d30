package com.ryuqq.storeguard.runner;

import com.ryuqq.storeguard.core.operation.StoreOperation;
import com.ryuqq.storeguard.core.policy.RetryPresets;

/**
 * 프리셋 기반 재시도 래퍼.
 *
 * <p>트랜잭션/커넥션 범위 프리셋으로 구성된 공유 RetryExecutor를 제공합니다.
 * RetryExecutor는 불변이므로 모든 호출자가 같은 인스턴스를 사용해도 안전합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * String jobId = StoreRetries.inTransactionScope(() -> contentIndex.claim(hash));
 * }</pre>
 *
 * @author StoreGuard Team
 * @since 1.0.0
 */
public final class StoreRetries {

    private static final RetryExecutor TRANSACTIONAL = new RetryExecutor(RetryPresets.transactionScope());
    private static final RetryExecutor CONNECTION = new RetryExecutor(RetryPresets.connectionScope());

    private StoreRetries() {
    }

    /**
     * 트랜잭션 범위 실행자.
     *
     * @return 공유 RetryExecutor
     */
    public static RetryExecutor transactional() {
        return TRANSACTIONAL;
    }

    /**
     * 커넥션 범위 실행자.
     *
     * @return 공유 RetryExecutor
     */
    public static RetryExecutor connection() {
        return CONNECTION;
    }

    /**
     * 트랜잭션 범위 프리셋으로 작업 실행.
     *
     * @param operation 저장소 작업
     * @param <T> 결과 타입
     * @param <E> 작업의 검사 예외 타입
     * @return 작업 결과
     * @throws E 마지막 실패 (원본 그대로)
     */
    public static <T, E extends Exception> T inTransactionScope(StoreOperation<T, E> operation) throws E {
        return TRANSACTIONAL.invoke(operation);
    }

    /**
     * 커넥션 범위 프리셋으로 작업 실행.
     *
     * @param operation 저장소 작업
     * @param <T> 결과 타입
     * @param <E> 작업의 검사 예외 타입
     * @return 작업 결과
     * @throws E 마지막 실패 (원본 그대로)
     */
    public static <T, E extends Exception> T inConnectionScope(StoreOperation<T, E> operation) throws E {
        return CONNECTION.invoke(operation);
    }
}
