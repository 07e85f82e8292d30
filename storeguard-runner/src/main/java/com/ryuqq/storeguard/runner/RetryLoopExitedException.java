package com.ryuqq.storeguard.runner;

/**
 * 재시도 루프가 반환도 예외도 없이 빠져나온 경우의 내부 오류.
 *
 * <p>정상 동작에서는 도달할 수 없습니다. 관측되었다면 RetryExecutor 로직 결함입니다.</p>
 *
 * @author StoreGuard Team
 * @since 1.0.0
 */
public class RetryLoopExitedException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /**
     * 생성자.
     *
     * @param lastFailure 마지막으로 잡힌 실패 (없으면 null)
     */
    public RetryLoopExitedException(Throwable lastFailure) {
        super("Unexpected retry loop exit", lastFailure);
    }
}
