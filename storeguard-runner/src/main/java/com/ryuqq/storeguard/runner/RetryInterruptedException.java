package com.ryuqq.storeguard.runner;

/**
 * 백오프 대기 중 스레드가 인터럽트되어 재시도를 중단한 경우.
 *
 * <p>cause는 {@link InterruptedException}이며, 직전 시도의 저장소 실패는
 * suppressed 예외로 첨부됩니다. 던지기 전에 인터럽트 플래그는 복원됩니다.</p>
 *
 * @author StoreGuard Team
 * @since 1.0.0
 */
public class RetryInterruptedException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final int completedAttempts;

    /**
     * 생성자.
     *
     * @param completedAttempts 인터럽트 시점까지 수행된 시도 횟수
     * @param cause 인터럽트 예외
     * @param lastFailure 직전 시도의 실패
     */
    public RetryInterruptedException(int completedAttempts, InterruptedException cause, Throwable lastFailure) {
        super("Retry backoff interrupted after " + completedAttempts + " attempt(s)", cause);
        this.completedAttempts = completedAttempts;
        if (lastFailure != null) {
            addSuppressed(lastFailure);
        }
    }

    /**
     * 인터럽트 시점까지 수행된 시도 횟수.
     *
     * @return 시도 횟수
     */
    public int getCompletedAttempts() {
        return completedAttempts;
    }
}
