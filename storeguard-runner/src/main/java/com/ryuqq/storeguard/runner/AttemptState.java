package com.ryuqq.storeguard.runner;

/**
 * 호출 한 번의 시도 상태 (스택 로컬).
 *
 * <p>{@code invoke} 시작 시 생성되고 종료 시 버려집니다. 호출 간에 공유되거나 저장되지 않습니다.</p>
 *
 * @param attemptIndex 현재 시도 인덱스 (0부터 시작)
 * @param lastError 직전 시도의 실패 (첫 시도에서는 null)
 *
 * @author StoreGuard Team
 * @since 1.0.0
 */
record AttemptState(int attemptIndex, Exception lastError) {

    AttemptState {
        if (attemptIndex < 0) {
            throw new IllegalArgumentException(
                "attemptIndex must be non-negative (current: " + attemptIndex + ")"
            );
        }
    }

    static AttemptState initial() {
        return new AttemptState(0, null);
    }

    /**
     * 실패를 기록하고 다음 시도로 전이.
     */
    AttemptState next(Exception failure) {
        return new AttemptState(attemptIndex + 1, failure);
    }

    /**
     * 1부터 시작하는 시도 번호 (로그용).
     */
    int attemptNumber() {
        return attemptIndex + 1;
    }
}
