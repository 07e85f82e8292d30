package com.ryuqq.storeguard.core.classifier;

import com.ryuqq.storeguard.core.failure.ErrorKind;
import com.ryuqq.storeguard.core.policy.RetryPolicy;

/**
 * Error Classifier SPI.
 *
 * <p>잡힌 실패를 보고 재시도할지, 즉시 전파할지 결정합니다.</p>
 *
 * <p>메시지 문자열 기반 판정은 저장소 버전이나 로케일에 따라 깨지기 쉬우므로
 * 이 인터페이스 뒤에 격리합니다. 나중에 구조화된 오류 코드 기반 구현으로 바꿔도
 * RetryExecutor와 BackoffScheduler는 바뀌지 않습니다.</p>
 *
 * <p><strong>구현 요구사항:</strong></p>
 * <ul>
 *   <li>순수 함수: I/O 없음, 상태 변경 없음</li>
 *   <li>같은 실패 객체와 정책에 대해 항상 같은 결과</li>
 *   <li>thread-safe</li>
 * </ul>
 *
 * @author StoreGuard Team
 * @since 1.0.0
 */
public interface ErrorClassifier {

    /**
     * 실패 판정.
     *
     * @param failure 잡힌 실패
     * @return 실패 종류
     * @throws IllegalArgumentException failure가 null인 경우
     */
    ErrorKind classify(Throwable failure);

    /**
     * 재시도 여부 결정.
     *
     * <p>남은 시도 횟수는 고려하지 않습니다. 예산 소진 판단은 RetryExecutor의 몫입니다.</p>
     *
     * @param failure 잡힌 실패
     * @param policy 적용 중인 정책
     * @return 재시도해야 하면 true
     * @throws IllegalArgumentException failure 또는 policy가 null인 경우
     */
    boolean shouldRetry(Throwable failure, RetryPolicy policy);
}
