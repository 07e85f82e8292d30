package com.ryuqq.storeguard.runner;

import com.ryuqq.storeguard.core.classifier.ErrorClassifier;
import com.ryuqq.storeguard.core.classifier.MessagePatternErrorClassifier;
import com.ryuqq.storeguard.core.operation.StoreOperation;
import com.ryuqq.storeguard.core.policy.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 정책 기반 재시도 실행자.
 *
 * <p>인자 없는 저장소 작업을 실행하고, 실패하면 ErrorClassifier와 BackoffScheduler에 물어
 * 대기 후 재시도하거나 마지막 실패를 그대로 전파합니다.</p>
 *
 * <p><strong>상태 전이 (호출 단위):</strong></p>
 * <pre>
 * Attempting(0)
 *   ├── 성공                                        → Success (값 반환)
 *   ├── 실패 + 재시도 판정 + index &lt; maxRetries   → DEBUG 로그, 대기, Attempting(index+1)
 *   └── 실패 + (즉시 전파 판정 | index == maxRetries) → Propagate (같은 예외 객체 재던짐)
 * </pre>
 *
 * <p><strong>전파 규칙:</strong></p>
 * <ul>
 *   <li>호출자가 원래 실패 종류로 분기할 수 있도록 예외를 감싸거나 변환하지 않습니다.</li>
 *   <li>{@link Error}는 분류 대상이 아니며 첫 발생 시 그대로 전파됩니다.</li>
 *   <li>분류기가 예외를 던지면 재시도하지 않고, 그 예외를 suppressed로 첨부한 원래 실패를 전파합니다.</li>
 *   <li>대기 중 인터럽트 → 인터럽트 플래그 복원 후 {@link RetryInterruptedException}</li>
 * </ul>
 *
 * <p><strong>동시성:</strong></p>
 * <ul>
 *   <li>정책, 분류기, 스케줄러는 불변이므로 인스턴스를 여러 스레드가 공유해도 안전합니다.</li>
 *   <li>시도 상태는 호출마다 스택에 생성되며 공유되지 않습니다.</li>
 *   <li>한 호출의 시도들은 엄격히 순차적입니다. 서로 다른 호출 간의 순서는 보장하지 않습니다.</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * RetryExecutor executor = new RetryExecutor(RetryPresets.connectionScope());
 * boolean exists = executor.invoke(() -> contentIndex.hasContent(hash));
 *
 * // 데코레이터 형태
 * StoreOperation<Boolean, SQLException> guarded = executor.wrap(() -> contentIndex.hasContent(hash));
 * }</pre>
 *
 * @author StoreGuard Team
 * @since 1.0.0
 */
public final class RetryExecutor {

    private static final Logger log = LoggerFactory.getLogger(RetryExecutor.class);

    static final int MAX_LOGGED_MESSAGE_LENGTH = 200;

    private final RetryPolicy policy;
    private final ErrorClassifier classifier;
    private final BackoffScheduler backoffScheduler;
    private final Sleeper sleeper;
    private final AtomicLong droppedDiagnostics = new AtomicLong();

    /**
     * 생성자 (기본 MessagePatternErrorClassifier, Thread 기반 Sleeper 사용).
     *
     * @param policy 재시도 정책
     * @throws IllegalArgumentException policy가 null인 경우
     */
    public RetryExecutor(RetryPolicy policy) {
        this(policy, new MessagePatternErrorClassifier(), Sleeper.threadSleeper());
    }

    /**
     * 생성자 (분류기, Sleeper 주입).
     *
     * @param policy 재시도 정책
     * @param classifier 오류 분류기
     * @param sleeper 백오프 대기 구현
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public RetryExecutor(RetryPolicy policy, ErrorClassifier classifier, Sleeper sleeper) {
        if (policy == null) {
            throw new IllegalArgumentException("policy cannot be null");
        }
        if (classifier == null) {
            throw new IllegalArgumentException("classifier cannot be null");
        }
        if (sleeper == null) {
            throw new IllegalArgumentException("sleeper cannot be null");
        }
        this.policy = policy;
        this.classifier = classifier;
        this.backoffScheduler = new BackoffScheduler(policy);
        this.sleeper = sleeper;
    }

    /**
     * 작업 실행 (정책에 따라 재시도).
     *
     * <p>작업은 최대 {@code maxRetries + 1}회 호출됩니다.</p>
     *
     * @param operation 저장소 작업 (재호출 안전해야 함)
     * @param <T> 결과 타입
     * @param <E> 작업의 검사 예외 타입
     * @return 첫 성공 또는 재시도 후 성공한 결과
     * @throws E 재시도 불가 판정 또는 예산 소진 시 마지막 실패 (원본 그대로)
     * @throws IllegalArgumentException operation이 null인 경우
     * @throws RetryInterruptedException 백오프 대기 중 인터럽트 발생 시
     */
    public <T, E extends Exception> T invoke(StoreOperation<T, E> operation) throws E {
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }

        AttemptState state = AttemptState.initial();
        while (state.attemptIndex() <= policy.maxRetries()) {
            try {
                return operation.execute();
            } catch (Exception failure) {
                if (!isRetryable(failure) || state.attemptIndex() >= policy.maxRetries()) {
                    throw failure;
                }

                Duration delay = backoffScheduler.delayFor(state.attemptIndex());
                logRetry(state, failure, delay);
                pause(state, failure, delay);
                state = state.next(failure);
            }
        }

        // 위 규칙대로라면 도달 불가
        throw new RetryLoopExitedException(state.lastError());
    }

    /**
     * 작업을 재시도 정책으로 감싼 작업 반환 (데코레이터 형태).
     *
     * <p>반환된 작업은 호출될 때마다 {@link #invoke(StoreOperation)}를 새로 수행합니다.</p>
     *
     * @param operation 감쌀 작업
     * @param <T> 결과 타입
     * @param <E> 작업의 검사 예외 타입
     * @return 재시도가 적용된 작업
     * @throws IllegalArgumentException operation이 null인 경우
     */
    public <T, E extends Exception> StoreOperation<T, E> wrap(StoreOperation<T, E> operation) {
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }
        return () -> invoke(operation);
    }

    /**
     * 적용 중인 정책 조회.
     *
     * @return 재시도 정책
     */
    public RetryPolicy getPolicy() {
        return policy;
    }

    /**
     * 기록에 실패한 재시도 진단 로그 수.
     *
     * @return 누락된 진단 로그 수
     */
    public long getDroppedDiagnostics() {
        return droppedDiagnostics.get();
    }

    /**
     * 분류기 판정.
     *
     * <p>판정 중 예외가 나면 원래 실패를 그대로 전파하기 위해 재시도하지 않으며,
     * 판정 예외는 원래 실패의 suppressed로 첨부합니다.</p>
     */
    private boolean isRetryable(Exception failure) {
        try {
            return classifier.shouldRetry(failure, policy);
        } catch (RuntimeException classificationFailure) {
            failure.addSuppressed(classificationFailure);
            return false;
        }
    }

    /**
     * 재시도 진단 로그 (DEBUG).
     *
     * <p>로깅이 실패해도 재시도 루프는 계속됩니다.</p>
     */
    private void logRetry(AttemptState state, Exception failure, Duration delay) {
        try {
            if (log.isDebugEnabled()) {
                log.debug("Store operation failed (attempt {}/{}): {}. Retrying in {}s...",
                    state.attemptNumber(), policy.maxAttempts(), truncate(describe(failure)), formatSeconds(delay));
            }
        } catch (RuntimeException diagnosticsFailure) {
            droppedDiagnostics.incrementAndGet();
        }
    }

    /**
     * 백오프 대기.
     *
     * @throws RetryInterruptedException 대기 중 인터럽트 발생 시
     */
    private void pause(AttemptState state, Exception failure, Duration delay) {
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RetryInterruptedException(state.attemptNumber(), e, failure);
        }
    }

    private static String describe(Exception failure) {
        String message = failure.getMessage();
        return message == null ? failure.getClass().getName() : message;
    }

    static String truncate(String message) {
        if (message.length() <= MAX_LOGGED_MESSAGE_LENGTH) {
            return message;
        }
        return message.substring(0, MAX_LOGGED_MESSAGE_LENGTH) + "...";
    }

    static String formatSeconds(Duration delay) {
        return String.format(Locale.ROOT, "%.2f", delay.toNanos() / 1_000_000_000.0);
    }
}
