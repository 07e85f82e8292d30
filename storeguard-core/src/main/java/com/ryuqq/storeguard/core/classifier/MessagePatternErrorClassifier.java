package com.ryuqq.storeguard.core.classifier;

import com.ryuqq.storeguard.core.failure.ErrorKind;
import com.ryuqq.storeguard.core.failure.FailureCategorizer;
import com.ryuqq.storeguard.core.failure.FailureCategory;
import com.ryuqq.storeguard.core.failure.SqlFailureCategorizer;
import com.ryuqq.storeguard.core.policy.RetryPolicy;

import java.util.List;
import java.util.Locale;

/**
 * 카테고리 + 메시지 패턴 기반 ErrorClassifier.
 *
 * <p>하나의 예외 타입이 "디스크 가득 참"과 "테이블 잠김"을 모두 포함하므로 카테고리만으로는
 * 너무 거칩니다. 재시도 대상 카테고리의 실패는 메시지를 검사하여 둘을 구분합니다.</p>
 *
 * <p><strong>판정 알고리즘 ({@link #shouldRetry}):</strong></p>
 * <ol>
 *   <li>카테고리가 정책의 재시도 대상이 아니면 → false (로직 오류는 절대 재시도하지 않음)</li>
 *   <li>메시지에 경합 문구가 있으면 → true</li>
 *   <li>PROGRAMMING 카테고리이거나 메시지에 치명 문구가 있으면 → false (스키마/구문 결함)</li>
 *   <li>그 외 → true (재시도 대상 카테고리의 낯선 실패는 일시적일 수 있다고 가정)</li>
 * </ol>
 *
 * <p><strong>문구 (대소문자 무시):</strong></p>
 * <ul>
 *   <li>경합: "database is locked", "database table is locked",
 *       "cannot start a transaction within a transaction"</li>
 *   <li>치명: "no such table", "no such column", "syntax error"</li>
 * </ul>
 *
 * @author StoreGuard Team
 * @since 1.0.0
 */
public final class MessagePatternErrorClassifier implements ErrorClassifier {

    static final List<String> CONTENTION_PHRASES = List.of(
        "database is locked",
        "database table is locked",
        "cannot start a transaction within a transaction"
    );

    static final List<String> FATAL_PHRASES = List.of(
        "no such table",
        "no such column",
        "syntax error"
    );

    private final FailureCategorizer categorizer;

    /**
     * 생성자 (기본 SqlFailureCategorizer 사용).
     */
    public MessagePatternErrorClassifier() {
        this(new SqlFailureCategorizer());
    }

    /**
     * 생성자 (커스텀 FailureCategorizer 주입).
     *
     * @param categorizer 실패 카테고리 매퍼
     * @throws IllegalArgumentException categorizer가 null인 경우
     */
    public MessagePatternErrorClassifier(FailureCategorizer categorizer) {
        if (categorizer == null) {
            throw new IllegalArgumentException("categorizer cannot be null");
        }
        this.categorizer = categorizer;
    }

    @Override
    public ErrorKind classify(Throwable failure) {
        if (failure == null) {
            throw new IllegalArgumentException("failure cannot be null");
        }
        FailureCategory category = categorizer.categorize(failure);
        if (!category.isStoreFailure()) {
            return ErrorKind.UNCLASSIFIED;
        }
        return classifyStoreFailure(failure, category);
    }

    @Override
    public boolean shouldRetry(Throwable failure, RetryPolicy policy) {
        if (failure == null) {
            throw new IllegalArgumentException("failure cannot be null");
        }
        if (policy == null) {
            throw new IllegalArgumentException("policy cannot be null");
        }

        // 1. 카테고리 fast path
        FailureCategory category = categorizer.categorize(failure);
        if (!policy.isRetryableCategory(category)) {
            return false;
        }

        // 2~4. 재시도 대상 카테고리라도 스키마/구문 결함은 즉시 실패
        return classifyStoreFailure(failure, category) != ErrorKind.SCHEMA_OR_SYNTAX_FAULT;
    }

    /**
     * 저장소 실패의 종류 판정.
     *
     * <p>경합 문구가 가장 우선합니다. 드라이버가 잘못된 구문으로 보고한 실패(PROGRAMMING)는
     * 메시지와 무관하게 스키마/구문 결함입니다.</p>
     */
    private ErrorKind classifyStoreFailure(Throwable failure, FailureCategory category) {
        String message = normalizedMessage(failure);
        if (containsAny(message, CONTENTION_PHRASES)) {
            return ErrorKind.TRANSIENT_CONTENTION;
        }
        if (category == FailureCategory.PROGRAMMING || containsAny(message, FATAL_PHRASES)) {
            return ErrorKind.SCHEMA_OR_SYNTAX_FAULT;
        }
        return ErrorKind.OTHER_OPERATIONAL;
    }

    private static String normalizedMessage(Throwable failure) {
        String message = failure.getMessage();
        return message == null ? "" : message.toLowerCase(Locale.ROOT);
    }

    private static boolean containsAny(String message, List<String> phrases) {
        for (String phrase : phrases) {
            if (message.contains(phrase)) {
                return true;
            }
        }
        return false;
    }
}
