package com.ryuqq.storeguard.core.failure;

import java.sql.SQLClientInfoException;
import java.sql.SQLDataException;
import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;
import java.sql.SQLIntegrityConstraintViolationException;
import java.sql.SQLNonTransientConnectionException;
import java.sql.SQLNonTransientException;
import java.sql.SQLSyntaxErrorException;

/**
 * JDBC 예외 계층 기반 기본 Categorizer.
 *
 * <p><strong>매핑 규칙 (위에서부터 먼저 일치하는 규칙 적용):</strong></p>
 * <ol>
 *   <li>{@link StoreFailure} → 선언된 카테고리</li>
 *   <li>{@link SQLException}이 아닌 예외 → UNCATEGORIZED</li>
 *   <li>{@link SQLIntegrityConstraintViolationException} → INTEGRITY</li>
 *   <li>{@link SQLDataException} → DATA</li>
 *   <li>{@link SQLSyntaxErrorException}, {@link SQLFeatureNotSupportedException},
 *       {@link SQLClientInfoException} → PROGRAMMING</li>
 *   <li>{@link SQLNonTransientConnectionException} → OPERATIONAL</li>
 *   <li>그 밖의 {@link SQLNonTransientException} → DATABASE</li>
 *   <li>나머지 SQLException (transient, recoverable, 하위 타입 없는 SQLException) → OPERATIONAL</li>
 * </ol>
 *
 * <p>임베디드 단일 writer 저장소의 드라이버는 잠금 충돌과 누락된 테이블을 모두
 * 하위 타입 없는 SQLException으로 보고합니다. 둘의 구분은
 * ErrorClassifier의 메시지 검사가 담당합니다.</p>
 *
 * @author StoreGuard Team
 * @since 1.0.0
 */
public final class SqlFailureCategorizer implements FailureCategorizer {

    @Override
    public FailureCategory categorize(Throwable failure) {
        if (failure == null) {
            throw new IllegalArgumentException("failure cannot be null");
        }
        if (failure instanceof StoreFailure) {
            return ((StoreFailure) failure).getCategory();
        }
        if (!(failure instanceof SQLException)) {
            return FailureCategory.UNCATEGORIZED;
        }

        if (failure instanceof SQLIntegrityConstraintViolationException) {
            return FailureCategory.INTEGRITY;
        }
        if (failure instanceof SQLDataException) {
            return FailureCategory.DATA;
        }
        if (failure instanceof SQLSyntaxErrorException
            || failure instanceof SQLFeatureNotSupportedException
            || failure instanceof SQLClientInfoException) {
            return FailureCategory.PROGRAMMING;
        }
        if (failure instanceof SQLNonTransientConnectionException) {
            return FailureCategory.OPERATIONAL;
        }
        if (failure instanceof SQLNonTransientException) {
            return FailureCategory.DATABASE;
        }
        return FailureCategory.OPERATIONAL;
    }
}
