package com.ryuqq.storeguard.adapter.jdbc;

import com.ryuqq.storeguard.runner.RetryExecutor;
import com.ryuqq.storeguard.runner.StoreRetries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * JDBC 작업 단위를 재시도 프리셋 아래에서 실행하는 템플릿.
 *
 * <p><strong>동작 방식:</strong></p>
 * <ul>
 *   <li>{@link #withConnection}: 시도마다 커넥션 열기 → 콜백 → 닫기 (커넥션 범위 프리셋)</li>
 *   <li>{@link #inTransaction}: 시도마다 커넥션 열기 → autoCommit 해제 → 콜백 → commit,
 *       실패 시 rollback 후 원래 예외 전파 → autoCommit 복원 → 닫기 (트랜잭션 범위 프리셋)</li>
 * </ul>
 *
 * <p>잠금 충돌로 실패한 트랜잭션은 롤백된 뒤 새 커넥션에서 처음부터 다시 실행되므로
 * 부분 커밋이 남지 않습니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * JdbcStoreTemplate template = new JdbcStoreTemplate(dataSource::getConnection);
 *
 * template.inTransaction(conn -> {
 *     try (PreparedStatement ps = conn.prepareStatement(
 *             "UPDATE content_index SET status = ? WHERE hash = ?")) {
 *         ps.setString(1, "completed");
 *         ps.setString(2, hash);
 *         return ps.executeUpdate();
 *     }
 * });
 * }</pre>
 *
 * @author StoreGuard Team
 * @since 1.0.0
 */
public final class JdbcStoreTemplate {

    private static final Logger log = LoggerFactory.getLogger(JdbcStoreTemplate.class);

    private final ConnectionSource connectionSource;
    private final RetryExecutor connectionExecutor;
    private final RetryExecutor transactionExecutor;

    /**
     * 생성자 (기본 프리셋 실행자 사용).
     *
     * @param connectionSource 커넥션 공급자
     * @throws IllegalArgumentException connectionSource가 null인 경우
     */
    public JdbcStoreTemplate(ConnectionSource connectionSource) {
        this(connectionSource, StoreRetries.connection(), StoreRetries.transactional());
    }

    /**
     * 생성자 (실행자 주입).
     *
     * @param connectionSource 커넥션 공급자
     * @param connectionExecutor 커넥션 범위 실행자
     * @param transactionExecutor 트랜잭션 범위 실행자
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public JdbcStoreTemplate(ConnectionSource connectionSource,
                             RetryExecutor connectionExecutor,
                             RetryExecutor transactionExecutor) {
        if (connectionSource == null) {
            throw new IllegalArgumentException("connectionSource cannot be null");
        }
        if (connectionExecutor == null) {
            throw new IllegalArgumentException("connectionExecutor cannot be null");
        }
        if (transactionExecutor == null) {
            throw new IllegalArgumentException("transactionExecutor cannot be null");
        }
        this.connectionSource = connectionSource;
        this.connectionExecutor = connectionExecutor;
        this.transactionExecutor = transactionExecutor;
    }

    /**
     * 커넥션 범위 실행.
     *
     * @param callback 작업 단위
     * @param <T> 결과 타입
     * @return 작업 결과
     * @throws SQLException 마지막 실패 (원본 그대로)
     * @throws IllegalArgumentException callback이 null인 경우
     */
    public <T> T withConnection(ConnectionCallback<T> callback) throws SQLException {
        if (callback == null) {
            throw new IllegalArgumentException("callback cannot be null");
        }
        return connectionExecutor.invoke(() -> {
            try (Connection connection = connectionSource.open()) {
                return callback.doInConnection(connection);
            }
        });
    }

    /**
     * 트랜잭션 범위 실행.
     *
     * @param callback 작업 단위 (한 트랜잭션)
     * @param <T> 결과 타입
     * @return 커밋된 작업 결과
     * @throws SQLException 마지막 실패 (원본 그대로, rollback 실패는 suppressed로 첨부)
     * @throws IllegalArgumentException callback이 null인 경우
     */
    public <T> T inTransaction(ConnectionCallback<T> callback) throws SQLException {
        if (callback == null) {
            throw new IllegalArgumentException("callback cannot be null");
        }
        return transactionExecutor.invoke(() -> runInTransaction(callback));
    }

    /**
     * 트랜잭션 한 번 실행 (재시도 없음).
     */
    private <T> T runInTransaction(ConnectionCallback<T> callback) throws SQLException {
        try (Connection connection = connectionSource.open()) {
            boolean previousAutoCommit = connection.getAutoCommit();
            connection.setAutoCommit(false);
            try {
                T result = callback.doInConnection(connection);
                connection.commit();
                return result;
            } catch (SQLException | RuntimeException | Error e) {
                rollback(connection, e);
                throw e;
            } finally {
                restoreAutoCommit(connection, previousAutoCommit);
            }
        }
    }

    /**
     * Rollback (실패 시 원래 예외에 suppressed로 첨부).
     */
    private void rollback(Connection connection, Throwable failure) {
        try {
            connection.rollback();
        } catch (SQLException rollbackFailure) {
            failure.addSuppressed(rollbackFailure);
        }
    }

    /**
     * autoCommit 복원.
     *
     * <p>복원 실패가 원래 결과나 예외를 덮어쓰지 않도록 로그만 남깁니다.
     * 커넥션은 곧바로 닫힙니다.</p>
     */
    private void restoreAutoCommit(Connection connection, boolean previousAutoCommit) {
        try {
            connection.setAutoCommit(previousAutoCommit);
        } catch (SQLException e) {
            log.warn("Failed to restore autoCommit={} before closing connection", previousAutoCommit, e);
        }
    }
}
