package com.ryuqq.storeguard.adapter.jdbc;

import com.ryuqq.storeguard.core.classifier.MessagePatternErrorClassifier;
import com.ryuqq.storeguard.core.policy.RetryPresets;
import com.ryuqq.storeguard.runner.RetryExecutor;
import com.ryuqq.storeguard.testkit.RecordingSleeper;
import com.ryuqq.storeguard.testkit.StoreFailures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

/**
 * JdbcStoreTemplate 유닛 테스트.
 *
 * <p>JDBC 커넥션/트랜잭션 범위 동작을 검증합니다:</p>
 * <ul>
 *   <li>시도마다 새 커넥션, 항상 close</li>
 *   <li>트랜잭션: commit 또는 rollback, autoCommit 복원</li>
 *   <li>잠금 충돌은 rollback 후 새 트랜잭션으로 재시도</li>
 *   <li>rollback 실패는 원래 예외의 suppressed로 첨부</li>
 * </ul>
 *
 * @author StoreGuard Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class JdbcStoreTemplateTest {

    @Mock
    private ConnectionSource connectionSource;

    @Mock
    private Connection firstConnection;

    @Mock
    private Connection secondConnection;

    private RecordingSleeper sleeper;
    private JdbcStoreTemplate template;

    @BeforeEach
    void setUp() {
        sleeper = new RecordingSleeper();
        MessagePatternErrorClassifier classifier = new MessagePatternErrorClassifier();
        template = new JdbcStoreTemplate(
            connectionSource,
            new RetryExecutor(RetryPresets.connectionScope(), classifier, sleeper),
            new RetryExecutor(RetryPresets.transactionScope(), classifier, sleeper)
        );
    }

    // ============================================================
    // 1. 커넥션 범위
    // ============================================================

    @Test
    void withConnection_성공시_결과_반환_후_close() throws SQLException {
        // given
        when(connectionSource.open()).thenReturn(firstConnection);

        // when
        String result = template.withConnection(connection -> {
            assertThat(connection).isSameAs(firstConnection);
            return "indexed";
        });

        // then
        assertThat(result).isEqualTo("indexed");
        verify(firstConnection).close();
        assertThat(sleeper.delays()).isEmpty();
    }

    @Test
    void withConnection_잠금시_새_커넥션으로_재시도() throws SQLException {
        // given
        when(connectionSource.open()).thenReturn(firstConnection, secondConnection);
        AtomicInteger calls = new AtomicInteger();

        // when
        Integer result = template.withConnection(connection -> {
            if (calls.getAndIncrement() == 0) {
                throw StoreFailures.databaseLocked();
            }
            return 7;
        });

        // then
        assertThat(result).isEqualTo(7);
        verify(firstConnection).close();
        verify(secondConnection).close();
        assertThat(sleeper.delays()).containsExactly(Duration.ofMillis(100));
    }

    @Test
    void withConnection_커넥션_열기_실패도_재시도() throws SQLException {
        // given
        when(connectionSource.open())
            .thenThrow(StoreFailures.databaseLocked())
            .thenReturn(firstConnection);

        // when
        String result = template.withConnection(connection -> "opened");

        // then
        assertThat(result).isEqualTo("opened");
        verify(connectionSource, times(2)).open();
    }

    @Test
    void withConnection_복구불가_즉시_전파() throws SQLException {
        // given
        when(connectionSource.open()).thenReturn(firstConnection);
        SQLException missing = StoreFailures.noSuchTable("content_index");

        // when & then
        assertThatThrownBy(() -> template.withConnection(connection -> {
            throw missing;
        })).isSameAs(missing);
        verify(connectionSource, times(1)).open();
        verify(firstConnection).close();
    }

    // ============================================================
    // 2. 트랜잭션 범위
    // ============================================================

    @Test
    void inTransaction_성공시_commit_후_autoCommit_복원() throws SQLException {
        // given
        when(connectionSource.open()).thenReturn(firstConnection);
        when(firstConnection.getAutoCommit()).thenReturn(true);

        // when
        String result = template.inTransaction(connection -> "committed");

        // then
        assertThat(result).isEqualTo("committed");
        InOrder inOrder = inOrder(firstConnection);
        inOrder.verify(firstConnection).setAutoCommit(false);
        inOrder.verify(firstConnection).commit();
        inOrder.verify(firstConnection).setAutoCommit(true);
        inOrder.verify(firstConnection).close();
        verify(firstConnection, never()).rollback();
    }

    @Test
    void inTransaction_잠금시_rollback_후_새_트랜잭션으로_재시도() throws SQLException {
        // given
        when(connectionSource.open()).thenReturn(firstConnection, secondConnection);
        when(firstConnection.getAutoCommit()).thenReturn(true);
        when(secondConnection.getAutoCommit()).thenReturn(true);
        AtomicInteger calls = new AtomicInteger();

        // when
        String result = template.inTransaction(connection -> {
            if (calls.getAndIncrement() == 0) {
                throw StoreFailures.tableLocked();
            }
            return "second try";
        });

        // then
        assertThat(result).isEqualTo("second try");
        verify(firstConnection).rollback();
        verify(firstConnection, never()).commit();
        verify(firstConnection).close();
        verify(secondConnection).commit();
        verify(secondConnection, never()).rollback();
        assertThat(sleeper.delays()).containsExactly(Duration.ofMillis(50));
    }

    @Test
    void inTransaction_복구불가_rollback_후_같은_예외_전파() throws SQLException {
        // given
        when(connectionSource.open()).thenReturn(firstConnection);
        when(firstConnection.getAutoCommit()).thenReturn(true);
        SQLException syntax = StoreFailures.syntaxError("UPDAT");

        // when & then
        assertThatThrownBy(() -> template.inTransaction(connection -> {
            throw syntax;
        })).isSameAs(syntax);
        verify(connectionSource, times(1)).open();
        verify(firstConnection).rollback();
        verify(firstConnection).setAutoCommit(true);
        verify(firstConnection).close();
    }

    @Test
    void inTransaction_rollback_실패는_suppressed로_첨부() throws SQLException {
        // given
        when(connectionSource.open()).thenReturn(firstConnection);
        when(firstConnection.getAutoCommit()).thenReturn(false);
        SQLException rollbackFailure = new SQLException("rollback failed");
        doThrow(rollbackFailure).when(firstConnection).rollback();
        SQLException missing = StoreFailures.noSuchColumn("status");

        // when & then
        assertThatThrownBy(() -> template.inTransaction(connection -> {
            throw missing;
        })).isSameAs(missing);
        assertThat(missing.getSuppressed()).containsExactly(rollbackFailure);
    }

    @Test
    void inTransaction_런타임_예외도_rollback_재시도없음() throws SQLException {
        // given
        when(connectionSource.open()).thenReturn(firstConnection);
        when(firstConnection.getAutoCommit()).thenReturn(true);
        IllegalStateException bug = StoreFailures.logicError();

        // when & then
        assertThatThrownBy(() -> template.inTransaction(connection -> {
            throw bug;
        })).isSameAs(bug);
        verify(firstConnection).rollback();
        verify(connectionSource, times(1)).open();
        assertThat(sleeper.delays()).isEmpty();
    }

    @Test
    void inTransaction_autoCommit_복원_실패해도_결과_유지() throws SQLException {
        // given
        when(connectionSource.open()).thenReturn(firstConnection);
        when(firstConnection.getAutoCommit()).thenReturn(true);
        doNothing().when(firstConnection).setAutoCommit(false);
        doThrow(new SQLException("connection closed")).when(firstConnection).setAutoCommit(true);

        // when
        String result = template.inTransaction(connection -> "kept");

        // then
        assertThat(result).isEqualTo("kept");
        verify(firstConnection).commit();
        verify(firstConnection).close();
    }

    // ============================================================
    // 3. 검증
    // ============================================================

    @Test
    void 생성자_null_의존성_거부() {
        RetryExecutor executor = new RetryExecutor(RetryPresets.connectionScope());

        assertThatThrownBy(() -> new JdbcStoreTemplate(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("connectionSource cannot be null");
        assertThatThrownBy(() -> new JdbcStoreTemplate(connectionSource, null, executor))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("connectionExecutor cannot be null");
        assertThatThrownBy(() -> new JdbcStoreTemplate(connectionSource, executor, null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("transactionExecutor cannot be null");
    }

    @Test
    void null_콜백_거부() {
        assertThatThrownBy(() -> template.withConnection(null))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> template.inTransaction(null))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
