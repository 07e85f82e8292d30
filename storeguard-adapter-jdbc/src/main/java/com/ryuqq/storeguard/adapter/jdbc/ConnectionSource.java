package com.ryuqq.storeguard.adapter.jdbc;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * 시도마다 새 커넥션을 여는 공급자.
 *
 * <p>커넥션 풀링은 이 모듈의 책임이 아닙니다. {@code DataSource::getConnection}이나
 * {@code () -> DriverManager.getConnection(url)}을 그대로 넘기면 됩니다.</p>
 *
 * @author StoreGuard Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface ConnectionSource {

    /**
     * 커넥션 열기.
     *
     * @return 새 커넥션 (호출자가 닫음)
     * @throws SQLException 커넥션을 열 수 없는 경우
     */
    Connection open() throws SQLException;
}
