package com.ryuqq.storeguard.adapter.jdbc;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * 커넥션 하나로 수행하는 작업 단위.
 *
 * <p>재시도 시 새 커넥션으로 다시 호출되므로 멱등이어야 합니다.</p>
 *
 * @param <T> 결과 타입
 *
 * @author StoreGuard Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface ConnectionCallback<T> {

    /**
     * 작업 수행.
     *
     * @param connection 이번 시도용 커넥션 (콜백이 닫으면 안 됨)
     * @return 작업 결과
     * @throws SQLException 저장소 실패
     */
    T doInConnection(Connection connection) throws SQLException;
}
