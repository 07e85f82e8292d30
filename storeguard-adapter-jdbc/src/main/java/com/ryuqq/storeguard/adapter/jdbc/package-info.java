/**
 * JDBC Adapter - 커넥션/트랜잭션 범위 재시도 템플릿.
 *
 * <ul>
 *   <li>{@link com.ryuqq.storeguard.adapter.jdbc.JdbcStoreTemplate} - 프리셋 기반 실행 템플릿</li>
 *   <li>{@link com.ryuqq.storeguard.adapter.jdbc.ConnectionSource} - 시도별 커넥션 공급자</li>
 *   <li>{@link com.ryuqq.storeguard.adapter.jdbc.ConnectionCallback} - 작업 단위</li>
 * </ul>
 *
 * @author StoreGuard Team
 * @since 1.0.0
 */
package com.ryuqq.storeguard.adapter.jdbc;
