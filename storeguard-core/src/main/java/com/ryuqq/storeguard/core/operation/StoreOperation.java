package com.ryuqq.storeguard.core.operation;

/**
 * 인자 없는 저장소 작업 하나.
 *
 * <p>재시도 시 처음부터 다시 호출되므로 멱등이거나 안전하게 재진입 가능해야 합니다.
 * 이는 호출자가 지켜야 하는 계약이며 실행자가 강제하지 않습니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * StoreOperation<Boolean, SQLException> hasContent = () -> {
 *     try (Connection conn = dataSource.getConnection();
 *          PreparedStatement ps = conn.prepareStatement("SELECT 1 FROM content_index WHERE hash = ?")) {
 *         ps.setString(1, hash);
 *         try (ResultSet rs = ps.executeQuery()) {
 *             return rs.next();
 *         }
 *     }
 * };
 * }</pre>
 *
 * @param <T> 결과 타입
 * @param <E> 작업이 던지는 검사 예외 타입 (없으면 RuntimeException)
 *
 * @author StoreGuard Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface StoreOperation<T, E extends Exception> {

    /**
     * 작업 실행.
     *
     * @return 작업 결과
     * @throws E 저장소 실패
     */
    T execute() throws E;
}
