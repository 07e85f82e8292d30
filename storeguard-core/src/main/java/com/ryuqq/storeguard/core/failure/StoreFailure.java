package com.ryuqq.storeguard.core.failure;

/**
 * 카테고리를 명시적으로 가진 저장소 실패.
 *
 * <p>JDBC 예외 계층을 쓰지 않는 저장소 드라이버를 감싸는 호출자가
 * 자신의 실패를 분류 체계에 올릴 때 사용합니다.
 * {@link SqlFailureCategorizer}는 이 예외의 카테고리를 그대로 사용합니다.</p>
 *
 * @author StoreGuard Team
 * @since 1.0.0
 */
public class StoreFailure extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final FailureCategory category;

    /**
     * 생성자.
     *
     * @param category 실패 카테고리
     * @param message 실패 메시지
     * @throws IllegalArgumentException category가 null인 경우
     */
    public StoreFailure(FailureCategory category, String message) {
        this(category, message, null);
    }

    /**
     * 생성자 (원인 포함).
     *
     * @param category 실패 카테고리
     * @param message 실패 메시지
     * @param cause 원인 (null 가능)
     * @throws IllegalArgumentException category가 null인 경우
     */
    public StoreFailure(FailureCategory category, String message, Throwable cause) {
        super(message, cause);
        if (category == null) {
            throw new IllegalArgumentException("category cannot be null");
        }
        this.category = category;
    }

    /**
     * OPERATIONAL 카테고리 실패 생성.
     *
     * @param message 실패 메시지
     * @return StoreFailure 인스턴스
     */
    public static StoreFailure operational(String message) {
        return new StoreFailure(FailureCategory.OPERATIONAL, message);
    }

    /**
     * 실패 카테고리 조회.
     *
     * @return 카테고리
     */
    public FailureCategory getCategory() {
        return category;
    }
}
