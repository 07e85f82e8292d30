package com.ryuqq.storeguard.core.failure;

/**
 * 저장소 실패의 타입 수준 분류.
 *
 * <p>드라이버의 예외 계층을 그대로 옮긴 닫힌 분류입니다.
 * {@link #DATABASE}가 데이터베이스 계열의 루트이며, 나머지 데이터베이스 카테고리는
 * 모두 {@link #DATABASE}의 하위 카테고리입니다.</p>
 *
 * <pre>
 * DATABASE
 *   ├── OPERATIONAL   (잠금, busy, I/O, 누락된 테이블/컬럼)
 *   ├── INTEGRITY     (제약 조건 위반)
 *   ├── DATA          (잘못된 데이터 값)
 *   └── PROGRAMMING   (API 오용, 드라이버가 거부한 구문)
 * UNCATEGORIZED       (저장소 실패가 아닌 모든 예외)
 * </pre>
 *
 * <p>RetryPolicy의 재시도 대상 카테고리 집합은 {@link #isA(FailureCategory)}로
 * 계층적으로 매칭됩니다. 즉 {@code DATABASE}를 재시도 대상으로 지정하면
 * {@code INTEGRITY} 실패도 재시도 대상이 됩니다.</p>
 *
 * @author StoreGuard Team
 * @since 1.0.0
 */
public enum FailureCategory {

    /**
     * 데이터베이스 수준의 일반 실패 (계열 루트).
     */
    DATABASE(null),

    /**
     * 저장소의 일반 운영 실패.
     *
     * <p>잠금 충돌, busy 상태, 누락된 테이블 등 하나의 예외 타입이 일시적/영구적 실패를
     * 모두 포함하므로 메시지 검사가 필요한 유일한 카테고리입니다.</p>
     */
    OPERATIONAL(DATABASE),

    /**
     * 무결성 제약 조건 위반.
     */
    INTEGRITY(DATABASE),

    /**
     * 잘못된 데이터 값 (범위 초과, 형 변환 실패 등).
     */
    DATA(DATABASE),

    /**
     * 프로그래밍 오류 (구문 오류, 지원하지 않는 기능, API 오용).
     */
    PROGRAMMING(DATABASE),

    /**
     * 저장소 실패가 아닌 예외 (로직 오류, NPE 등).
     */
    UNCATEGORIZED(null);

    private final FailureCategory parent;

    FailureCategory(FailureCategory parent) {
        this.parent = parent;
    }

    /**
     * 상위 카테고리 조회.
     *
     * @return 상위 카테고리, 루트인 경우 null
     */
    public FailureCategory parent() {
        return parent;
    }

    /**
     * 이 카테고리가 주어진 카테고리와 같거나 그 하위 카테고리인지 확인.
     *
     * @param other 비교할 카테고리
     * @return 같거나 하위 카테고리이면 true
     * @throws IllegalArgumentException other가 null인 경우
     */
    public boolean isA(FailureCategory other) {
        if (other == null) {
            throw new IllegalArgumentException("other cannot be null");
        }
        for (FailureCategory current = this; current != null; current = current.parent) {
            if (current == other) {
                return true;
            }
        }
        return false;
    }

    /**
     * 데이터베이스 계열 카테고리인지 확인.
     *
     * @return DATABASE 또는 그 하위 카테고리이면 true
     */
    public boolean isStoreFailure() {
        return isA(DATABASE);
    }
}
