package com.ryuqq.storeguard.core.failure;

/**
 * 개별 실패에 대한 판정 결과.
 *
 * <p>{@link FailureCategory}가 예외 타입만 보고 정해지는 것과 달리,
 * ErrorKind는 카테고리와 메시지 내용을 함께 보고 실패마다 새로 계산됩니다.
 * 저장되지 않으며 같은 실패 객체에 대해 항상 같은 값을 반환합니다.</p>
 *
 * @author StoreGuard Team
 * @since 1.0.0
 */
public enum ErrorKind {

    /**
     * 일시적 경합.
     *
     * <p>다른 writer가 잠금을 보유 중이거나, 테이블이 잠겼거나,
     * 이미 열린 트랜잭션 안에서 트랜잭션을 시작하려 한 경우.
     * 개입 없이 해소될 것으로 기대합니다.</p>
     */
    TRANSIENT_CONTENTION(true),

    /**
     * 스키마/구문 결함.
     *
     * <p>누락된 테이블이나 컬럼, 잘못된 구문. 재시도로 고칠 수 없습니다.</p>
     */
    SCHEMA_OR_SYNTAX_FAULT(false),

    /**
     * 알려진 패턴에 해당하지 않는 데이터베이스 계열 실패.
     */
    OTHER_OPERATIONAL(true),

    /**
     * 저장소 실패가 아닌 예외.
     */
    UNCLASSIFIED(false);

    private final boolean possiblyTransient;

    ErrorKind(boolean possiblyTransient) {
        this.possiblyTransient = possiblyTransient;
    }

    /**
     * 재시도로 해소될 가능성이 있는 종류인지 확인.
     *
     * <p>실제 재시도 여부는 RetryPolicy의 카테고리 집합과 함께 결정됩니다.</p>
     *
     * @return 일시적일 수 있으면 true
     */
    public boolean isPossiblyTransient() {
        return possiblyTransient;
    }
}
