package com.ryuqq.storeguard.runner;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * 백오프 대기 SPI.
 *
 * <p>재시도 루프의 유일한 중단 지점입니다. 기본 구현은 호출 스레드를 블로킹합니다.
 * 테스트에서는 실제로 잠들지 않고 요청된 대기 시간만 기록하는 구현으로 교체합니다.</p>
 *
 * @author StoreGuard Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Sleeper {

    /**
     * 주어진 시간만큼 대기.
     *
     * @param delay 대기 시간 (0이면 즉시 반환)
     * @throws InterruptedException 대기 중 인터럽트 발생 시
     */
    void sleep(Duration delay) throws InterruptedException;

    /**
     * 호출 스레드를 블로킹하는 기본 Sleeper.
     *
     * @return Thread 기반 Sleeper
     */
    static Sleeper threadSleeper() {
        return delay -> {
            if (delay.isNegative() || delay.isZero()) {
                return;
            }
            TimeUnit.NANOSECONDS.sleep(delay.toNanos());
        };
    }
}
