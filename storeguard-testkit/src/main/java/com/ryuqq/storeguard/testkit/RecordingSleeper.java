package com.ryuqq.storeguard.testkit;

import com.ryuqq.storeguard.runner.Sleeper;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Sleeper that records requested delays without sleeping.
 *
 * <p>Can be told to throw {@link InterruptedException} on a given call to exercise
 * interrupt handling.</p>
 *
 * @author StoreGuard Team
 * @since 1.0.0
 */
public final class RecordingSleeper implements Sleeper {

    private final List<Duration> delays = new CopyOnWriteArrayList<>();
    private volatile int interruptOnCall = -1;

    @Override
    public void sleep(Duration delay) throws InterruptedException {
        delays.add(delay);
        if (delays.size() == interruptOnCall) {
            throw new InterruptedException("interrupted by test on sleep #" + interruptOnCall);
        }
    }

    /**
     * Throws on the n-th call (1-based).
     */
    public RecordingSleeper interruptOnCall(int call) {
        if (call < 1) {
            throw new IllegalArgumentException("call must be positive (current: " + call + ")");
        }
        this.interruptOnCall = call;
        return this;
    }

    public List<Duration> delays() {
        return List.copyOf(delays);
    }

    public Duration totalDelay() {
        Duration total = Duration.ZERO;
        for (Duration delay : delays) {
            total = total.plus(delay);
        }
        return total;
    }

    public void clear() {
        delays.clear();
        interruptOnCall = -1;
    }
}
