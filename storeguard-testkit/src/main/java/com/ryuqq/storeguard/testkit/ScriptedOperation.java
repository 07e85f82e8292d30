package com.ryuqq.storeguard.testkit;

import com.ryuqq.storeguard.core.operation.StoreOperation;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Store operation that fails a scripted number of times before returning a value.
 *
 * <p>Each failure comes from the supplier, so every invocation throws a fresh instance.
 * Thrown failures are kept in order to assert which one was propagated.</p>
 *
 * <pre>{@code
 * ScriptedOperation<String> op =
 *     ScriptedOperation.failingThenReturning(2, StoreFailures::databaseLocked, "ok");
 * }</pre>
 *
 * @param <T> result type
 *
 * @author StoreGuard Team
 * @since 1.0.0
 */
public final class ScriptedOperation<T> implements StoreOperation<T, SQLException> {

    private final int failuresBeforeSuccess;
    private final Supplier<? extends Exception> failureSupplier;
    private final T result;
    private final AtomicInteger invocations = new AtomicInteger();
    private final List<Exception> thrown = Collections.synchronizedList(new ArrayList<>());

    private ScriptedOperation(int failuresBeforeSuccess, Supplier<? extends Exception> failureSupplier, T result) {
        if (failuresBeforeSuccess < 0) {
            throw new IllegalArgumentException(
                "failuresBeforeSuccess must be non-negative (current: " + failuresBeforeSuccess + ")"
            );
        }
        if (failureSupplier == null) {
            throw new IllegalArgumentException("failureSupplier cannot be null");
        }
        this.failuresBeforeSuccess = failuresBeforeSuccess;
        this.failureSupplier = failureSupplier;
        this.result = result;
    }

    /**
     * Fails {@code failures} times, then returns {@code result} on every later call.
     */
    public static <T> ScriptedOperation<T> failingThenReturning(
            int failures, Supplier<? extends Exception> failureSupplier, T result) {
        return new ScriptedOperation<>(failures, failureSupplier, result);
    }

    /**
     * Never succeeds.
     */
    public static <T> ScriptedOperation<T> alwaysFailing(Supplier<? extends Exception> failureSupplier) {
        return new ScriptedOperation<>(Integer.MAX_VALUE, failureSupplier, null);
    }

    /**
     * Succeeds on the first call.
     */
    public static <T> ScriptedOperation<T> succeeding(T result) {
        return new ScriptedOperation<>(0, () -> new IllegalStateException("unreachable"), result);
    }

    @Override
    public T execute() throws SQLException {
        int invocation = invocations.incrementAndGet();
        if (invocation > failuresBeforeSuccess) {
            return result;
        }

        Exception failure = failureSupplier.get();
        thrown.add(failure);
        if (failure instanceof SQLException) {
            throw (SQLException) failure;
        }
        if (failure instanceof RuntimeException) {
            throw (RuntimeException) failure;
        }
        throw new IllegalStateException("Scripted failure must be SQLException or RuntimeException: " + failure);
    }

    public int invocations() {
        return invocations.get();
    }

    /**
     * Failures thrown so far, oldest first.
     */
    public List<Exception> thrown() {
        synchronized (thrown) {
            return List.copyOf(thrown);
        }
    }

    /**
     * Most recently thrown failure.
     *
     * @throws IllegalStateException if nothing was thrown yet
     */
    public Exception lastThrown() {
        synchronized (thrown) {
            if (thrown.isEmpty()) {
                throw new IllegalStateException("No failure thrown yet");
            }
            return thrown.get(thrown.size() - 1);
        }
    }
}
