package com.ryuqq.storeguard.core.policy;

import com.ryuqq.storeguard.core.failure.FailureCategory;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * RetryPolicy Record 테스트.
 *
 * @author StoreGuard Team
 * @since 1.0.0
 */
class RetryPolicyTest {

    @Test
    void constructor_Default_UsesDefaults() {
        // When
        RetryPolicy policy = new RetryPolicy();

        // Then
        assertEquals(5, policy.maxRetries());
        assertEquals(Duration.ofMillis(100), policy.baseDelay());
        assertEquals(Duration.ofSeconds(2), policy.maxDelay());
        assertEquals(2.0, policy.backoffFactor());
        assertEquals(EnumSet.of(FailureCategory.OPERATIONAL), policy.retryableCategories());
        assertEquals(6, policy.maxAttempts());
    }

    @Test
    void constructor_ZeroRetries_CreatesSingleAttemptPolicy() {
        RetryPolicy policy = new RetryPolicy().withMaxRetries(0);

        assertEquals(0, policy.maxRetries());
        assertEquals(1, policy.maxAttempts());
    }

    @Test
    void constructor_NegativeMaxRetries_ThrowsException() {
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> new RetryPolicy().withMaxRetries(-1)
        );
        assertTrue(exception.getMessage().contains("maxRetries must be non-negative"));
    }

    @Test
    void constructor_NullBaseDelay_ThrowsException() {
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> new RetryPolicy().withBaseDelay(null)
        );
        assertTrue(exception.getMessage().contains("baseDelay cannot be null"));
    }

    @Test
    void constructor_ZeroBaseDelay_ThrowsException() {
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> new RetryPolicy().withBaseDelay(Duration.ZERO)
        );
        assertTrue(exception.getMessage().contains("baseDelay must be positive"));
    }

    @Test
    void constructor_MaxDelayBelowBase_ThrowsException() {
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> new RetryPolicy().withMaxDelay(Duration.ofMillis(50))
        );
        assertTrue(exception.getMessage().contains("maxDelay must be >= baseDelay"));
    }

    @Test
    void constructor_MaxDelayBeyondNanosRange_ThrowsException() {
        Duration tooLong = RetryPolicy.MAX_SUPPORTED_DELAY.plusNanos(1);

        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> new RetryPolicy().withMaxDelay(tooLong)
        );
        assertTrue(exception.getMessage().contains("maxDelay must be <="));
    }

    @Test
    void constructor_HugeBaseAndMaxDelay_ThrowsException() {
        Duration centuries = Duration.ofDays(365L * 1000);

        assertThrows(IllegalArgumentException.class,
            () -> new RetryPolicy(1, centuries, centuries, 2.0, EnumSet.of(FailureCategory.OPERATIONAL)));
    }

    @Test
    void constructor_MaxDelayAtNanosLimit_CreatesPolicy() {
        RetryPolicy policy = new RetryPolicy().withMaxDelay(RetryPolicy.MAX_SUPPORTED_DELAY);

        assertEquals(RetryPolicy.MAX_SUPPORTED_DELAY, policy.maxDelay());
    }

    @Test
    void constructor_MaxDelayEqualsBase_CreatesPolicy() {
        RetryPolicy policy = new RetryPolicy().withMaxDelay(Duration.ofMillis(100));

        assertEquals(policy.baseDelay(), policy.maxDelay());
    }

    @Test
    void constructor_BackoffFactorBelowOne_ThrowsException() {
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> new RetryPolicy().withBackoffFactor(0.5)
        );
        assertTrue(exception.getMessage().contains("backoffFactor must be >= 1.0"));
    }

    @Test
    void constructor_NaNBackoffFactor_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> new RetryPolicy().withBackoffFactor(Double.NaN));
    }

    @Test
    void constructor_EmptyCategories_ThrowsException() {
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> new RetryPolicy().withRetryableCategories(Set.of())
        );
        assertTrue(exception.getMessage().contains("retryableCategories cannot be null or empty"));
    }

    @Test
    void constructor_NullCategoryElement_ThrowsException() {
        Set<FailureCategory> categories = new HashSet<>();
        categories.add(FailureCategory.OPERATIONAL);
        categories.add(null);

        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> new RetryPolicy().withRetryableCategories(categories)
        );
        assertTrue(exception.getMessage().contains("cannot contain null"));
    }

    @Test
    void constructor_CategoriesAreCopied() {
        // Given
        Set<FailureCategory> categories = EnumSet.of(FailureCategory.OPERATIONAL);
        RetryPolicy policy = new RetryPolicy().withRetryableCategories(categories);

        // When
        categories.add(FailureCategory.DATABASE);

        // Then
        assertEquals(EnumSet.of(FailureCategory.OPERATIONAL), policy.retryableCategories());
        assertThrows(UnsupportedOperationException.class,
            () -> policy.retryableCategories().add(FailureCategory.DATA));
    }

    @Test
    void isRetryableCategory_ParentListed_MatchesChildren() {
        RetryPolicy policy = new RetryPolicy().withRetryableCategories(EnumSet.of(FailureCategory.DATABASE));

        assertTrue(policy.isRetryableCategory(FailureCategory.OPERATIONAL));
        assertTrue(policy.isRetryableCategory(FailureCategory.INTEGRITY));
        assertTrue(policy.isRetryableCategory(FailureCategory.DATABASE));
        assertFalse(policy.isRetryableCategory(FailureCategory.UNCATEGORIZED));
    }

    @Test
    void isRetryableCategory_ChildListed_DoesNotMatchParent() {
        RetryPolicy policy = new RetryPolicy();

        assertTrue(policy.isRetryableCategory(FailureCategory.OPERATIONAL));
        assertFalse(policy.isRetryableCategory(FailureCategory.DATABASE));
        assertFalse(policy.isRetryableCategory(FailureCategory.PROGRAMMING));
    }

    @Test
    void isRetryableCategory_Null_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> new RetryPolicy().isRetryableCategory(null));
    }

    @Test
    void withMaxRetries_KeepsOtherFields() {
        RetryPolicy original = new RetryPolicy();

        RetryPolicy changed = original.withMaxRetries(2);

        assertEquals(2, changed.maxRetries());
        assertEquals(original.baseDelay(), changed.baseDelay());
        assertEquals(original.maxDelay(), changed.maxDelay());
        assertEquals(original.backoffFactor(), changed.backoffFactor());
        assertEquals(original.retryableCategories(), changed.retryableCategories());
        assertEquals(5, original.maxRetries());
    }

    @Test
    void equals_SameValues_ReturnsTrue() {
        assertEquals(new RetryPolicy(), new RetryPolicy());
        assertEquals(new RetryPolicy().hashCode(), new RetryPolicy().hashCode());
    }
}
