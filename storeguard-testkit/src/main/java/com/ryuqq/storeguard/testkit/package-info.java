/**
 * Testkit - fixtures for exercising retry behavior without a live store.
 *
 * <ul>
 *   <li>{@link com.ryuqq.storeguard.testkit.ScriptedOperation} - fails k times, then succeeds</li>
 *   <li>{@link com.ryuqq.storeguard.testkit.RecordingSleeper} - records backoff without waiting</li>
 *   <li>{@link com.ryuqq.storeguard.testkit.StoreFailures} - canned driver failures</li>
 *   <li>{@link com.ryuqq.storeguard.testkit.contract.AbstractRetryContractTest} - contract test base</li>
 * </ul>
 *
 * @author StoreGuard Team
 * @since 1.0.0
 */
package com.ryuqq.storeguard.testkit;
