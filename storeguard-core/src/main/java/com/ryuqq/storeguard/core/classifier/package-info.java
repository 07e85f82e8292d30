/**
 * Error Classification - 재시도/즉시 전파 판정.
 *
 * <ul>
 *   <li>{@link com.ryuqq.storeguard.core.classifier.ErrorClassifier} - 판정 SPI</li>
 *   <li>{@link com.ryuqq.storeguard.core.classifier.MessagePatternErrorClassifier} - 카테고리 + 메시지 패턴 기본 구현</li>
 * </ul>
 *
 * @author StoreGuard Team
 * @since 1.0.0
 */
package com.ryuqq.storeguard.core.classifier;
