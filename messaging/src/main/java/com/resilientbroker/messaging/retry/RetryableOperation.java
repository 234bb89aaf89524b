/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.resilientbroker.messaging.retry;

/**
 * One attempt of a repeatable operation. Must be idempotent or safe to repeat.
 */
@FunctionalInterface
public interface RetryableOperation<T> {
    T call() throws Exception;
}
