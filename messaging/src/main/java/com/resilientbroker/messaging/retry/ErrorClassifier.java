/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.resilientbroker.messaging.retry;

/**
 * Maps a failure to an {@link ErrorClass}. Implementations must be thread-safe.
 */
@FunctionalInterface
public interface ErrorClassifier {

    ErrorClass classify(Throwable error);

    default boolean isRetryable(Throwable error) {
        return classify(error) == ErrorClass.RETRYABLE;
    }
}
