/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.resilientbroker.messaging.retry;

/**
 * Closed classification of failures. Only {@link #RETRYABLE} is retried.
 */
public enum ErrorClass {
    RETRYABLE,
    FATAL,
    UNKNOWN
}
