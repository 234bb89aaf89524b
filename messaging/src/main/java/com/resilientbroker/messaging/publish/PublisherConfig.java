/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.resilientbroker.messaging.publish;

import com.resilientbroker.common.exception.InvalidConfigurationException;
import com.resilientbroker.messaging.retry.RetryPolicy;

import java.time.Duration;

/**
 * Publisher tuning.
 *
 * @param contentType       content type used when a request carries none
 * @param retryPolicy       per-publish retry policy
 * @param publisherConfirms wait for a broker confirm after every send
 * @param confirmTimeout    how long to wait for that confirm
 */
public record PublisherConfig(String contentType, RetryPolicy retryPolicy, boolean publisherConfirms,
                              Duration confirmTimeout) {

    public static final String DEFAULT_CONTENT_TYPE = "application/octet-stream";
    public static final Duration DEFAULT_CONFIRM_TIMEOUT = Duration.ofSeconds(5);

    public PublisherConfig {
        if (contentType == null || contentType.isBlank()) contentType = DEFAULT_CONTENT_TYPE;
        if (retryPolicy == null) retryPolicy = RetryPolicy.defaults();
        if (confirmTimeout == null) confirmTimeout = DEFAULT_CONFIRM_TIMEOUT;
        if (confirmTimeout.isNegative() || confirmTimeout.isZero()) {
            throw new InvalidConfigurationException("confirmTimeout must be positive: " + confirmTimeout);
        }
    }

    public static PublisherConfig defaults() {
        return new PublisherConfig(DEFAULT_CONTENT_TYPE, RetryPolicy.defaults(), false, DEFAULT_CONFIRM_TIMEOUT);
    }

    public PublisherConfig withContentType(String type) {
        return new PublisherConfig(type, retryPolicy, publisherConfirms, confirmTimeout);
    }

    public PublisherConfig withRetryPolicy(RetryPolicy policy) {
        return new PublisherConfig(contentType, policy, publisherConfirms, confirmTimeout);
    }

    public PublisherConfig withConfirms(Duration timeout) {
        return new PublisherConfig(contentType, retryPolicy, true, timeout);
    }
}
