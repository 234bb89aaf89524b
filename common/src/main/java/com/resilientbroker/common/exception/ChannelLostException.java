/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.resilientbroker.common.exception;

/**
 * A session became unusable because the underlying connection dropped
 * or the broker closed the channel. Retryable.
 */
public class ChannelLostException extends BrokerClientException {
    public ChannelLostException(String message) {
        super("BRK_CHANNEL_LOST", message);
    }

    public ChannelLostException(String message, Throwable cause) {
        super("BRK_CHANNEL_LOST", message, cause);
    }
}
