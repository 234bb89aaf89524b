/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.resilientbroker.common.exception;

/**
 * Raised at construction time when a configuration value is out of range.
 */
public class InvalidConfigurationException extends BrokerClientException {
    public InvalidConfigurationException(String message) {
        super("BRK_INVALID_CONFIG", message);
    }

    public InvalidConfigurationException(String message, Throwable cause) {
        super("BRK_INVALID_CONFIG", message, cause);
    }
}
