/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.resilientbroker.messaging.consume;

import com.resilientbroker.common.exception.BrokerClientException;

/** Thrown by a {@link MessageHandler} for a message that will never succeed (poison message). */
public class PermanentHandlerException extends BrokerClientException {

    public PermanentHandlerException(String message) {
        super("BRK_HANDLER_PERMANENT", message);
    }

    public PermanentHandlerException(String message, Throwable cause) {
        super("BRK_HANDLER_PERMANENT", message, cause);
    }
}
