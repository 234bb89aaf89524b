/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.resilientbroker.messaging.consume;

import com.resilientbroker.common.concurrent.CancellationToken;

/**
 * Application callback for consumed messages. Returning normally acknowledges the delivery;
 * throwing triggers retry and, once attempts run out, dead-lettering or rejection.
 *
 * <p>Throw {@link PermanentHandlerException} for failures a retry cannot fix. The token is
 * cancelled when the pool stops; long-running handlers should honour it.</p>
 */
@FunctionalInterface
public interface MessageHandler {

    void handle(Delivery delivery, CancellationToken token) throws Exception;
}
