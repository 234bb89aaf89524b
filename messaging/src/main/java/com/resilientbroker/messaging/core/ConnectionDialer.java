/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.resilientbroker.messaging.core;

import com.rabbitmq.client.Connection;

import java.io.IOException;
import java.util.concurrent.TimeoutException;

/**
 * Opens one physical broker connection. Each call returns a new connection.
 */
@FunctionalInterface
public interface ConnectionDialer {

    Connection dial() throws IOException, TimeoutException;

    /** Target description for log messages; must not include credentials. */
    default String describe() {
        return "broker";
    }
}
