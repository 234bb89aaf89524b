/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.resilientbroker.messaging.topology;

import com.rabbitmq.client.BuiltinExchangeType;
import com.resilientbroker.common.exception.InvalidConfigurationException;

import java.util.Map;

/** Exchange declaration parameters. */
public record ExchangeSpec(String name, BuiltinExchangeType type, boolean durable, boolean autoDelete,
                           boolean internal, Map<String, Object> arguments) {

    public ExchangeSpec {
        if (name == null || name.isEmpty()) {
            throw new InvalidConfigurationException("The default exchange cannot be declared");
        }
        if (type == null) type = BuiltinExchangeType.DIRECT;
        arguments = arguments == null ? Map.of() : Map.copyOf(arguments);
    }

    /** A durable, non-internal exchange of the given type. */
    public static ExchangeSpec durable(String name, BuiltinExchangeType type) {
        return new ExchangeSpec(name, type, true, false, false, Map.of());
    }
}
