/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.resilientbroker.messaging.topology;

import java.util.HashMap;
import java.util.Map;

/**
 * Queue declaration parameters, with an optional binding.
 *
 * @param name         queue name, {@code ""} to let the broker generate one
 * @param bindExchange exchange to bind to, or {@code null} for no binding
 * @param routingKey   binding key, used only with {@code bindExchange}
 */
public record QueueSpec(String name, boolean durable, boolean exclusive, boolean autoDelete,
                        Map<String, Object> arguments, String bindExchange, String routingKey) {

    public QueueSpec {
        if (name == null) name = "";
        arguments = arguments == null ? Map.of() : Map.copyOf(arguments);
        if (routingKey == null) routingKey = "";
    }

    public static QueueSpec durable(String name) {
        return new QueueSpec(name, true, false, false, Map.of(), null, null);
    }

    public QueueSpec boundTo(String exchange, String key) {
        return new QueueSpec(name, durable, exclusive, autoDelete, arguments, exchange, key);
    }

    public QueueSpec withArgument(String key, Object value) {
        Map<String, Object> merged = new HashMap<>(arguments);
        merged.put(key, value);
        return new QueueSpec(name, durable, exclusive, autoDelete, merged, bindExchange, routingKey);
    }

    public boolean hasBinding() {
        return bindExchange != null && !bindExchange.isEmpty();
    }
}
