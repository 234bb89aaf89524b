/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.resilientbroker.common.config;

import com.resilientbroker.common.exception.InvalidConfigurationException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BrokerClientPropertiesTest {

    @Test
    void loadsClasspathResourceWithTypedGetters() {
        BrokerClientProperties props = BrokerClientProperties.loadClasspath("broker-client-test.properties");

        assertThat(props.getString("broker.host")).isEqualTo("rabbit.internal");
        assertThat(props.getInt("broker.port", 0)).isEqualTo(5672);
        assertThat(props.getInt("broker.consumer.workers", 1)).isEqualTo(4);
        assertThat(props.getBoolean("broker.publish.confirms", false)).isTrue();
        assertThat(props.getDuration("broker.connect-timeout", Duration.ZERO)).isEqualTo(Duration.ofSeconds(5));
        assertThat(props.getDuration("broker.heartbeat", Duration.ZERO)).isEqualTo(Duration.ofSeconds(20));
    }

    @Test
    void missingResourceYieldsDefaults() {
        BrokerClientProperties props = BrokerClientProperties.loadClasspath("does-not-exist.properties");

        assertThat(props.getString("broker.host", "localhost")).isEqualTo("localhost");
        assertThat(props.getInt("broker.port", 5672)).isEqualTo(5672);
    }

    @Test
    void placeholderFallsBackToDefault() {
        BrokerClientProperties props = BrokerClientProperties.loadClasspath("broker-client-test.properties");

        assertThat(props.getString("broker.consumer.queue")).isEqualTo("orders");
    }

    @Test
    void placeholderResolvesAgainstOtherKeys() {
        BrokerClientProperties props = BrokerClientProperties.fromMap(Map.of(
                "broker.dlq.base", "orders",
                "broker.dlq.routing-key", "${broker.dlq.base}.dlq"));

        assertThat(props.getString("broker.dlq.routing-key")).isEqualTo("orders.dlq");
    }

    @Test
    void unresolvedPlaceholderFails() {
        assertThatThrownBy(() -> BrokerClientProperties.fromMap(Map.of("broker.password", "${RB_TEST_NO_SUCH_KEY}")))
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessageContaining("RB_TEST_NO_SUCH_KEY");
    }

    @Test
    void systemPropertyOverridesLoadedValue() {
        System.setProperty("broker.test.override", "from-jvm");
        try {
            BrokerClientProperties props = BrokerClientProperties.fromMap(Map.of("broker.test.override", "from-file"));

            assertThat(props.getString("broker.test.override")).isEqualTo("from-jvm");
        } finally {
            System.clearProperty("broker.test.override");
        }
    }

    @Test
    void parsesDurationFormats() {
        BrokerClientProperties props = BrokerClientProperties.fromMap(Map.of(
                "a", "250ms",
                "b", "30s",
                "c", "5m",
                "d", "2h",
                "e", "1500",
                "f", "PT0.5S"));

        assertThat(props.getDuration("a", null)).isEqualTo(Duration.ofMillis(250));
        assertThat(props.getDuration("b", null)).isEqualTo(Duration.ofSeconds(30));
        assertThat(props.getDuration("c", null)).isEqualTo(Duration.ofMinutes(5));
        assertThat(props.getDuration("d", null)).isEqualTo(Duration.ofHours(2));
        assertThat(props.getDuration("e", null)).isEqualTo(Duration.ofMillis(1500));
        assertThat(props.getDuration("f", null)).isEqualTo(Duration.ofMillis(500));
        assertThat(props.getDuration("missing", Duration.ofSeconds(1))).isEqualTo(Duration.ofSeconds(1));
    }

    @Test
    void malformedValuesFailWithConfigurationError() {
        BrokerClientProperties props = BrokerClientProperties.fromMap(Map.of(
                "broker.port", "amqp",
                "broker.heartbeat", "soon"));

        assertThatThrownBy(() -> props.getInt("broker.port", 0))
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessageContaining("broker.port");
        assertThatThrownBy(() -> props.getDuration("broker.heartbeat", null))
                .isInstanceOf(InvalidConfigurationException.class);
    }

    @Test
    void subPropertiesStripPrefix() {
        BrokerClientProperties props = BrokerClientProperties.loadClasspath("broker-client-test.properties");

        Map<String, String> args = props.getSubProperties("broker.consumer.args.");

        assertThat(args).containsOnly(
                Map.entry("x-priority", "5"),
                Map.entry("x-stream-offset", "first"));
        assertThat(props.hasProperty("broker.consumer.args.x-priority")).isTrue();
    }
}
