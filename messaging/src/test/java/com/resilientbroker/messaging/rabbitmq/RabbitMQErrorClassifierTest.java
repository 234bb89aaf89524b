/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.resilientbroker.messaging.rabbitmq;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.AlreadyClosedException;
import com.rabbitmq.client.AuthenticationFailureException;
import com.rabbitmq.client.ShutdownSignalException;
import com.resilientbroker.common.exception.ChannelLostException;
import com.resilientbroker.common.exception.ClientClosedException;
import com.resilientbroker.common.exception.ConnectionNotReadyException;
import com.resilientbroker.common.exception.InvalidRequestException;
import com.resilientbroker.messaging.retry.ErrorClass;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.net.ConnectException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;

class RabbitMQErrorClassifierTest {

    private final RabbitMQErrorClassifier classifier = new RabbitMQErrorClassifier();

    private static ShutdownSignalException connectionClosed(int code, boolean byApplication) {
        AMQP.Connection.Close close = new AMQP.Connection.Close.Builder()
                .replyCode(code)
                .replyText("closed with " + code)
                .build();
        return new ShutdownSignalException(true, byApplication, close, null);
    }

    private static ShutdownSignalException channelClosed(int code) {
        AMQP.Channel.Close close = new AMQP.Channel.Close.Builder()
                .replyCode(code)
                .replyText("channel closed with " + code)
                .build();
        return new ShutdownSignalException(false, false, close, null);
    }

    @ParameterizedTest
    @ValueSource(ints = {320, 504, 506, 541})
    void connectionLossCodesAreRetryable(int code) {
        assertEquals(ErrorClass.RETRYABLE, classifier.classify(connectionClosed(code, false)));
    }

    @ParameterizedTest
    @ValueSource(ints = {311, 312, 313, 402, 403, 404, 405, 406, 501, 502, 503, 505, 530, 540})
    void requestErrorCodesAreFatal(int code) {
        assertEquals(ErrorClass.FATAL, classifier.classify(channelClosed(code)));
    }

    @Test
    void unlistedCodeIsUnknown() {
        assertEquals(ErrorClass.UNKNOWN, classifier.classifyReplyCode(999, false));
    }

    @Test
    void normalCloseDependsOnWhoInitiatedIt() {
        assertEquals(ErrorClass.RETRYABLE, classifier.classify(connectionClosed(200, false)));
        assertEquals(ErrorClass.FATAL, classifier.classify(connectionClosed(200, true)));
    }

    @Test
    void shutdownWithoutReplyCodeIsRetryable() {
        ShutdownSignalException heartbeatLoss = new ShutdownSignalException(true, false, null, null);

        assertEquals(ErrorClass.RETRYABLE, classifier.classify(heartbeatLoss));
        assertEquals(ErrorClass.RETRYABLE, classifier.classify(new AlreadyClosedException(heartbeatLoss)));
    }

    @Test
    void ioExceptionWrappingShutdownUsesTheReplyCode() {
        IOException wrapped = new IOException("declare failed", channelClosed(AMQP.NOT_FOUND));

        assertEquals(ErrorClass.FATAL, classifier.classify(wrapped));
    }

    @Test
    void networkFailuresAreRetryable() {
        assertEquals(ErrorClass.RETRYABLE, classifier.classify(new ConnectException("refused")));
        assertEquals(ErrorClass.RETRYABLE, classifier.classify(new TimeoutException("confirm timeout")));
        assertEquals(ErrorClass.RETRYABLE,
                classifier.classify(new CompletionException(new IOException("reset by peer"))));
    }

    @Test
    void clientExceptionsFollowTheTaxonomy() {
        assertEquals(ErrorClass.RETRYABLE, classifier.classify(new ConnectionNotReadyException("reconnecting")));
        assertEquals(ErrorClass.RETRYABLE, classifier.classify(new ChannelLostException("gone")));
        assertEquals(ErrorClass.FATAL, classifier.classify(new ClientClosedException()));
        assertEquals(ErrorClass.FATAL, classifier.classify(new InvalidRequestException("no routing key")));
    }

    @Test
    void authenticationFailureIsFatal() {
        assertEquals(ErrorClass.FATAL, classifier.classify(new AuthenticationFailureException("ACCESS_REFUSED")));
    }

    @Test
    void anythingElseIsUnknown() {
        assertEquals(ErrorClass.UNKNOWN, classifier.classify(new IllegalStateException("bug")));
        assertFalse(classifier.isRetryable(new IllegalStateException("bug")));
    }
}
