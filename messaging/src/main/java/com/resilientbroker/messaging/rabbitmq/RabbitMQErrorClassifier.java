/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.resilientbroker.messaging.rabbitmq;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.AuthenticationFailureException;
import com.rabbitmq.client.Method;
import com.rabbitmq.client.PossibleAuthenticationFailureException;
import com.rabbitmq.client.ShutdownSignalException;
import com.resilientbroker.common.exception.BrokerClientException;
import com.resilientbroker.common.exception.ChannelLostException;
import com.resilientbroker.common.exception.ConnectionNotReadyException;
import com.resilientbroker.messaging.retry.ErrorClass;
import com.resilientbroker.messaging.retry.ErrorClassifier;

import java.io.IOException;
import java.util.Set;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Classifies AMQP 0-9-1 failures.
 *
 * <p>Reply codes that signal a lost or forced-closed connection are retryable:
 * 320 CONNECTION_FORCED, 504 CHANNEL_ERROR, 506 RESOURCE_ERROR, 541 INTERNAL_ERROR, and
 * 200 REPLY_SUCCESS when the broker (not this client) initiated the close. Codes that point
 * at a malformed or unauthorized request are fatal. Any other code is {@link ErrorClass#UNKNOWN}
 * and therefore not retried.</p>
 *
 * <p>Plain network failures ({@link IOException} without a shutdown signal, timeouts) and
 * shutdown signals without a close method (heartbeat loss, socket reset) are retryable.</p>
 */
public class RabbitMQErrorClassifier implements ErrorClassifier {

    static final Set<Integer> RETRYABLE_REPLY_CODES = Set.of(
            AMQP.CONNECTION_FORCED,
            AMQP.CHANNEL_ERROR,
            AMQP.RESOURCE_ERROR,
            AMQP.INTERNAL_ERROR);

    static final Set<Integer> FATAL_REPLY_CODES = Set.of(
            AMQP.CONTENT_TOO_LARGE,
            AMQP.NO_ROUTE,
            AMQP.NO_CONSUMERS,
            AMQP.INVALID_PATH,
            AMQP.ACCESS_REFUSED,
            AMQP.NOT_FOUND,
            AMQP.RESOURCE_LOCKED,
            AMQP.PRECONDITION_FAILED,
            AMQP.FRAME_ERROR,
            AMQP.SYNTAX_ERROR,
            AMQP.COMMAND_INVALID,
            AMQP.UNEXPECTED_FRAME,
            AMQP.NOT_ALLOWED,
            AMQP.NOT_IMPLEMENTED);

    @Override
    public ErrorClass classify(Throwable error) {
        Throwable t = unwrap(error);
        if (t == null) return ErrorClass.UNKNOWN;

        if (t instanceof ConnectionNotReadyException || t instanceof ChannelLostException) {
            return ErrorClass.RETRYABLE;
        }
        if (t instanceof BrokerClientException) {
            return ErrorClass.FATAL;
        }
        if (t instanceof ShutdownSignalException) {
            return classifyShutdown((ShutdownSignalException) t);
        }
        if (t instanceof AuthenticationFailureException || t instanceof PossibleAuthenticationFailureException) {
            return ErrorClass.FATAL;
        }
        if (t instanceof IOException) {
            if (t.getCause() instanceof ShutdownSignalException) {
                return classifyShutdown((ShutdownSignalException) t.getCause());
            }
            return ErrorClass.RETRYABLE;
        }
        if (t instanceof TimeoutException) {
            return ErrorClass.RETRYABLE;
        }
        if (t instanceof InterruptedException) {
            return ErrorClass.FATAL;
        }
        return ErrorClass.UNKNOWN;
    }

    /** Classify a bare reply code; exposed for callers that only have the code. */
    public ErrorClass classifyReplyCode(int replyCode, boolean initiatedByApplication) {
        if (replyCode == AMQP.REPLY_SUCCESS) {
            return initiatedByApplication ? ErrorClass.FATAL : ErrorClass.RETRYABLE;
        }
        if (RETRYABLE_REPLY_CODES.contains(replyCode)) return ErrorClass.RETRYABLE;
        if (FATAL_REPLY_CODES.contains(replyCode)) return ErrorClass.FATAL;
        return ErrorClass.UNKNOWN;
    }

    private ErrorClass classifyShutdown(ShutdownSignalException signal) {
        Integer code = replyCode(signal.getReason());
        if (code == null) {
            return signal.isInitiatedByApplication() ? ErrorClass.FATAL : ErrorClass.RETRYABLE;
        }
        return classifyReplyCode(code, signal.isInitiatedByApplication());
    }

    static Integer replyCode(Method reason) {
        if (reason instanceof AMQP.Connection.Close) return ((AMQP.Connection.Close) reason).getReplyCode();
        if (reason instanceof AMQP.Channel.Close) return ((AMQP.Channel.Close) reason).getReplyCode();
        return null;
    }

    private static Throwable unwrap(Throwable t) {
        Throwable current = t;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
