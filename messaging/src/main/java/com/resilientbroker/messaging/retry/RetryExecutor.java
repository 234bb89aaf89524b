/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.resilientbroker.messaging.retry;

import com.resilientbroker.common.concurrent.CancellationToken;
import com.resilientbroker.common.exception.OperationCancelledException;
import com.resilientbroker.common.exception.OperationFailedException;
import com.resilientbroker.common.exception.RetryExhaustedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Bounded retry with exponential backoff and jitter.
 *
 * <p>Runs the operation up to {@link RetryPolicy#getMaxAttempts()} times. A success returns
 * at once. A failure the classifier does not call {@link ErrorClass#RETRYABLE} is surfaced
 * immediately: runtime exceptions as they are, checked ones wrapped in
 * {@link OperationFailedException}. Running out of attempts throws
 * {@link RetryExhaustedException} with the last failure as cause.</p>
 *
 * <p>Sleeps between attempts race the cancellation token. Cancellation always wins over the
 * last operation error and surfaces as {@link OperationCancelledException}.</p>
 *
 * <p>Stateless and safe for concurrent use.</p>
 */
public class RetryExecutor {

    private static final Logger log = LoggerFactory.getLogger(RetryExecutor.class);

    private final ErrorClassifier defaultClassifier;

    public RetryExecutor(ErrorClassifier defaultClassifier) {
        this.defaultClassifier = defaultClassifier;
    }

    public ErrorClassifier getDefaultClassifier() { return defaultClassifier; }

    public <T> T execute(RetryableOperation<T> operation, RetryPolicy policy, CancellationToken token) {
        return execute("operation", operation, policy, token, defaultClassifier);
    }

    public void run(String name, RetryableAction action, RetryPolicy policy, CancellationToken token) {
        execute(name, () -> {
            action.run();
            return null;
        }, policy, token, defaultClassifier);
    }

    public void run(String name, RetryableAction action, RetryPolicy policy, CancellationToken token,
                    ErrorClassifier classifier) {
        execute(name, () -> {
            action.run();
            return null;
        }, policy, token, classifier);
    }

    public <T> T execute(String name, RetryableOperation<T> operation, RetryPolicy policy,
                         CancellationToken token, ErrorClassifier classifier) {
        BackoffSchedule backoff = new BackoffSchedule(policy);
        int maxAttempts = policy.getMaxAttempts();

        for (int attempt = 1; ; attempt++) {
            token.throwIfCancelled();
            Exception failure;
            try {
                return operation.call();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new OperationCancelledException(name + " interrupted");
            } catch (Exception e) {
                failure = e;
            }

            // a failure caused by cancellation (e.g. an aborted session) reports the cancellation
            token.throwIfCancelled();

            ErrorClass errorClass = classifier.classify(failure);
            if (errorClass != ErrorClass.RETRYABLE) {
                log.debug("{} failed with {} error on attempt {}: {}", name, errorClass, attempt, failure.toString());
                throw surface(failure, attempt);
            }
            if (attempt >= maxAttempts) {
                log.warn("{} exhausted {} attempt(s), last error: {}", name, maxAttempts, failure.toString());
                throw new RetryExhaustedException(attempt, failure);
            }

            Duration delay = backoff.nextDelay();
            log.warn("{} attempt {}/{} failed: {}; retrying in {}ms",
                    name, attempt, maxAttempts, failure.toString(), delay.toMillis());
            sleep(name, delay, token);
        }
    }

    private static void sleep(String name, Duration delay, CancellationToken token) {
        try {
            if (token.await(delay)) {
                throw new OperationCancelledException(token.reason());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OperationCancelledException(name + " interrupted during backoff");
        }
    }

    private static RuntimeException surface(Exception failure, int attempt) {
        if (failure instanceof RuntimeException) return (RuntimeException) failure;
        return new OperationFailedException(attempt, failure);
    }
}
