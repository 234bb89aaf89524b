/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.resilientbroker.messaging.consume;

import com.resilientbroker.common.exception.ClientClosedException;
import com.resilientbroker.common.exception.InvalidRequestException;
import com.resilientbroker.common.exception.OperationCancelledException;
import com.resilientbroker.messaging.retry.ErrorClass;
import com.resilientbroker.messaging.retry.ErrorClassifier;

/**
 * Classification of {@link MessageHandler} failures: everything is worth another attempt
 * except an explicit {@link PermanentHandlerException}, a bad request, or the client going away.
 */
public class HandlerErrorClassifier implements ErrorClassifier {

    public static final HandlerErrorClassifier INSTANCE = new HandlerErrorClassifier();

    @Override
    public ErrorClass classify(Throwable error) {
        if (error instanceof PermanentHandlerException
                || error instanceof InvalidRequestException
                || error instanceof OperationCancelledException
                || error instanceof ClientClosedException
                || error instanceof InterruptedException) {
            return ErrorClass.FATAL;
        }
        return ErrorClass.RETRYABLE;
    }
}
