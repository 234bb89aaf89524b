/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.resilientbroker.common.exception;

public class OperationCancelledException extends BrokerClientException {
    public OperationCancelledException(String reason) {
        super("BRK_CANCELLED", "Operation cancelled: " + reason);
    }
}
