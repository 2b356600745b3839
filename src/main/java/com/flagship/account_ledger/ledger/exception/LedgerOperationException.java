package com.flagship.account_ledger.ledger.exception;

import com.flagship.account_ledger.ledger.FailureKind;
import lombok.Getter;

/**
 * Thrown when a caller converts a failed operation result into an exception.
 */
@Getter
public class LedgerOperationException extends RuntimeException {

    private final FailureKind failureKind;

    public LedgerOperationException(FailureKind failureKind, String message) {
        super(message);
        this.failureKind = failureKind;
    }
}
