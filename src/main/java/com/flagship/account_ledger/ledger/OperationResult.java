package com.flagship.account_ledger.ledger;

import com.flagship.account_ledger.ledger.exception.LedgerOperationException;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Outcome of a balance-changing operation: either success, or a failure kind with a message.
 *
 * Callers branch on {@link #getFailureKind()}; {@link #orElseThrow()} is there for callers
 * that prefer exceptions.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class OperationResult {

    private static final OperationResult SUCCESS = new OperationResult(null, null);

    FailureKind failureKind;
    String message;

    public static OperationResult success() {
        return SUCCESS;
    }

    public static OperationResult failure(FailureKind kind, String message) {
        if (kind == null) {
            throw new IllegalArgumentException("Failure kind is required");
        }
        return new OperationResult(kind, message);
    }

    public boolean isSuccess() {
        return failureKind == null;
    }

    public boolean isFailure() {
        return failureKind != null;
    }

    /**
     * @throws LedgerOperationException if this result is a failure
     */
    public void orElseThrow() {
        if (isFailure()) {
            throw new LedgerOperationException(failureKind, message);
        }
    }
}
