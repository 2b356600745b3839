package com.flagship.account_ledger.ledger;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Moves value between two accounts as a single critical section.
 *
 * Both locks are taken before anything is validated, always in ascending account id
 * order regardless of which side initiated, so A-to-B and B-to-A transfers running at
 * the same time cannot wait on each other in a cycle. Locks are released on every exit path.
 *
 * Check order: same account, initiator frozen, counterparty frozen, amount positive,
 * funds sufficient. Only when all pass are the two balances changed and one record
 * appended to each history.
 */
public final class TransferCoordinator {

    private TransferCoordinator() {
        // Utility class
    }

    public static OperationResult transfer(Account initiator, Account counterparty, BigDecimal amount) {
        Objects.requireNonNull(initiator, "initiator");
        Objects.requireNonNull(counterparty, "counterparty");
        Objects.requireNonNull(amount, "amount");

        if (initiator == counterparty) {
            return OperationResult.failure(FailureKind.INVALID_TARGET,
                "Cannot transfer from an account to itself: " + initiator.getName());
        }

        Account first = lockOrderFirst(initiator, counterparty);
        Account second = first == initiator ? counterparty : initiator;

        OperationResult firstLocked = AccountLocks.acquire(first);
        if (firstLocked.isFailure()) {
            return firstLocked;
        }
        try {
            OperationResult secondLocked = AccountLocks.acquire(second);
            if (secondLocked.isFailure()) {
                return secondLocked;
            }
            try {
                return transferLocked(initiator, counterparty, amount);
            } finally {
                second.lock().unlock();
            }
        } finally {
            first.lock().unlock();
        }
    }

    private static OperationResult transferLocked(Account initiator, Account counterparty, BigDecimal amount) {
        if (initiator.isFrozen()) {
            return OperationResult.failure(FailureKind.ACCOUNT_FROZEN, "Account is frozen: " + initiator.getName());
        }
        if (counterparty.isFrozen()) {
            return OperationResult.failure(FailureKind.COUNTERPARTY_FROZEN,
                "Target account is frozen: " + counterparty.getName());
        }
        if (amount.signum() <= 0) {
            return OperationResult.failure(FailureKind.INVALID_AMOUNT, "Transfer amount must be positive.");
        }
        BigDecimal available = initiator.balanceLocked();
        if (amount.compareTo(available) > 0) {
            return OperationResult.failure(FailureKind.INSUFFICIENT_FUNDS,
                String.format("Insufficient funds: balance=%s, requested=%s", available, amount));
        }

        initiator.debit(TransactionKind.TRANSFER_OUT, amount, "Transferred to " + counterparty.getName());
        counterparty.credit(TransactionKind.TRANSFER_IN, amount, "Received from " + initiator.getName());
        return OperationResult.success();
    }

    static Account lockOrderFirst(Account a, Account b) {
        int cmp = a.getId().compareTo(b.getId());
        if (cmp == 0) {
            throw new IllegalStateException("Distinct accounts share id " + a.getId());
        }
        return cmp < 0 ? a : b;
    }
}
