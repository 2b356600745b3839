package com.flagship.account_ledger.ledger;

import java.util.concurrent.TimeUnit;

/**
 * Bounded lock acquisition for balance-changing operations.
 */
final class AccountLocks {

    private AccountLocks() {
        // Utility class
    }

    /**
     * Tries to take the account's lock within its lock timeout.
     * On success the caller owns the lock and must release it. A free lock is taken
     * without looking at the interrupt flag; only an actual wait can be interrupted.
     *
     * @return success, or a LOCK_TIMEOUT failure if the lock was not taken
     */
    static OperationResult acquire(Account account) {
        if (account.lock().tryLock()) {
            return OperationResult.success();
        }
        try {
            if (account.lock().tryLock(account.getLockTimeout().toNanos(), TimeUnit.NANOSECONDS)) {
                return OperationResult.success();
            }
            return OperationResult.failure(FailureKind.LOCK_TIMEOUT,
                "Timed out after " + account.getLockTimeout() + " waiting for account " + account.getName());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return OperationResult.failure(FailureKind.LOCK_TIMEOUT,
                "Interrupted while waiting for account " + account.getName());
        }
    }
}
