package com.flagship.account_ledger.ledger;

/**
 * Reasons a balance-changing operation can be rejected.
 * A rejected operation never changes balance or history.
 */
public enum FailureKind {
    /**
     * Deposit, withdrawal or transfer amount was zero or negative.
     */
    INVALID_AMOUNT,

    /**
     * The account whose balance would change is frozen.
     */
    ACCOUNT_FROZEN,

    /**
     * The receiving side of a transfer is frozen.
     */
    COUNTERPARTY_FROZEN,

    /**
     * Amount exceeds the available balance.
     */
    INSUFFICIENT_FUNDS,

    /**
     * An account lock could not be acquired within the account's lock timeout.
     */
    LOCK_TIMEOUT,

    /**
     * Transfer counterparty is the initiating account itself.
     */
    INVALID_TARGET
}
