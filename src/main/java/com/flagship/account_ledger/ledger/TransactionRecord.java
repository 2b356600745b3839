package com.flagship.account_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;

/**
 * One entry of an account's history.
 *
 * Key invariant: records are immutable and belong to exactly one account.
 * The amount is always the positive magnitude of the movement, never the signed delta.
 */
@Value
public class TransactionRecord {
    TransactionKind kind;
    BigDecimal amount;
    BigDecimal balanceAfter;
    String note;
}
