package com.flagship.account_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

/**
 * Consistent view of an account, captured under its lock.
 */
@Value
public class AccountSnapshot {
    UUID accountId;
    String name;
    BigDecimal balance;
    boolean frozen;
    List<TransactionRecord> history;
}
