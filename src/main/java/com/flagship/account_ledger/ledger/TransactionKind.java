package com.flagship.account_ledger.ledger;

/**
 * Kind of balance-changing event recorded in an account's history.
 * A transfer always produces one TRANSFER_OUT and one TRANSFER_IN record, on different accounts.
 */
public enum TransactionKind {
    DEPOSIT("deposit"),
    WITHDRAW("withdraw"),
    TRANSFER_OUT("transfer_out"),
    TRANSFER_IN("transfer_in");

    private final String wireName;

    TransactionKind(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }
}
