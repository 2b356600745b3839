package com.flagship.account_ledger.ledger;

import com.flagship.account_ledger.config.LedgerProperties;
import com.flagship.account_ledger.observability.AccountLogContext;
import com.flagship.account_ledger.observability.LedgerMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;

/**
 * Application-facing entry point for account operations.
 *
 * Opens accounts with the configured lock timeout and runs every operation with
 * logging and metrics around it. The service keeps no reference to the accounts
 * it opens; callers own them.
 *
 * The plain methods return the operation's result unchanged. The {@code ...OrThrow}
 * variants raise {@link com.flagship.account_ledger.ledger.exception.LedgerOperationException}
 * on failure instead.
 */
@Service
@Slf4j
public class AccountService {

    private final LedgerProperties properties;
    private final LedgerMetrics metrics;

    public AccountService(LedgerProperties properties, LedgerMetrics metrics) {
        this.properties = properties;
        this.metrics = metrics;
    }

    public Account openAccount(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Account name is required");
        }
        Account account = new Account(name, properties.getLockTimeout());
        metrics.incrementAccountsOpened();
        log.info("Opened account {} with id {}", name, account.getId());
        return account;
    }

    public OperationResult deposit(Account account, BigDecimal amount) {
        return AccountLogContext.withAccount(account,
            () -> logOutcome("deposit", account, amount, account.deposit(amount)));
    }

    public OperationResult withdraw(Account account, BigDecimal amount) {
        return AccountLogContext.withAccount(account,
            () -> logOutcome("withdraw", account, amount, account.withdraw(amount)));
    }

    public OperationResult transfer(Account initiator, Account counterparty, BigDecimal amount) {
        return AccountLogContext.withTransfer(initiator, counterparty,
            () -> metrics.timeTransfer(
                () -> logOutcome("transfer", initiator, amount, initiator.transfer(counterparty, amount))));
    }

    public void depositOrThrow(Account account, BigDecimal amount) {
        deposit(account, amount).orElseThrow();
    }

    public void withdrawOrThrow(Account account, BigDecimal amount) {
        withdraw(account, amount).orElseThrow();
    }

    public void transferOrThrow(Account initiator, Account counterparty, BigDecimal amount) {
        transfer(initiator, counterparty, amount).orElseThrow();
    }

    public void freeze(Account account) {
        account.freeze();
        metrics.recordFreezeChange(true);
        log.info("Account {} frozen", account.getName());
    }

    public void unfreeze(Account account) {
        account.unfreeze();
        metrics.recordFreezeChange(false);
        log.info("Account {} unfrozen", account.getName());
    }

    private OperationResult logOutcome(String operation, Account account, BigDecimal amount, OperationResult result) {
        metrics.recordOperation(operation, result);
        if (result.isSuccess()) {
            log.info("{} of {} on account {} applied", operation, amount, account.getName());
        } else {
            log.warn("{} of {} on account {} rejected: {} ({})",
                operation, amount, account.getName(), result.getFailureKind(), result.getMessage());
        }
        return result;
    }
}
