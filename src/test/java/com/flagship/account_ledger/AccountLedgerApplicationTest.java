package com.flagship.account_ledger;

import com.flagship.account_ledger.config.LedgerProperties;
import com.flagship.account_ledger.ledger.Account;
import com.flagship.account_ledger.ledger.AccountService;
import com.flagship.account_ledger.ledger.TransactionKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.math.BigDecimal;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Wiring test: the service starts with properties bound from configuration.
 */
@SpringBootTest(properties = "ledger.lock-timeout=2s")
class AccountLedgerApplicationTest {

    @Autowired
    private AccountService accountService;

    @Autowired
    private LedgerProperties ledgerProperties;

    @Test
    @DisplayName("Lock timeout is bound from configuration and applied to opened accounts")
    void testConfiguredLockTimeout() {
        assertEquals(Duration.ofSeconds(2), ledgerProperties.getLockTimeout());

        Account account = accountService.openAccount("Alice");

        assertEquals(Duration.ofSeconds(2), account.getLockTimeout());
    }

    @Test
    @DisplayName("Deposit and transfer work end to end through the wired service")
    void testEndToEnd() {
        Account alice = accountService.openAccount("Alice");
        Account bob = accountService.openAccount("Bob");

        accountService.depositOrThrow(alice, new BigDecimal("150.0"));
        accountService.transferOrThrow(alice, bob, new BigDecimal("40.0"));

        assertEquals(0, new BigDecimal("110.0").compareTo(alice.getBalance()));
        assertEquals(TransactionKind.TRANSFER_IN, bob.getTransactionHistory().get(0).getKind());
    }
}
