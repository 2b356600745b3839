package com.flagship.account_ledger.observability;

import com.flagship.account_ledger.ledger.Account;
import org.slf4j.MDC;

import java.util.function.Supplier;

/**
 * Puts the account names an operation touches into the SLF4J MDC for its duration.
 *
 * Keys:
 * - account: the account the operation runs on (transfer initiator)
 * - counterparty: the receiving account of a transfer
 *
 * Previous values are restored afterwards, so nested calls keep the outer context.
 */
public final class AccountLogContext {

    public static final String ACCOUNT_MDC_KEY = "account";
    public static final String COUNTERPARTY_MDC_KEY = "counterparty";

    private AccountLogContext() {
        // Utility class
    }

    public static <T> T withAccount(Account account, Supplier<T> action) {
        String previous = MDC.get(ACCOUNT_MDC_KEY);
        MDC.put(ACCOUNT_MDC_KEY, account.getName());
        try {
            return action.get();
        } finally {
            restore(ACCOUNT_MDC_KEY, previous);
        }
    }

    public static <T> T withTransfer(Account initiator, Account counterparty, Supplier<T> action) {
        String previous = MDC.get(COUNTERPARTY_MDC_KEY);
        MDC.put(COUNTERPARTY_MDC_KEY, counterparty.getName());
        try {
            return withAccount(initiator, action);
        } finally {
            restore(COUNTERPARTY_MDC_KEY, previous);
        }
    }

    private static void restore(String key, String previous) {
        if (previous == null) {
            MDC.remove(key);
        } else {
            MDC.put(key, previous);
        }
    }
}
