package com.flagship.account_ledger.observability;

import com.flagship.account_ledger.ledger.OperationResult;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.function.Supplier;

/**
 * Centralized metrics for ledger operations.
 *
 * Metrics exposed:
 * - ledger.accounts.opened: Counter of accounts opened through the service
 * - ledger.operations: Counter tagged by operation and outcome (success or failure kind)
 * - ledger.freeze.changes: Counter tagged by the resulting state
 * - ledger.transfer.duration: Timer for transfers, including lock waits
 */
@Component
public class LedgerMetrics {

    public static final String OPERATIONS = "ledger.operations";
    public static final String SUCCESS = "success";

    private final MeterRegistry registry;

    private final Counter accountsOpened;
    private final Timer transferTimer;

    public LedgerMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.accountsOpened = Counter.builder("ledger.accounts.opened")
                .description("Number of accounts opened")
                .register(registry);

        this.transferTimer = Timer.builder("ledger.transfer.duration")
                .description("Time taken to complete or reject a transfer")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);
    }

    public void incrementAccountsOpened() {
        accountsOpened.increment();
    }

    /**
     * Records one operation outcome. Uses registry.counter() for meter lookup/creation.
     */
    public void recordOperation(String operation, OperationResult result) {
        registry.counter(OPERATIONS,
                "operation", operation,
                "outcome", outcomeTag(result)
        ).increment();
    }

    public void recordFreezeChange(boolean frozen) {
        registry.counter("ledger.freeze.changes", "state", frozen ? "frozen" : "unfrozen").increment();
    }

    public <T> T timeTransfer(Supplier<T> operation) {
        return transferTimer.record(operation);
    }

    static String outcomeTag(OperationResult result) {
        if (result.isSuccess()) {
            return SUCCESS;
        }
        return result.getFailureKind().name().toLowerCase(Locale.ROOT);
    }
}
