package com.flagship.account_ledger.ledger;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;

/**
 * A single-currency account with a balance, a freeze flag and an append-only history.
 *
 * This class enforces the core invariants:
 * 1. The balance is never negative
 * 2. A rejected operation changes neither balance nor history
 * 3. History order equals the order in which operations committed
 *
 * Every mutation and every query runs under the account's lock. Balance-changing
 * operations wait at most {@link #getLockTimeout()} for it and report
 * {@link FailureKind#LOCK_TIMEOUT} otherwise. Equality is identity; the name is a
 * display label only.
 */
public class Account {

    public static final Duration DEFAULT_LOCK_TIMEOUT = Duration.ofSeconds(5);

    private final UUID id;
    private final String name;
    private final Duration lockTimeout;
    private final ReentrantLock lock = new ReentrantLock();
    private final List<TransactionRecord> history = new ArrayList<>();

    private BigDecimal balance = BigDecimal.ZERO;
    private volatile boolean frozen;

    public Account(String name) {
        this(name, DEFAULT_LOCK_TIMEOUT);
    }

    public Account(String name, Duration lockTimeout) {
        this(UUID.randomUUID(), name, lockTimeout);
    }

    public Account(UUID id, String name, Duration lockTimeout) {
        this.id = Objects.requireNonNull(id, "id");
        this.name = Objects.requireNonNull(name, "name");
        this.lockTimeout = Objects.requireNonNull(lockTimeout, "lockTimeout");
        if (lockTimeout.isNegative() || lockTimeout.isZero()) {
            throw new IllegalArgumentException("Lock timeout must be positive");
        }
    }

    public UUID getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public Duration getLockTimeout() {
        return lockTimeout;
    }

    /**
     * Adds {@code amount} to the balance and records a DEPOSIT.
     * Checks, in order: frozen, amount positive.
     */
    public OperationResult deposit(BigDecimal amount) {
        Objects.requireNonNull(amount, "amount");
        OperationResult locked = AccountLocks.acquire(this);
        if (locked.isFailure()) {
            return locked;
        }
        try {
            if (frozen) {
                return OperationResult.failure(FailureKind.ACCOUNT_FROZEN, "Account is frozen: " + name);
            }
            if (amount.signum() <= 0) {
                return OperationResult.failure(FailureKind.INVALID_AMOUNT, "Deposit must be positive.");
            }
            credit(TransactionKind.DEPOSIT, amount, "Deposit successful");
            return OperationResult.success();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Subtracts {@code amount} from the balance and records a WITHDRAW.
     * Checks, in order: frozen, amount positive, funds sufficient.
     */
    public OperationResult withdraw(BigDecimal amount) {
        Objects.requireNonNull(amount, "amount");
        OperationResult locked = AccountLocks.acquire(this);
        if (locked.isFailure()) {
            return locked;
        }
        try {
            if (frozen) {
                return OperationResult.failure(FailureKind.ACCOUNT_FROZEN, "Account is frozen: " + name);
            }
            if (amount.signum() <= 0) {
                return OperationResult.failure(FailureKind.INVALID_AMOUNT, "Withdraw must be positive.");
            }
            if (amount.compareTo(balance) > 0) {
                return OperationResult.failure(FailureKind.INSUFFICIENT_FUNDS,
                    String.format("Insufficient funds: balance=%s, requested=%s", balance, amount));
            }
            debit(TransactionKind.WITHDRAW, amount, "Withdrawal successful");
            return OperationResult.success();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Moves {@code amount} from this account to {@code counterparty} as one atomic step.
     *
     * @see TransferCoordinator#transfer(Account, Account, BigDecimal)
     */
    public OperationResult transfer(Account counterparty, BigDecimal amount) {
        return TransferCoordinator.transfer(this, counterparty, amount);
    }

    public void freeze() {
        setFrozen(true);
    }

    public void unfreeze() {
        setFrozen(false);
    }

    public boolean isFrozen() {
        return frozen;
    }

    public BigDecimal getBalance() {
        lock.lock();
        try {
            return balance;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns a copy of the history; changing it does not affect the account.
     */
    public List<TransactionRecord> getTransactionHistory() {
        lock.lock();
        try {
            return new ArrayList<>(history);
        } finally {
            lock.unlock();
        }
    }

    public AccountSnapshot snapshot() {
        lock.lock();
        try {
            return new AccountSnapshot(id, name, balance, frozen, List.copyOf(history));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public String toString() {
        return "Account{name=" + name + ", id=" + id + "}";
    }

    private void setFrozen(boolean value) {
        lock.lock();
        try {
            frozen = value;
        } finally {
            lock.unlock();
        }
    }

    // The methods below require the caller to hold this account's lock.

    ReentrantLock lock() {
        return lock;
    }

    BigDecimal balanceLocked() {
        requireLockHeld();
        return balance;
    }

    void credit(TransactionKind kind, BigDecimal amount, String note) {
        requireLockHeld();
        balance = balance.add(amount);
        history.add(new TransactionRecord(kind, amount, balance, note));
    }

    void debit(TransactionKind kind, BigDecimal amount, String note) {
        requireLockHeld();
        balance = balance.subtract(amount);
        history.add(new TransactionRecord(kind, amount, balance, note));
    }

    private void requireLockHeld() {
        if (!lock.isHeldByCurrentThread()) {
            throw new IllegalStateException("Lock for account " + name + " is not held by the current thread");
        }
    }
}
