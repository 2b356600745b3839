package com.flagship.account_ledger.config;

import com.flagship.account_ledger.ledger.Account;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.hibernate.validator.constraints.time.DurationMin;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Ledger settings bound from the {@code ledger.*} properties.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "ledger")
public class LedgerProperties {

    /**
     * Longest a balance-changing operation waits for an account lock.
     */
    @NotNull
    @DurationMin(millis = 1)
    private Duration lockTimeout = Account.DEFAULT_LOCK_TIMEOUT;
}
