package com.flagship.account_ledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AccountLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(AccountLedgerApplication.class, args);
    }
}
