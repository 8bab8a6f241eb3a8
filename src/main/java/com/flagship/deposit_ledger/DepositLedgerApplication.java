package com.flagship.deposit_ledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class DepositLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(DepositLedgerApplication.class, args);
    }
}
