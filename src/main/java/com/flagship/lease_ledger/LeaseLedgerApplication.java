package com.flagship.lease_ledger;

import com.flagship.lease_ledger.config.LeaseLedgerProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties(LeaseLedgerProperties.class)
public class LeaseLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(LeaseLedgerApplication.class, args);
    }
}
