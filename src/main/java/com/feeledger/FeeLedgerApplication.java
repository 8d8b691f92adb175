package com.feeledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class FeeLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(FeeLedgerApplication.class, args);
    }
}
