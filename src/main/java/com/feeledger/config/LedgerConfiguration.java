package com.feeledger.config;

import com.feeledger.engine.FeeCalculationEngine;
import com.feeledger.ledger.FeeLedger;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class LedgerConfiguration {

    @Bean
    public Clock ledgerClock() {
        return Clock.systemUTC();
    }

    @Bean
    public FeeLedger feeLedger(FeeCalculationEngine engine, Clock ledgerClock) {
        return new FeeLedger(engine, ledgerClock);
    }
}
