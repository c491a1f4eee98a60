package com.marginledger.config;

import com.marginledger.access.AccessPolicy;
import com.marginledger.access.ConfiguredAccessPolicy;
import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the collaborators the ledger consumes but does not own: the wall clock used to
 * stamp order creation and the access-control predicates.
 */
@Configuration
public class LedgerConfig {

    @Bean
    public Clock ledgerClock() {
        return Clock.systemUTC();
    }

    @Bean
    public AccessPolicy accessPolicy(LedgerProperties ledgerProperties) {
        return new ConfiguredAccessPolicy(ledgerProperties.getExecutors());
    }
}
