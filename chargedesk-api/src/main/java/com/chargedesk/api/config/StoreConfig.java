package com.chargedesk.api.config;

import com.chargedesk.core.evidence.CasePayloadCodec;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class StoreConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public CasePayloadCodec casePayloadCodec() {
        return new CasePayloadCodec();
    }
}
