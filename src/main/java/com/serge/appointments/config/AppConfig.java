package com.serge.appointments.config;

import com.serge.appointments.service.BookingQuotaGate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class AppConfig {
    private static final Logger log = LoggerFactory.getLogger(AppConfig.class);

    @Bean
    @ConditionalOnMissingBean
    Clock clock() {
        return Clock.systemUTC();
    }

    /** Used until a subscription-backed gate is wired in. */
    @Bean
    @ConditionalOnMissingBean(BookingQuotaGate.class)
    BookingQuotaGate unlimitedQuotaGate() {
        log.info("booking.quota_gate using unlimited default");
        return (businessId, date) -> true;
    }
}
