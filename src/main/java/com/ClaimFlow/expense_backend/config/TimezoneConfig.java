package com.ClaimFlow.expense_backend.config;

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;
import java.util.TimeZone;

@Configuration
@Slf4j
public class TimezoneConfig {

    @Value("${app.timezone:Asia/Kolkata}")
    private String timezone;

    @PostConstruct
    public void init() {
        TimeZone.setDefault(TimeZone.getTimeZone(timezone));
        log.info("Application timezone set to: {}", TimeZone.getDefault().getID());
    }

    @Bean
    public Clock clock() {
        return Clock.system(ZoneId.of(timezone));
    }
}
