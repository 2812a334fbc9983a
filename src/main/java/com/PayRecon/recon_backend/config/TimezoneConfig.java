package com.PayRecon.recon_backend.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import jakarta.annotation.PostConstruct;
import java.util.TimeZone;

@Slf4j
@Configuration
@RequiredArgsConstructor
public class TimezoneConfig implements WebMvcConfigurer {

    private final ReconciliationProperties properties;

    @PostConstruct
    public void init() {
        // Pay periods and shift dates are local to the business
        TimeZone.setDefault(TimeZone.getTimeZone(properties.getTimezone()));
        log.info("Application timezone set to: {}", TimeZone.getDefault().getID());
    }
}
