package com.gt.vocab.conf;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.time.ZoneOffset;

@Configuration
public class TimeConfig {

    private static final Logger log = LoggerFactory.getLogger(TimeConfig.class);

    static final String DEFAULT_TIMEZONE = "Asia/Ho_Chi_Minh";
    static final ZoneId FALLBACK_ZONE = ZoneOffset.ofHours(7);

    @Bean
    public Clock getClock() {
        return Clock.systemUTC();
    }

    // Zone used for "today" and "yesterday" boundaries
    @Bean
    public ZoneId getLocalZone(@Value("${vocab.timezone:" + DEFAULT_TIMEZONE + "}") String timezone) {
        return resolveZone(timezone);
    }

    static ZoneId resolveZone(String timezone) {
        if (timezone == null || timezone.isBlank()) {
            return ZoneId.of(DEFAULT_TIMEZONE);
        }

        try {
            return ZoneId.of(timezone.strip());
        } catch (DateTimeException ex) {
            log.warn("Unrecognised timezone {}, falling back to {}", timezone, FALLBACK_ZONE);
            return FALLBACK_ZONE;
        }
    }
}
