package com.optionanalytics.config;

import java.time.LocalTime;
import java.time.ZoneId;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Market calendar conventions used to turn an expiry date into a time to expiry.
 *
 * <p>Binds to the {@code optionanalytics.market.*} prefix. With the defaults a contract
 * expires at the end of its expiry day (midnight New York time) and years are 365.25 days.
 */
@Configuration
@ConfigurationProperties(prefix = "optionanalytics.market")
@Getter
@Setter
public class MarketConfig {

    private ZoneId zone = ZoneId.of("America/New_York");

    /** Time of day on the expiry date at which the contract stops trading. Null = end of day. */
    private LocalTime expiryCutoff;

    private double daysPerYear = 365.25;
}
