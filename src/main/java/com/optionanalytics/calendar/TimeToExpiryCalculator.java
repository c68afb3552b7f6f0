package com.optionanalytics.calendar;

import com.optionanalytics.config.MarketConfig;
import com.optionanalytics.domain.InputChecks;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import org.springframework.stereotype.Component;

/**
 * Converts an expiry date into a time to expiry in years as of a valuation instant.
 *
 * <p>The contract stops trading at the configured cutoff on its expiry day, in the market's
 * zone (end of day when no cutoff is set). Time is counted in seconds over a year of
 * {@code daysPerYear} days and floored at zero, so a contract valued after its cutoff is
 * expired rather than negative.
 */
@Component
public class TimeToExpiryCalculator {

    private static final double SECONDS_PER_DAY = 86_400.0;

    private final MarketConfig marketConfig;

    public TimeToExpiryCalculator(MarketConfig marketConfig) {
        this.marketConfig = marketConfig;
    }

    public double yearsToExpiry(Instant valuationTime, LocalDate expiryDate) {
        InputChecks.requirePresent("valuationTime", valuationTime);
        InputChecks.requirePresent("expiryDate", expiryDate);

        long seconds = ChronoUnit.SECONDS.between(valuationTime, expiryInstant(expiryDate));
        if (seconds <= 0) {
            return 0.0;
        }
        return seconds / (marketConfig.getDaysPerYear() * SECONDS_PER_DAY);
    }

    /** Instant at which a contract expiring on {@code expiryDate} stops trading. */
    public Instant expiryInstant(LocalDate expiryDate) {
        ZonedDateTime cutoff = marketConfig.getExpiryCutoff() != null
                ? expiryDate.atTime(marketConfig.getExpiryCutoff()).atZone(marketConfig.getZone())
                : expiryDate.plusDays(1).atStartOfDay(marketConfig.getZone());
        return cutoff.toInstant();
    }
}
