package com.optionanalytics.domain.model;

import com.optionanalytics.domain.InputChecks;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/**
 * Immutable market snapshot used to value a contract, as of a valuation instant.
 * Rates are continuously compounded decimals (0.05 = 5%).
 */
@Value
public class MarketState {

    /** Spot price S of the underlying. Always > 0. */
    double spot;

    /** Continuously-compounded risk-free rate r. */
    double riskFreeRate;

    /** Continuous dividend yield q. Zero for non-dividend underlyings. */
    double dividendYield;

    Instant valuationTime;

    @Builder(toBuilder = true)
    public MarketState(double spot, double riskFreeRate, double dividendYield, Instant valuationTime) {
        this.spot = InputChecks.requirePositive("spot", spot);
        this.riskFreeRate = InputChecks.requireFinite("riskFreeRate", riskFreeRate);
        this.dividendYield = InputChecks.requireFinite("dividendYield", dividendYield);
        this.valuationTime = InputChecks.requirePresent("valuationTime", valuationTime);
    }

    /** Same snapshot with a different spot; used for finite-difference bumps. */
    public MarketState withSpot(double newSpot) {
        return toBuilder().spot(newSpot).build();
    }

    /** Same snapshot with a different risk-free rate; used for finite-difference bumps. */
    public MarketState withRiskFreeRate(double newRate) {
        return toBuilder().riskFreeRate(newRate).build();
    }
}
