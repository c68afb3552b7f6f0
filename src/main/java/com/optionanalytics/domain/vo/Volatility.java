package com.optionanalytics.domain.vo;

import com.optionanalytics.exception.InvalidInputException;
import lombok.Value;

/**
 * Annualized volatility sigma as a decimal (0.20 = 20%).
 *
 * <p>Zero is accepted and marks the degenerate deterministic case: models return the
 * forward-discounted intrinsic value instead of evaluating their formula. Negative or
 * non-finite values are rejected.
 */
@Value
public class Volatility {

    double value;

    private Volatility(double value) {
        this.value = value;
    }

    public static Volatility of(double sigma) {
        if (!Double.isFinite(sigma) || sigma < 0.0) {
            throw InvalidInputException.forField("volatility", sigma, "volatility must be a finite number >= 0");
        }
        return new Volatility(sigma);
    }

    public boolean isDegenerate() {
        return value == 0.0;
    }
}
