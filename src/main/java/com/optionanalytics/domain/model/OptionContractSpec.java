package com.optionanalytics.domain.model;

import com.optionanalytics.domain.InputChecks;
import com.optionanalytics.domain.enums.ExerciseStyle;
import com.optionanalytics.domain.enums.OptionKind;
import com.optionanalytics.exception.InvalidInputException;
import lombok.Builder;
import lombok.Value;

/**
 * Immutable description of a single vanilla option contract.
 *
 * <p>Construction validates the contract: strike must be in (0, inf) and time to expiry
 * must be >= 0 (years). A contract with {@code timeToExpiry == 0} is at expiry and is
 * valued at intrinsic value by every model. Exercise style defaults to EUROPEAN.
 */
@Value
public class OptionContractSpec {

    /** Underlying identifier, e.g. "SPY" or "AAPL". */
    String underlying;

    /** Strike price K. */
    double strike;

    /** Time to expiry T in years. */
    double timeToExpiry;

    OptionKind kind;

    ExerciseStyle exerciseStyle;

    @Builder(toBuilder = true)
    public OptionContractSpec(
            String underlying, double strike, double timeToExpiry, OptionKind kind, ExerciseStyle exerciseStyle) {
        if (underlying == null || underlying.isBlank()) {
            throw InvalidInputException.forField(
                    "underlying", underlying, "underlying is required");
        }
        this.underlying = underlying;
        this.strike = InputChecks.requirePositive("strike", strike);
        this.timeToExpiry = InputChecks.requireNonNegative("timeToExpiry", timeToExpiry);
        this.kind = InputChecks.requirePresent("kind", kind);
        this.exerciseStyle = exerciseStyle != null ? exerciseStyle : ExerciseStyle.EUROPEAN;
    }

    public boolean isExpired() {
        return timeToExpiry == 0.0;
    }

    public boolean isCall() {
        return kind == OptionKind.CALL;
    }

    public boolean isAmerican() {
        return exerciseStyle == ExerciseStyle.AMERICAN;
    }

    /** Exercise value if the underlying traded at {@code underlyingPrice}. */
    public double intrinsicValue(double underlyingPrice) {
        return kind.payoff(underlyingPrice, strike);
    }
}
