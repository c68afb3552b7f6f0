package com.optionanalytics.domain.model;

import com.optionanalytics.domain.InputChecks;
import lombok.Value;

/**
 * Fixed dimension of a term structure: either one strike, or a moneyness bucket
 * {@code |K/S - moneyness| <= halfWidth} (e.g. 1.0 +/- 0.10 for at-the-money).
 */
@Value
public class TermStructureAnchor {

    public enum Type {
        STRIKE,
        MONEYNESS
    }

    Type type;

    double value;

    /** Bucket half-width; zero for strike anchors. */
    double halfWidth;

    private TermStructureAnchor(Type type, double value, double halfWidth) {
        this.type = type;
        this.value = value;
        this.halfWidth = halfWidth;
    }

    public static TermStructureAnchor strike(double strike) {
        return new TermStructureAnchor(Type.STRIKE, InputChecks.requirePositive("strike", strike), 0.0);
    }

    public static TermStructureAnchor moneyness(double moneyness, double halfWidth) {
        return new TermStructureAnchor(
                Type.MONEYNESS,
                InputChecks.requirePositive("moneyness", moneyness),
                InputChecks.requireNonNegative("halfWidth", halfWidth));
    }
}
