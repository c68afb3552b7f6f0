package com.optionanalytics.domain;

import com.optionanalytics.exception.InvalidInputException;

/**
 * Range checks shared by the value types. Every failure is an {@link InvalidInputException}
 * naming the field, so malformed records are rejected before they reach the pricing math.
 */
public final class InputChecks {

    private InputChecks() {}

    public static double requirePositive(String field, double value) {
        if (!Double.isFinite(value) || value <= 0.0) {
            throw InvalidInputException.forField(field, value, field + " must be a finite number > 0");
        }
        return value;
    }

    public static double requireNonNegative(String field, double value) {
        if (!Double.isFinite(value) || value < 0.0) {
            throw InvalidInputException.forField(field, value, field + " must be a finite number >= 0");
        }
        return value;
    }

    public static double requireFinite(String field, double value) {
        if (!Double.isFinite(value)) {
            throw InvalidInputException.forField(field, value, field + " must be a finite number");
        }
        return value;
    }

    public static <T> T requirePresent(String field, T value) {
        if (value == null) {
            throw InvalidInputException.forField(field, null, field + " is required");
        }
        return value;
    }
}
