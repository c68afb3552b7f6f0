package com.optionanalytics.exception;

import java.util.HashMap;
import java.util.Map;

/**
 * Malformed contract or market parameters: non-positive spot or strike, negative time to
 * expiry, non-finite numbers, negative volatility, or a lattice parameterization whose
 * risk-neutral probability leaves (0, 1).
 *
 * <p>Raised when a value object is constructed or a model is invoked; never retried.
 */
public class InvalidInputException extends BaseException {

    public InvalidInputException(String message) {
        super(ErrorCode.INVALID_INPUT, message);
    }

    public InvalidInputException(String message, Map<String, Object> details) {
        super(ErrorCode.INVALID_INPUT, message, details);
    }

    /** Builds an exception whose details name the offending field and its rejected value. */
    public static InvalidInputException forField(String field, Object value, String message) {
        Map<String, Object> details = new HashMap<>();
        details.put("field", field);
        details.put("value", value);
        return new InvalidInputException(message, details);
    }
}
