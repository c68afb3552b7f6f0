package com.optionanalytics.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Getter;

/**
 * Root of the analytics exceptions. Unchecked; the pricing math never catches its own
 * validation failures.
 *
 * <p>{@code details} names what was rejected, usually {@code field} and {@code value}, and is
 * echoed in the error response body.
 */
@Getter
public abstract class BaseException extends RuntimeException {

    private final ErrorCode errorCode;
    private final Map<String, Object> details;

    protected BaseException(ErrorCode errorCode, String message) {
        this(errorCode, message, null);
    }

    protected BaseException(ErrorCode errorCode, String message, Map<String, Object> details) {
        super(message);
        this.errorCode = errorCode;
        // a missing field is reported with a null value, which Map.copyOf rejects
        this.details = details != null ? Collections.unmodifiableMap(new LinkedHashMap<>(details)) : Map.of();
    }

    /** Name of the rejected field, or null when the failure is not about a single field. */
    public String getField() {
        Object field = details.get("field");
        return field != null ? field.toString() : null;
    }
}
