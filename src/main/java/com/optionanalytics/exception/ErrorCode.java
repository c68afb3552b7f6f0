package com.optionanalytics.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** Codes returned in {@code error.code} of an {@link com.optionanalytics.api.dto.response.ApiErrorResponse}. */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    /** Request body failed Bean Validation. */
    VALIDATION_ERROR("VALIDATION_ERROR", 400),
    /** Contract, market, volatility or model parameters rejected by the domain checks. */
    INVALID_INPUT("INVALID_INPUT", 400),
    /** Body could not be read as JSON of the expected shape. */
    BAD_REQUEST("BAD_REQUEST", 400),
    NOT_FOUND("NOT_FOUND", 404),
    INTERNAL_ERROR("INTERNAL_ERROR", 500);

    private final String code;
    private final int httpStatus;

    public boolean isServerError() {
        return httpStatus >= 500;
    }
}
