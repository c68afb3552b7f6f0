package com.optionanalytics.api.dto.request;

import com.optionanalytics.domain.enums.PricingModelType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Solver overrides are optional; missing ones fall back to the configured defaults. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ImpliedVolatilityRequest {

    @Valid
    @NotNull
    private OptionQuoteRequest quote;

    private PricingModelType model;

    @Positive
    private Integer steps;

    @Positive
    private Double initialGuess;

    @Positive
    private Double tolerance;

    @Positive
    private Integer maxIterations;
}
