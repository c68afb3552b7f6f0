package com.optionanalytics.api.dto.request;

import com.optionanalytics.domain.enums.PricingModelType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Theoretical price of one contract at a given volatility. Without {@code model} the model is
 * chosen from the exercise style; {@code steps} only applies to the lattice.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PriceRequest {

    @Valid
    @NotNull
    private ContractRequest contract;

    @Valid
    @NotNull
    private MarketRequest market;

    @NotNull
    @PositiveOrZero
    private Double volatility;

    private PricingModelType model;

    @Positive
    private Integer steps;

    /** Defaults to true. */
    private Boolean includeGreeks;
}
