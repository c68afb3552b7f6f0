package com.optionanalytics.api.dto.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EarlyExerciseRequest {

    @Valid
    @NotNull
    private ContractRequest contract;

    @Valid
    @NotNull
    private MarketRequest market;

    @NotNull
    @PositiveOrZero
    private Double volatility;

    @Positive
    private Integer steps;
}
