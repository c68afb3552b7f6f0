package com.optionanalytics.api.dto.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Lattice diagnostics request; {@code steps} defaults to the configured schedule. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConvergenceRequest {

    @Valid
    @NotNull
    private ContractRequest contract;

    @Valid
    @NotNull
    private MarketRequest market;

    @NotNull
    @PositiveOrZero
    private Double volatility;

    private List<@Positive Integer> steps;
}
