package com.optionanalytics.api.dto.request;

import com.optionanalytics.domain.enums.ExerciseStyle;
import com.optionanalytics.domain.enums.OptionKind;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import java.time.LocalDate;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Contract terms of a pricing or solve request. Either {@code timeToExpiry} (years) or
 * {@code expiryDate} must be given; when both are present {@code timeToExpiry} wins.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ContractRequest {

    @NotBlank
    private String underlying;

    @NotNull
    @Positive
    private Double strike;

    @PositiveOrZero
    private Double timeToExpiry;

    private LocalDate expiryDate;

    @NotNull
    private OptionKind kind;

    /** Defaults to EUROPEAN. */
    private ExerciseStyle exerciseStyle;
}
