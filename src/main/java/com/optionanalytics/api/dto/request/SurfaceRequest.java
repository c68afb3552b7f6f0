package com.optionanalytics.api.dto.request;

import com.optionanalytics.domain.enums.OptionKind;
import com.optionanalytics.domain.enums.PricingModelType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Chain to solve plus the slice to cut from it.
 *
 * <ul>
 *   <li>Smile: {@code expiry} in years.
 *   <li>Term structure: {@code anchorStrike}, or {@code anchorMoneyness} with an optional
 *       {@code moneynessHalfWidth}.
 * </ul>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SurfaceRequest {

    @NotEmpty
    private List<@Valid OptionQuoteRequest> quotes;

    private PricingModelType model;

    @Positive
    private Integer steps;

    private OptionKind optionKind;

    private Boolean includeNonConverged;

    @PositiveOrZero
    private Double expiry;

    @Positive
    private Double anchorStrike;

    @Positive
    private Double anchorMoneyness;

    @PositiveOrZero
    private Double moneynessHalfWidth;
}
