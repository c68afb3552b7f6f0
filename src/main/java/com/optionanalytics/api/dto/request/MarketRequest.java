package com.optionanalytics.api.dto.request;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Market snapshot. A missing valuation time means now; a missing dividend yield means zero. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MarketRequest {

    @NotNull
    @Positive
    private Double spot;

    @NotNull
    private Double riskFreeRate;

    private Double dividendYield;

    private Instant valuationTime;
}
