package com.optionanalytics.api.dto.request;

import com.optionanalytics.domain.enums.PricingModelType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Positive;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChainAnalyticsRequest {

    @NotEmpty
    private List<@Valid OptionQuoteRequest> quotes;

    private PricingModelType model;

    @Positive
    private Integer steps;
}
