package com.optionanalytics.domain.model;

import com.optionanalytics.domain.enums.PricingModelType;
import lombok.Builder;
import lombok.Value;

/**
 * Theoretical price of a contract, optionally with its Greeks. Returned by value; the model
 * that produced it keeps no reference.
 */
@Value
@Builder
public class PricingResult {

    PricingModelType model;

    double price;

    /** Null when Greeks were not requested. */
    Greeks greeks;

    public boolean hasGreeks() {
        return greeks != null;
    }
}
