package com.optionanalytics.api.dto.response;

import com.optionanalytics.domain.enums.ExerciseStyle;
import com.optionanalytics.domain.enums.NonConvergenceReason;
import com.optionanalytics.domain.enums.OptionKind;
import com.optionanalytics.domain.enums.PricingModelType;
import com.optionanalytics.domain.enums.SolverMethod;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One flat row per contract of a chain run, the layout analytics are cached and exported in.
 * Model price, pricing error and Greeks are null for quotes whose solve did not converge.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ContractAnalyticsRow {

    private String underlying;
    private OptionKind kind;
    private ExerciseStyle exerciseStyle;
    private double strike;
    private double timeToExpiry;

    private double spot;
    private double riskFreeRate;
    private double dividendYield;
    private double marketPrice;

    private PricingModelType pricingModel;
    private double impliedVolatility;
    private boolean converged;
    private int iterations;
    private double residual;
    private SolverMethod solverMethod;
    private NonConvergenceReason failureReason;

    private Double modelPrice;
    private Double pricingError;

    private Double delta;
    private Double gamma;
    private Double vega;
    private Double theta;
    private Double rho;
}
