package com.optionanalytics.mapper;

import com.optionanalytics.api.dto.response.ContractAnalyticsRow;
import com.optionanalytics.domain.model.ContractAnalytics;
import java.util.List;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

/**
 * MapStruct mapper flattening {@link ContractAnalytics} into one {@link ContractAnalyticsRow}:
 * contract terms, market snapshot, solve outcome, model re-price and Greeks side by side.
 * Greeks columns come out null when the solve did not converge.
 */
@Mapper
public interface ContractAnalyticsMapper {

    @Mapping(source = "quote.contract.underlying", target = "underlying")
    @Mapping(source = "quote.contract.kind", target = "kind")
    @Mapping(source = "quote.contract.exerciseStyle", target = "exerciseStyle")
    @Mapping(source = "quote.contract.strike", target = "strike")
    @Mapping(source = "quote.contract.timeToExpiry", target = "timeToExpiry")
    @Mapping(source = "quote.market.spot", target = "spot")
    @Mapping(source = "quote.market.riskFreeRate", target = "riskFreeRate")
    @Mapping(source = "quote.market.dividendYield", target = "dividendYield")
    @Mapping(source = "quote.marketPrice", target = "marketPrice")
    @Mapping(source = "impliedVolatility.model", target = "pricingModel")
    @Mapping(source = "impliedVolatility.volatility", target = "impliedVolatility")
    @Mapping(source = "impliedVolatility.iterations", target = "iterations")
    @Mapping(source = "impliedVolatility.residual", target = "residual")
    @Mapping(source = "impliedVolatility.method", target = "solverMethod")
    @Mapping(source = "impliedVolatility.failureReason", target = "failureReason")
    @Mapping(source = "greeks.delta", target = "delta")
    @Mapping(source = "greeks.gamma", target = "gamma")
    @Mapping(source = "greeks.vega", target = "vega")
    @Mapping(source = "greeks.theta", target = "theta")
    @Mapping(source = "greeks.rho", target = "rho")
    ContractAnalyticsRow toRow(ContractAnalytics analytics);

    List<ContractAnalyticsRow> toRows(List<ContractAnalytics> analytics);
}
