package com.optionanalytics.mapper;

import com.optionanalytics.api.dto.request.ContractRequest;
import com.optionanalytics.api.dto.request.MarketRequest;
import com.optionanalytics.api.dto.request.OptionQuoteRequest;
import com.optionanalytics.calendar.TimeToExpiryCalculator;
import com.optionanalytics.domain.model.MarketState;
import com.optionanalytics.domain.model.OptionContractSpec;
import com.optionanalytics.domain.model.OptionQuote;
import com.optionanalytics.exception.InvalidInputException;
import java.time.Instant;
import java.util.List;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

/**
 * MapStruct mapper from request DTOs to domain values.
 *
 * <p>The generated methods copy fields onto the domain builders, so domain validation runs on
 * construction. Time to expiry and valuation time are resolved first by the default methods:
 * an explicit {@code timeToExpiry} wins over an {@code expiryDate}, and a missing valuation
 * time means now.
 */
@Mapper
public interface OptionQuoteMapper {

    @Mapping(source = "resolvedTimeToExpiry", target = "timeToExpiry")
    OptionContractSpec toContract(ContractRequest request, Double resolvedTimeToExpiry);

    @Mapping(source = "resolvedValuationTime", target = "valuationTime")
    MarketState toMarket(MarketRequest request, Instant resolvedValuationTime);

    default MarketState toMarket(MarketRequest request) {
        Instant valuationTime = request.getValuationTime() != null ? request.getValuationTime() : Instant.now();
        return toMarket(request, valuationTime);
    }

    default OptionContractSpec toContract(
            ContractRequest request, Instant valuationTime, TimeToExpiryCalculator calculator) {
        Double timeToExpiry = request.getTimeToExpiry();
        if (timeToExpiry == null) {
            if (request.getExpiryDate() == null) {
                throw new InvalidInputException("Either timeToExpiry or expiryDate is required");
            }
            timeToExpiry = calculator.yearsToExpiry(valuationTime, request.getExpiryDate());
        }
        return toContract(request, timeToExpiry);
    }

    default OptionQuote toQuote(OptionQuoteRequest request, TimeToExpiryCalculator calculator) {
        MarketState market = toMarket(request.getMarket());
        return OptionQuote.builder()
                .contract(toContract(request.getContract(), market.getValuationTime(), calculator))
                .market(market)
                .marketPrice(request.getMarketPrice())
                .build();
    }

    default List<OptionQuote> toQuotes(List<OptionQuoteRequest> requests, TimeToExpiryCalculator calculator) {
        return requests.stream().map(request -> toQuote(request, calculator)).toList();
    }
}
