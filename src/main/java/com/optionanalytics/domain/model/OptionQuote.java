package com.optionanalytics.domain.model;

import com.optionanalytics.domain.InputChecks;
import lombok.Builder;
import lombok.Value;

/**
 * An observed option price together with the contract and the market snapshot it was
 * quoted against. Produced by the market-data collaborator and consumed read-only.
 */
@Value
public class OptionQuote {

    OptionContractSpec contract;

    MarketState market;

    /** Observed market price (last or mid). Zero is accepted; negative prices are not. */
    double marketPrice;

    @Builder
    public OptionQuote(OptionContractSpec contract, MarketState market, double marketPrice) {
        this.contract = InputChecks.requirePresent("contract", contract);
        this.market = InputChecks.requirePresent("market", market);
        this.marketPrice = InputChecks.requireNonNegative("marketPrice", marketPrice);
    }

    /** Strike over spot. 1.0 is at-the-money. */
    public double getMoneyness() {
        return contract.getStrike() / market.getSpot();
    }
}
