package com.optionanalytics.core.pricing;

import com.optionanalytics.domain.model.Greeks;
import com.optionanalytics.domain.model.MarketState;
import com.optionanalytics.domain.model.OptionContractSpec;

/**
 * Valuation when no randomness is left: the contract is at expiry (T = 0) or the volatility
 * is zero. The underlying then grows deterministically to the forward S*e^((r-q)T), so a
 * European contract is worth e^(-rT) * payoff(forward), i.e. payoff(S*e^(-qT), K*e^(-rT)).
 * At T = 0 this is exactly the intrinsic value.
 */
final class DeterministicValuation {

    private static final Greeks FLAT = Greeks.builder().build();

    private DeterministicValuation() {}

    static double europeanPrice(OptionContractSpec contract, MarketState market) {
        if (contract.isExpired()) {
            return contract.intrinsicValue(market.getSpot());
        }
        double t = contract.getTimeToExpiry();
        double discountedSpot = market.getSpot() * Math.exp(-market.getDividendYield() * t);
        double discountedStrike = contract.getStrike() * Math.exp(-market.getRiskFreeRate() * t);
        return contract.getKind().payoff(discountedSpot, discountedStrike);
    }

    /**
     * American counterpart: the better of exercising now and holding to expiry. Interior
     * exercise dates are not searched.
     */
    static double americanPrice(OptionContractSpec contract, MarketState market) {
        return Math.max(contract.intrinsicValue(market.getSpot()), europeanPrice(contract, market));
    }

    static Greeks europeanGreeks(OptionContractSpec contract, MarketState market) {
        double spot = market.getSpot();
        double strike = contract.getStrike();
        double sign = contract.isCall() ? 1.0 : -1.0;

        if (contract.isExpired()) {
            boolean inTheMoney = sign * (spot - strike) > 0.0;
            return inTheMoney ? Greeks.builder().delta(sign).build() : FLAT;
        }

        double t = contract.getTimeToExpiry();
        double r = market.getRiskFreeRate();
        double q = market.getDividendYield();
        double expQT = Math.exp(-q * t);
        double discountedSpot = spot * expQT;
        double discountedStrike = strike * Math.exp(-r * t);

        if (sign * (discountedSpot - discountedStrike) <= 0.0) {
            return FLAT;
        }
        // value = sign * (S*e^(-qT) - K*e^(-rT)); theta = -dV/dT
        return Greeks.builder()
                .delta(sign * expQT)
                .theta(sign * (q * discountedSpot - r * discountedStrike))
                .rho(sign * t * discountedStrike)
                .build();
    }

    static Greeks americanGreeks(OptionContractSpec contract, MarketState market) {
        double immediate = contract.intrinsicValue(market.getSpot());
        if (immediate > europeanPrice(contract, market)) {
            return Greeks.builder().delta(contract.isCall() ? 1.0 : -1.0).build();
        }
        return europeanGreeks(contract, market);
    }
}
