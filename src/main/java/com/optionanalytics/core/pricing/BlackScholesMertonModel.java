package com.optionanalytics.core.pricing;

import com.optionanalytics.domain.enums.PricingModelType;
import com.optionanalytics.domain.model.Greeks;
import com.optionanalytics.domain.model.MarketState;
import com.optionanalytics.domain.model.OptionContractSpec;
import com.optionanalytics.domain.vo.Volatility;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.springframework.stereotype.Component;

/**
 * Closed-form Black-Scholes-Merton pricer with continuous dividend yield.
 *
 * <p>Key formulas:
 * <ul>
 *   <li>d1 = [ln(S/K) + (r - q + sigma^2/2) * T] / (sigma * sqrt(T))
 *   <li>d2 = d1 - sigma * sqrt(T)
 *   <li>Call: S * e^(-qT) * N(d1) - K * e^(-rT) * N(d2)
 *   <li>Put: K * e^(-rT) * N(-d2) - S * e^(-qT) * N(-d1)
 *   <li>Delta: e^(-qT) * N(d1) for calls, e^(-qT) * [N(d1) - 1] for puts
 *   <li>Gamma: e^(-qT) * n(d1) / (S * sigma * sqrt(T))
 *   <li>Vega: S * e^(-qT) * n(d1) * sqrt(T)
 * </ul>
 *
 * <p>T = 0 or sigma = 0 never reaches d1/d2 (the denominator sigma * sqrt(T) would be zero);
 * those inputs are valued by {@link DeterministicValuation}.
 *
 * <p>Strictly a European model. Applied to an American contract it returns the European
 * value, which is a lower bound for the American premium.
 */
@Component
public class BlackScholesMertonModel implements PricingModel {

    // Reusable standard normal distribution (thread-safe in commons-math3)
    private static final NormalDistribution NORM = new NormalDistribution();

    @Override
    public PricingModelType getType() {
        return PricingModelType.BLACK_SCHOLES_MERTON;
    }

    @Override
    public double price(OptionContractSpec contract, MarketState market, double volatility) {
        if (isDegenerate(contract, volatility)) {
            return DeterministicValuation.europeanPrice(contract, market);
        }

        double S = market.getSpot();
        double K = contract.getStrike();
        double T = contract.getTimeToExpiry();
        double sqrtT = Math.sqrt(T);
        double d1 = d1(S, K, T, market.getRiskFreeRate(), market.getDividendYield(), volatility);
        double d2 = d1 - volatility * sqrtT;

        double discountedSpot = S * Math.exp(-market.getDividendYield() * T);
        double discountedStrike = K * Math.exp(-market.getRiskFreeRate() * T);

        double price;
        if (contract.isCall()) {
            price = discountedSpot * NORM.cumulativeProbability(d1) - discountedStrike * NORM.cumulativeProbability(d2);
        } else {
            price = discountedStrike * NORM.cumulativeProbability(-d2)
                    - discountedSpot * NORM.cumulativeProbability(-d1);
        }
        // Rounding can leave deep OTM prices a few ulps below zero
        return Math.max(price, 0.0);
    }

    @Override
    public Greeks greeks(OptionContractSpec contract, MarketState market, double volatility) {
        if (isDegenerate(contract, volatility)) {
            return DeterministicValuation.europeanGreeks(contract, market);
        }

        double S = market.getSpot();
        double K = contract.getStrike();
        double T = contract.getTimeToExpiry();
        double r = market.getRiskFreeRate();
        double q = market.getDividendYield();
        double sqrtT = Math.sqrt(T);
        double d1 = d1(S, K, T, r, q, volatility);
        double d2 = d1 - volatility * sqrtT;

        double nd1 = NORM.density(d1);
        double expQT = Math.exp(-q * T);
        double expRT = Math.exp(-r * T);

        // Common to calls and puts: the diffusion part of theta
        double decay = -S * expQT * nd1 * volatility / (2.0 * sqrtT);

        double delta;
        double theta;
        double rho;
        if (contract.isCall()) {
            double Nd1 = NORM.cumulativeProbability(d1);
            double Nd2 = NORM.cumulativeProbability(d2);
            delta = expQT * Nd1;
            theta = decay + q * S * expQT * Nd1 - r * K * expRT * Nd2;
            rho = K * T * expRT * Nd2;
        } else {
            double NminusD1 = NORM.cumulativeProbability(-d1);
            double NminusD2 = NORM.cumulativeProbability(-d2);
            delta = -expQT * NminusD1;
            theta = decay - q * S * expQT * NminusD1 + r * K * expRT * NminusD2;
            rho = -K * T * expRT * NminusD2;
        }

        return Greeks.builder()
                .delta(delta)
                .gamma(expQT * nd1 / (S * volatility * sqrtT))
                .vega(S * expQT * nd1 * sqrtT)
                .theta(theta)
                .rho(rho)
                .build();
    }

    @Override
    public double vega(OptionContractSpec contract, MarketState market, double volatility) {
        if (isDegenerate(contract, volatility)) {
            return 0.0;
        }
        double S = market.getSpot();
        double T = contract.getTimeToExpiry();
        double d1 = d1(S, contract.getStrike(), T, market.getRiskFreeRate(), market.getDividendYield(), volatility);
        return S * Math.exp(-market.getDividendYield() * T) * NORM.density(d1) * Math.sqrt(T);
    }

    private static boolean isDegenerate(OptionContractSpec contract, double volatility) {
        return Volatility.of(volatility).isDegenerate() || contract.isExpired();
    }

    private static double d1(double S, double K, double T, double r, double q, double sigma) {
        return (Math.log(S / K) + (r - q + sigma * sigma / 2.0) * T) / (sigma * Math.sqrt(T));
    }
}
