package com.optionanalytics.core.pricing;

import com.optionanalytics.domain.enums.PricingModelType;
import com.optionanalytics.domain.model.Greeks;
import com.optionanalytics.domain.model.MarketState;
import com.optionanalytics.domain.model.OptionContractSpec;
import com.optionanalytics.domain.model.PricingResult;

/**
 * Capability shared by every pricing model: a theoretical price and its Greeks for a
 * contract, a market snapshot and a volatility.
 *
 * <p>The implied volatility solver and the chain analytics are written against this
 * interface only, so a model can be swapped (closed form, lattice with a chosen step
 * count) without touching them. Implementations are stateless and thread-safe.
 */
public interface PricingModel {

    PricingModelType getType();

    /**
     * Theoretical price (>= 0). A contract at expiry, or a zero volatility, is valued
     * deterministically at its (forward-discounted) intrinsic value.
     *
     * @throws com.optionanalytics.exception.InvalidInputException for a negative or non-finite
     *     volatility, or a parameterization the model cannot represent
     */
    double price(OptionContractSpec contract, MarketState market, double volatility);

    Greeks greeks(OptionContractSpec contract, MarketState market, double volatility);

    /**
     * dPrice/dSigma. Models override this when vega is cheaper to obtain than the full set of
     * Greeks; the implied volatility solver calls it on every Newton step.
     */
    default double vega(OptionContractSpec contract, MarketState market, double volatility) {
        return greeks(contract, market, volatility).getVega();
    }

    /**
     * Lowest volatility the model accepts for these inputs. Zero for the closed form; the
     * lattice needs enough dispersion to keep its risk-neutral probability inside (0, 1).
     */
    default double minimumAdmissibleVolatility(OptionContractSpec contract, MarketState market) {
        return 0.0;
    }

    default PricingResult evaluate(
            OptionContractSpec contract, MarketState market, double volatility, boolean includeGreeks) {
        return PricingResult.builder()
                .model(getType())
                .price(price(contract, market, volatility))
                .greeks(includeGreeks ? greeks(contract, market, volatility) : null)
                .build();
    }
}
