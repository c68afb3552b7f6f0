package com.optionanalytics.core.processor;

import com.optionanalytics.config.SolverConfig;
import com.optionanalytics.core.pricing.PricingModel;
import com.optionanalytics.domain.InputChecks;
import com.optionanalytics.domain.enums.NonConvergenceReason;
import com.optionanalytics.domain.enums.SolverMethod;
import com.optionanalytics.domain.model.ImpliedVolatilityResult;
import com.optionanalytics.domain.model.MarketState;
import com.optionanalytics.domain.model.OptionContractSpec;
import com.optionanalytics.domain.model.OptionQuote;
import com.optionanalytics.exception.InvalidInputException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Newton-Raphson implied volatility solver with bisection fallback, written against
 * {@link PricingModel} so it inverts the closed form and the lattice alike.
 *
 * <p>The search is confined to the bracket (minVolatility, maxVolatility), raised for the
 * lattice to the model's minimum admissible volatility. Before iterating, the quote is checked
 * against the prices at both ends of the bracket; a quote outside that range (below intrinsic,
 * or above the price at maxVolatility) cannot be matched and yields a non-converged result.
 *
 * <p>Newton-Raphson uses the model's vega as f'(sigma). It is abandoned for bisection on the
 * same bracket when vega is numerically zero (deep ITM/OTM, near expiry) or when a step would
 * leave the bracket. Bisection always converges for a quote inside the range because model
 * prices increase with sigma. Either phase stops when |model - market| < price tolerance or
 * the sigma step falls below the volatility tolerance.
 *
 * <p>Running out of iterations is reported, not thrown: the result carries the best sigma seen
 * and its residual with {@code converged = false}. This class is stateless and thread-safe.
 */
@Slf4j
@Component
public class ImpliedVolatilitySolver {

    private final SolverConfig config;

    public ImpliedVolatilitySolver(SolverConfig config) {
        this.config = config;
    }

    /** Solves with the configured starting guess, price tolerance and iteration budget. */
    public ImpliedVolatilityResult solve(OptionQuote quote, PricingModel model) {
        return solve(quote, model, config.getInitialGuess(), config.getPriceTolerance(), config.getMaxIterations());
    }

    /**
     * @param quote         observed price with its contract and market snapshot
     * @param model         model to invert
     * @param initialGuess  starting sigma; clamped into the search bracket
     * @param tolerance     price-space tolerance
     * @param maxIterations budget of model evaluations across both phases
     * @return the solve outcome; never null, never thrown for numerical failure
     */
    public ImpliedVolatilityResult solve(
            OptionQuote quote, PricingModel model, double initialGuess, double tolerance, int maxIterations) {
        InputChecks.requirePresent("quote", quote);
        InputChecks.requirePresent("model", model);
        InputChecks.requirePositive("initialGuess", initialGuess);
        InputChecks.requirePositive("tolerance", tolerance);
        if (maxIterations < 1) {
            throw InvalidInputException.forField("maxIterations", maxIterations, "maxIterations must be >= 1");
        }

        OptionContractSpec contract = quote.getContract();
        MarketState market = quote.getMarket();

        // Margin keeps the lattice's probability strictly inside (0, 1) at the lower edge
        double lower = Math.max(
                config.getMinVolatility(), model.minimumAdmissibleVolatility(contract, market) * 1.001);
        double upper = config.getMaxVolatility();
        if (lower >= upper) {
            throw new InvalidInputException("No admissible volatility range for " + model.getType()
                    + ": lower bound " + lower + " >= upper bound " + upper);
        }

        Search search = new Search(quote, model, tolerance, maxIterations);

        double lowResidual = model.price(contract, market, lower) - quote.getMarketPrice();
        if (lowResidual > tolerance) {
            log.debug(
                    "Price {} below achievable range for K={}, T={} (min {} at sigma={})",
                    quote.getMarketPrice(),
                    contract.getStrike(),
                    contract.getTimeToExpiry(),
                    quote.getMarketPrice() + lowResidual,
                    lower);
            return search.outOfRange(NonConvergenceReason.PRICE_BELOW_RANGE, lower, lowResidual);
        }
        double highResidual = model.price(contract, market, upper) - quote.getMarketPrice();
        if (highResidual < -tolerance) {
            log.debug(
                    "Price {} above achievable range for K={}, T={} (max {} at sigma={})",
                    quote.getMarketPrice(),
                    contract.getStrike(),
                    contract.getTimeToExpiry(),
                    quote.getMarketPrice() + highResidual,
                    upper);
            return search.outOfRange(NonConvergenceReason.PRICE_ABOVE_RANGE, upper, highResidual);
        }

        double start = Math.min(Math.max(initialGuess, lower), upper);
        ImpliedVolatilityResult newton = newtonRaphson(search, start, lower, upper);
        if (newton != null) {
            return newton;
        }

        log.debug(
                "Newton-Raphson abandoned after {} iterations for S={}, K={}, T={}, price={}, falling back to bisection",
                search.iterations,
                market.getSpot(),
                contract.getStrike(),
                contract.getTimeToExpiry(),
                quote.getMarketPrice());
        return bisection(search, lower, upper);
    }

    /** Returns null when Newton-Raphson has to hand over to bisection. */
    private ImpliedVolatilityResult newtonRaphson(Search search, double start, double lower, double upper) {
        double sigma = start;
        while (search.hasBudget()) {
            double residual = search.evaluate(sigma);
            if (Math.abs(residual) < search.tolerance) {
                return search.converged(SolverMethod.NEWTON_RAPHSON, sigma, residual);
            }

            double vega = search.vega(sigma);
            // Also rejects NaN
            if (!(Math.abs(vega) >= config.getMinVega())) {
                return null;
            }

            double next = sigma - residual / vega;
            if (!(next > lower && next < upper)) {
                return null;
            }
            if (Math.abs(next - sigma) < config.getVolatilityTolerance()) {
                return search.converged(SolverMethod.NEWTON_RAPHSON, next, search.residualAt(next));
            }
            sigma = next;
        }
        return search.exhausted(SolverMethod.NEWTON_RAPHSON);
    }

    private ImpliedVolatilityResult bisection(Search search, double lower, double upper) {
        double low = lower;
        double high = upper;
        while (search.hasBudget()) {
            double mid = (low + high) / 2.0;
            double residual = search.evaluate(mid);
            if (Math.abs(residual) < search.tolerance || (high - low) / 2.0 < config.getVolatilityTolerance()) {
                return search.converged(SolverMethod.BISECTION, mid, residual);
            }
            if (residual > 0.0) {
                high = mid;
            } else {
                low = mid;
            }
        }
        return search.exhausted(SolverMethod.BISECTION);
    }

    /** Mutable state of one solve. Confined to the calling thread. */
    private static final class Search {

        private final OptionQuote quote;
        private final PricingModel model;
        private final double tolerance;
        private final int maxIterations;

        private int iterations;
        private double bestSigma = Double.NaN;
        private double bestResidual = Double.POSITIVE_INFINITY;

        private Search(OptionQuote quote, PricingModel model, double tolerance, int maxIterations) {
            this.quote = quote;
            this.model = model;
            this.tolerance = tolerance;
            this.maxIterations = maxIterations;
        }

        boolean hasBudget() {
            return iterations < maxIterations;
        }

        /** One counted iteration: prices at sigma and remembers the best candidate so far. */
        double evaluate(double sigma) {
            iterations++;
            double residual = residualAt(sigma);
            if (Math.abs(residual) < Math.abs(bestResidual)) {
                bestResidual = residual;
                bestSigma = sigma;
            }
            return residual;
        }

        double residualAt(double sigma) {
            return model.price(quote.getContract(), quote.getMarket(), sigma) - quote.getMarketPrice();
        }

        double vega(double sigma) {
            return model.vega(quote.getContract(), quote.getMarket(), sigma);
        }

        ImpliedVolatilityResult converged(SolverMethod method, double sigma, double residual) {
            return base(sigma, residual).converged(true).method(method).build();
        }

        ImpliedVolatilityResult exhausted(SolverMethod method) {
            return base(bestSigma, bestResidual)
                    .converged(false)
                    .method(method)
                    .failureReason(NonConvergenceReason.ITERATION_LIMIT)
                    .build();
        }

        ImpliedVolatilityResult outOfRange(NonConvergenceReason reason, double sigma, double residual) {
            return base(sigma, residual).converged(false).failureReason(reason).build();
        }

        private ImpliedVolatilityResult.ImpliedVolatilityResultBuilder base(double sigma, double residual) {
            return ImpliedVolatilityResult.builder()
                    .quote(quote)
                    .model(model.getType())
                    .volatility(sigma)
                    .iterations(iterations)
                    .residual(residual);
        }
    }
}
