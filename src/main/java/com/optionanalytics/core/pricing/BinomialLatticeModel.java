package com.optionanalytics.core.pricing;

import com.optionanalytics.domain.enums.PricingModelType;
import com.optionanalytics.domain.model.Greeks;
import com.optionanalytics.domain.model.MarketState;
import com.optionanalytics.domain.model.OptionContractSpec;
import com.optionanalytics.domain.vo.Volatility;
import com.optionanalytics.exception.InvalidInputException;
import java.util.Map;
import lombok.Getter;
import lombok.Value;

/**
 * Cox-Ross-Rubinstein recombining binomial lattice with N steps.
 *
 * <p>Parameters: dt = T/N, u = e^(sigma*sqrt(dt)), d = 1/u and risk-neutral up-probability
 * p = (e^((r-q)dt) - d) / (u - d). Terminal payoffs are set at the N+1 leaves
 * S*u^j*d^(N-j), then values are rolled back with e^(-r*dt) * (p*Vup + (1-p)*Vdown).
 * AMERICAN contracts take max(continuation, intrinsic) at every node; EUROPEAN contracts
 * skip that check and converge to the Black-Scholes-Merton price as N grows.
 *
 * <p>A parameterization with p outside (0, 1), i.e. |(r-q)dt| >= sigma*sqrt(dt), is
 * arbitrage-inconsistent and rejected rather than clamped.
 *
 * <p>Greeks are finite-difference approximations. Delta, gamma and theta come from the node
 * values at levels 1 and 2 of the tree (bumped re-pricing on a one-step lattice); vega and rho
 * re-price with bumped sigma and r. They carry the lattice's discretization error.
 */
public class BinomialLatticeModel implements PricingModel {

    @Getter
    private final int steps;

    private final Bumps bumps;

    public BinomialLatticeModel(int steps) {
        this(steps, Bumps.DEFAULT);
    }

    public BinomialLatticeModel(int steps, Bumps bumps) {
        if (steps < 1) {
            throw InvalidInputException.forField("steps", steps, "lattice steps must be >= 1");
        }
        this.steps = steps;
        this.bumps = bumps;
    }

    @Override
    public PricingModelType getType() {
        return PricingModelType.CRR_BINOMIAL;
    }

    @Override
    public double price(OptionContractSpec contract, MarketState market, double volatility) {
        if (Volatility.of(volatility).isDegenerate() || contract.isExpired()) {
            return contract.isAmerican()
                    ? DeterministicValuation.americanPrice(contract, market)
                    : DeterministicValuation.europeanPrice(contract, market);
        }
        return backwardInduction(contract, market, volatility, null);
    }

    @Override
    public Greeks greeks(OptionContractSpec contract, MarketState market, double volatility) {
        if (Volatility.of(volatility).isDegenerate() || contract.isExpired()) {
            return contract.isAmerican()
                    ? DeterministicValuation.americanGreeks(contract, market)
                    : DeterministicValuation.europeanGreeks(contract, market);
        }

        double rho = rho(contract, market, volatility);
        double vega = vega(contract, market, volatility);

        if (steps >= 2) {
            return treeGreeks(contract, market, volatility, vega, rho);
        }

        double spot = market.getSpot();
        double base = backwardInduction(contract, market, volatility, null);

        double h = bumps.getRelativeSpot() * spot;
        double up = price(contract, market.withSpot(spot + h), volatility);
        double down = price(contract, market.withSpot(spot - h), volatility);

        double T = contract.getTimeToExpiry();
        double dt = Math.min(bumps.getTime(), T);
        double earlier = price(contract.toBuilder().timeToExpiry(T - dt).build(), market, volatility);

        return Greeks.builder()
                .delta((up - down) / (2.0 * h))
                .gamma((up - 2.0 * base + down) / (h * h))
                .vega(vega)
                .theta((earlier - base) / dt)
                .rho(rho)
                .build();
    }

    /**
     * Delta, gamma and theta read off the first two levels of the tree. Re-pricing at bumped
     * spots would move the strike relative to the node grid and pick up the lattice's odd/even
     * oscillation, which swamps gamma.
     */
    private Greeks treeGreeks(
            OptionContractSpec contract, MarketState market, double volatility, double vega, double rho) {
        double[] head = new double[6];
        backwardInduction(contract, market, volatility, head);

        double S = market.getSpot();
        double dt = contract.getTimeToExpiry() / steps;
        double u = Math.exp(volatility * Math.sqrt(dt));
        double d = 1.0 / u;

        // head: [root, down, up, down-down, middle, up-up]
        double delta = (head[2] - head[1]) / (S * u - S * d);
        double deltaUp = (head[5] - head[4]) / (S * u * u - S);
        double deltaDown = (head[4] - head[3]) / (S - S * d * d);
        double gamma = (deltaUp - deltaDown) / (0.5 * (S * u * u - S * d * d));
        double theta = (head[4] - head[0]) / (2.0 * dt);

        return Greeks.builder()
                .delta(delta)
                .gamma(gamma)
                .vega(vega)
                .theta(theta)
                .rho(rho)
                .build();
    }

    /**
     * Central difference in sigma; one-sided when the lower bump would leave the admissible
     * volatility range.
     */
    @Override
    public double vega(OptionContractSpec contract, MarketState market, double volatility) {
        if (Volatility.of(volatility).isDegenerate() || contract.isExpired()) {
            return 0.0;
        }
        double dv = bumps.getVolatility();
        double higher = backwardInduction(contract, market, volatility + dv, null);
        double lowerSigma = volatility - dv;
        if (lowerSigma > minimumAdmissibleVolatility(contract, market)) {
            return (higher - backwardInduction(contract, market, lowerSigma, null)) / (2.0 * dv);
        }
        return (higher - backwardInduction(contract, market, volatility, null)) / dv;
    }

    /**
     * Central difference in r. A rate bump that widens |r - q| can push p out of (0, 1) at a
     * sigma the unbumped tree accepts, so such a side is dropped for a one-sided difference.
     * When both sides widen it (r close to q, sigma at the edge) the bump shrinks to half the
     * remaining admissible band.
     */
    private double rho(OptionContractSpec contract, MarketState market, double volatility) {
        double r = market.getRiskFreeRate();
        double dr = bumps.getRate();
        MarketState rateUp = market.withRiskFreeRate(r + dr);
        MarketState rateDown = market.withRiskFreeRate(r - dr);
        boolean upAdmissible = volatility > minimumAdmissibleVolatility(contract, rateUp);
        boolean downAdmissible = volatility > minimumAdmissibleVolatility(contract, rateDown);

        if (upAdmissible && downAdmissible) {
            return (backwardInduction(contract, rateUp, volatility, null)
                            - backwardInduction(contract, rateDown, volatility, null))
                    / (2.0 * dr);
        }
        if (upAdmissible) {
            return (backwardInduction(contract, rateUp, volatility, null)
                            - backwardInduction(contract, market, volatility, null))
                    / dr;
        }
        if (downAdmissible) {
            return (backwardInduction(contract, market, volatility, null)
                            - backwardInduction(contract, rateDown, volatility, null))
                    / dr;
        }

        double dt = contract.getTimeToExpiry() / steps;
        double band = volatility / Math.sqrt(dt) - Math.abs(r - market.getDividendYield());
        double h = 0.5 * band;
        return (backwardInduction(contract, market.withRiskFreeRate(r + h), volatility, null)
                        - backwardInduction(contract, market.withRiskFreeRate(r - h), volatility, null))
                / (2.0 * h);
    }

    /** p stays inside (0, 1) only while sigma*sqrt(dt) > |r - q|*dt. */
    @Override
    public double minimumAdmissibleVolatility(OptionContractSpec contract, MarketState market) {
        double dt = contract.getTimeToExpiry() / steps;
        return Math.abs(market.getRiskFreeRate() - market.getDividendYield()) * Math.sqrt(dt);
    }

    /**
     * Rolls the tree back to the root. When {@code head} is given it receives the values of
     * levels 0 to 2: root, then level 1 (down, up), then level 2 (down-down, middle, up-up).
     */
    private double backwardInduction(OptionContractSpec contract, MarketState market, double sigma, double[] head) {
        double S = market.getSpot();
        double K = contract.getStrike();
        double r = market.getRiskFreeRate();
        double q = market.getDividendYield();
        double dt = contract.getTimeToExpiry() / steps;

        double u = Math.exp(sigma * Math.sqrt(dt));
        double d = 1.0 / u;
        double p = (Math.exp((r - q) * dt) - d) / (u - d);
        if (!(p > 0.0 && p < 1.0)) {
            throw new InvalidInputException(
                    "Lattice risk-neutral probability " + p + " is outside (0, 1)",
                    Map.of("probability", p, "volatility", sigma, "riskFreeRate", r, "dividendYield", q, "dt", dt));
        }

        double discount = Math.exp(-r * dt);
        double upSquared = u * u;
        boolean american = contract.isAmerican();

        // values[j] holds the node reached with j up-moves
        double[] values = new double[steps + 1];
        double leafPrice = S * Math.pow(d, steps);
        for (int j = 0; j <= steps; j++) {
            values[j] = contract.intrinsicValue(leafPrice);
            leafPrice *= upSquared;
        }
        if (head != null && steps == 2) {
            System.arraycopy(values, 0, head, 3, 3);
        }

        for (int step = steps - 1; step >= 0; step--) {
            double nodePrice = S * Math.pow(d, step);
            for (int j = 0; j <= step; j++) {
                double continuation = discount * (p * values[j + 1] + (1.0 - p) * values[j]);
                values[j] = american ? Math.max(continuation, contract.intrinsicValue(nodePrice)) : continuation;
                nodePrice *= upSquared;
            }
            if (head != null && step <= 2) {
                // level k starts at index k(k+1)/2
                System.arraycopy(values, 0, head, step * (step + 1) / 2, step + 1);
            }
        }
        return values[0];
    }

    /** Bump sizes for the finite-difference Greeks. */
    @Value
    public static class Bumps {

        public static final Bumps DEFAULT = new Bumps(0.01, 0.001, 1.0 / 365.0, 1e-4);

        /** Spot bump as a fraction of spot. One-step lattices only. */
        double relativeSpot;

        /** Absolute sigma bump. */
        double volatility;

        /** Time bump in years for theta. One-step lattices only. */
        double time;

        /** Absolute rate bump for rho. */
        double rate;
    }
}
