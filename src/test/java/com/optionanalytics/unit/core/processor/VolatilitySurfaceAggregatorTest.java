package com.optionanalytics.unit.core.processor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.optionanalytics.config.SurfaceConfig;
import com.optionanalytics.core.processor.VolatilitySurfaceAggregator;
import com.optionanalytics.domain.enums.NonConvergenceReason;
import com.optionanalytics.domain.enums.OptionKind;
import com.optionanalytics.domain.enums.PricingModelType;
import com.optionanalytics.domain.enums.SolverMethod;
import com.optionanalytics.domain.enums.SurfaceAxis;
import com.optionanalytics.domain.model.ImpliedVolatilityResult;
import com.optionanalytics.domain.model.MarketState;
import com.optionanalytics.domain.model.OptionContractSpec;
import com.optionanalytics.domain.model.OptionQuote;
import com.optionanalytics.domain.model.SurfacePoint;
import com.optionanalytics.domain.model.SurfaceSeries;
import com.optionanalytics.domain.model.TermStructureAnchor;
import com.optionanalytics.exception.InvalidInputException;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class VolatilitySurfaceAggregatorTest {

    private static final Instant VALUATION = Instant.parse("2025-06-02T14:30:00Z");
    private static final double SPOT = 100.0;

    private VolatilitySurfaceAggregator aggregator;

    @BeforeEach
    void setUp() {
        aggregator = new VolatilitySurfaceAggregator(new SurfaceConfig());
    }

    private static ImpliedVolatilityResult result(
            String underlying, OptionKind kind, double strike, double expiry, double sigma, boolean converged) {
        OptionContractSpec contract = OptionContractSpec.builder()
                .underlying(underlying)
                .strike(strike)
                .timeToExpiry(expiry)
                .kind(kind)
                .build();
        MarketState market = MarketState.builder()
                .spot(SPOT)
                .riskFreeRate(0.04)
                .dividendYield(0.0)
                .valuationTime(VALUATION)
                .build();
        return ImpliedVolatilityResult.builder()
                .quote(OptionQuote.builder().contract(contract).market(market).marketPrice(1.0).build())
                .model(PricingModelType.BLACK_SCHOLES_MERTON)
                .volatility(sigma)
                .iterations(converged ? 4 : 200)
                .converged(converged)
                .residual(converged ? 0.0 : 0.01)
                .method(SolverMethod.NEWTON_RAPHSON)
                .failureReason(converged ? null : NonConvergenceReason.ITERATION_LIMIT)
                .build();
    }

    private static ImpliedVolatilityResult converged(OptionKind kind, double strike, double expiry, double sigma) {
        return result("SPY", kind, strike, expiry, sigma, true);
    }

    private static List<Double> xs(SurfaceSeries series) {
        return series.getPoints().stream().map(SurfacePoint::getX).toList();
    }

    @Nested
    @DisplayName("Smile")
    class Smile {

        @Test
        @DisplayName("Points are sorted by strike and restricted to the requested expiry")
        void sortedAndFiltered() {
            List<ImpliedVolatilityResult> results = List.of(
                    converged(OptionKind.CALL, 110.0, 0.25, 0.22),
                    converged(OptionKind.CALL, 90.0, 0.25, 0.28),
                    converged(OptionKind.CALL, 100.0, 0.25, 0.24),
                    converged(OptionKind.CALL, 100.0, 0.50, 0.26));

            SurfaceSeries smile = aggregator.buildSmile(results, 0.25);

            assertThat(smile.getAxis()).isEqualTo(SurfaceAxis.STRIKE);
            assertThat(smile.getUnderlying()).isEqualTo("SPY");
            assertThat(smile.getFixedValue()).isEqualTo(0.25);
            assertThat(xs(smile)).containsExactly(90.0, 100.0, 110.0);
            assertThat(smile.getPoints().get(1).getImpliedVolatility()).isEqualTo(0.24);
            assertThat(smile.isQualityDegraded()).isFalse();
        }

        @Test
        @DisplayName("Call and put at the same strike are averaged into one point")
        void averagesDuplicates() {
            List<ImpliedVolatilityResult> results = List.of(
                    converged(OptionKind.CALL, 100.0, 0.25, 0.20), converged(OptionKind.PUT, 100.0, 0.25, 0.22));

            SurfaceSeries smile = aggregator.buildSmile(results, 0.25);

            assertThat(smile.size()).isEqualTo(1);
            assertThat(smile.getPoints().get(0).getImpliedVolatility()).isCloseTo(0.21, within(1e-12));
            assertThat(smile.getPoints().get(0).getSampleCount()).isEqualTo(2);
        }

        @Test
        @DisplayName("The option kind filter keeps only calls or puts")
        void kindFilter() {
            List<ImpliedVolatilityResult> results = List.of(
                    converged(OptionKind.CALL, 100.0, 0.25, 0.20), converged(OptionKind.PUT, 95.0, 0.25, 0.23));

            SurfaceSeries smile = aggregator.buildSmile(results, 0.25, OptionKind.PUT, false);

            assertThat(xs(smile)).containsExactly(95.0);
            assertThat(smile.getOptionKind()).isEqualTo(OptionKind.PUT);
        }

        @Test
        @DisplayName("Expiries within one minute of the requested expiry still match")
        void expiryTolerance() {
            double halfMinute = 0.5 / 525600.0;
            List<ImpliedVolatilityResult> results = List.of(converged(OptionKind.CALL, 100.0, 0.25 + halfMinute, 0.2));

            assertThat(aggregator.buildSmile(results, 0.25).size()).isEqualTo(1);
        }

        @Test
        @DisplayName("Non-converged results are excluded by default")
        void excludesNonConverged() {
            List<ImpliedVolatilityResult> results = List.of(
                    converged(OptionKind.CALL, 100.0, 0.25, 0.20),
                    result("SPY", OptionKind.CALL, 120.0, 0.25, 4.8, false));

            SurfaceSeries smile = aggregator.buildSmile(results, 0.25);

            assertThat(xs(smile)).containsExactly(100.0);
            assertThat(smile.isQualityDegraded()).isFalse();
        }

        @Test
        @DisplayName("Including non-converged results flags the series as quality-degraded")
        void includesNonConvergedWhenAsked() {
            List<ImpliedVolatilityResult> results = List.of(
                    converged(OptionKind.CALL, 100.0, 0.25, 0.20),
                    result("SPY", OptionKind.CALL, 120.0, 0.25, 4.8, false));

            SurfaceSeries smile = aggregator.buildSmile(results, 0.25, null, true);

            assertThat(xs(smile)).containsExactly(100.0, 120.0);
            assertThat(smile.isQualityDegraded()).isTrue();
        }

        @Test
        @DisplayName("Empty input gives an empty series")
        void emptyInput() {
            SurfaceSeries smile = aggregator.buildSmile(List.of(), 0.25);

            assertThat(smile.isEmpty()).isTrue();
            assertThat(smile.getUnderlying()).isNull();
        }

        @Test
        @DisplayName("Mixing underlyings in one series is rejected")
        void rejectsMixedUnderlyings() {
            List<ImpliedVolatilityResult> results = List.of(
                    converged(OptionKind.CALL, 100.0, 0.25, 0.20),
                    result("QQQ", OptionKind.CALL, 105.0, 0.25, 0.21, true));

            assertThatThrownBy(() -> aggregator.buildSmile(results, 0.25)).isInstanceOf(InvalidInputException.class);
        }

        @Test
        @DisplayName("buildSmiles returns one smile per expiry, nearest first")
        void smilesPerExpiry() {
            List<ImpliedVolatilityResult> results = List.of(
                    converged(OptionKind.CALL, 100.0, 0.50, 0.26),
                    converged(OptionKind.CALL, 95.0, 0.25, 0.25),
                    converged(OptionKind.CALL, 105.0, 0.25, 0.23),
                    converged(OptionKind.CALL, 100.0, 1.00, 0.27));

            List<SurfaceSeries> smiles = aggregator.buildSmiles(results);

            assertThat(smiles).extracting(SurfaceSeries::getFixedValue).containsExactly(0.25, 0.50, 1.00);
            assertThat(smiles.get(0).size()).isEqualTo(2);
        }
    }

    @Nested
    @DisplayName("Term structure")
    class TermStructure {

        @Test
        @DisplayName("Strike anchor selects one strike across expiries, sorted by expiry")
        void strikeAnchor() {
            List<ImpliedVolatilityResult> results = List.of(
                    converged(OptionKind.CALL, 100.0, 1.00, 0.27),
                    converged(OptionKind.CALL, 100.0, 0.25, 0.24),
                    converged(OptionKind.CALL, 105.0, 0.50, 0.22),
                    converged(OptionKind.CALL, 100.0, 0.50, 0.25));

            SurfaceSeries term = aggregator.buildTermStructure(results, TermStructureAnchor.strike(100.0));

            assertThat(term.getAxis()).isEqualTo(SurfaceAxis.EXPIRY);
            assertThat(term.isMoneynessAnchored()).isFalse();
            assertThat(xs(term)).containsExactly(0.25, 0.50, 1.00);
            assertThat(term.getPoints()).extracting(SurfacePoint::getImpliedVolatility).containsExactly(0.24, 0.25, 0.27);
        }

        @Test
        @DisplayName("Moneyness anchor averages the strikes inside the bucket at each expiry")
        void moneynessAnchor() {
            List<ImpliedVolatilityResult> results = List.of(
                    converged(OptionKind.CALL, 95.0, 0.25, 0.26),
                    converged(OptionKind.CALL, 105.0, 0.25, 0.22),
                    converged(OptionKind.CALL, 130.0, 0.25, 0.19),
                    converged(OptionKind.CALL, 110.0, 0.50, 0.21));

            SurfaceSeries term = aggregator.buildTermStructure(results, TermStructureAnchor.moneyness(1.0, 0.10));

            assertThat(term.isMoneynessAnchored()).isTrue();
            assertThat(xs(term)).containsExactly(0.25, 0.50);
            assertThat(term.getPoints().get(0).getImpliedVolatility()).isCloseTo(0.24, within(1e-12));
            assertThat(term.getPoints().get(0).getSampleCount()).isEqualTo(2);
        }

        @Test
        @DisplayName("ATM term structure uses the configured bucket")
        void atmTermStructure() {
            List<ImpliedVolatilityResult> results = List.of(
                    converged(OptionKind.PUT, 100.0, 0.25, 0.24), converged(OptionKind.PUT, 150.0, 0.25, 0.30));

            SurfaceSeries term = aggregator.buildAtmTermStructure(results);

            assertThat(term.getPoints()).extracting(SurfacePoint::getImpliedVolatility).containsExactly(0.24);
        }
    }
}
