package com.optionanalytics.unit.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.optionanalytics.config.LatticeConfig;
import com.optionanalytics.config.SolverConfig;
import com.optionanalytics.core.pricing.BinomialLatticeModel;
import com.optionanalytics.core.pricing.BlackScholesMertonModel;
import com.optionanalytics.core.pricing.PricingModelSelector;
import com.optionanalytics.core.processor.ImpliedVolatilitySolver;
import com.optionanalytics.domain.enums.ExerciseStyle;
import com.optionanalytics.domain.enums.NonConvergenceReason;
import com.optionanalytics.domain.enums.OptionKind;
import com.optionanalytics.domain.enums.PricingModelType;
import com.optionanalytics.domain.model.ContractAnalytics;
import com.optionanalytics.domain.model.MarketState;
import com.optionanalytics.domain.model.OptionContractSpec;
import com.optionanalytics.domain.model.OptionQuote;
import com.optionanalytics.exception.InvalidInputException;
import com.optionanalytics.observability.AnalyticsMetrics;
import com.optionanalytics.service.ChainAnalyticsJob;
import com.optionanalytics.service.ChainAnalyticsService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Tests for chain batch analytics. Most tests run units inline on the calling thread; the
 * cancellation tests queue units and run them by hand to control what has started.
 */
class ChainAnalyticsServiceTest {

    private static final MarketState MARKET = MarketState.builder()
            .spot(100.0)
            .riskFreeRate(0.05)
            .dividendYield(0.0)
            .valuationTime(Instant.parse("2025-06-02T14:30:00Z"))
            .build();

    private final BlackScholesMertonModel closedForm = new BlackScholesMertonModel();
    private SimpleMeterRegistry meterRegistry;
    private PricingModelSelector selector;
    private ImpliedVolatilitySolver solver;
    private AnalyticsMetrics metrics;

    @BeforeEach
    void setUp() {
        LatticeConfig latticeConfig = new LatticeConfig();
        latticeConfig.setDefaultSteps(100);
        meterRegistry = new SimpleMeterRegistry();
        selector = new PricingModelSelector(closedForm, latticeConfig);
        solver = new ImpliedVolatilitySolver(new SolverConfig());
        metrics = new AnalyticsMetrics(meterRegistry);
    }

    private ChainAnalyticsService service(Executor executor) {
        return new ChainAnalyticsService(solver, selector, metrics, executor);
    }

    private OptionQuote quoteAt(OptionKind kind, ExerciseStyle style, double strike, double sigma) {
        OptionContractSpec contract = OptionContractSpec.builder()
                .underlying("SPY")
                .strike(strike)
                .timeToExpiry(0.5)
                .kind(kind)
                .exerciseStyle(style)
                .build();
        double price = selector.select(null, null, contract).price(contract, MARKET, sigma);
        return OptionQuote.builder().contract(contract).market(MARKET).marketPrice(price).build();
    }

    private static OptionQuote quoteWithPrice(double strike, double price) {
        OptionContractSpec contract = OptionContractSpec.builder()
                .underlying("SPY")
                .strike(strike)
                .timeToExpiry(0.5)
                .kind(OptionKind.CALL)
                .build();
        return OptionQuote.builder().contract(contract).market(MARKET).marketPrice(price).build();
    }

    @Nested
    @DisplayName("Batch analysis")
    class Analyze {

        @Test
        @DisplayName("Results keep input order and carry Greeks and a re-priced value")
        void analyzesChain() {
            List<OptionQuote> quotes = List.of(
                    quoteAt(OptionKind.CALL, ExerciseStyle.EUROPEAN, 110.0, 0.22),
                    quoteAt(OptionKind.PUT, ExerciseStyle.EUROPEAN, 90.0, 0.28),
                    quoteAt(OptionKind.CALL, ExerciseStyle.EUROPEAN, 100.0, 0.25));

            List<ContractAnalytics> results = service(Runnable::run).analyze(quotes, null, null);

            assertThat(results).extracting(a -> a.getQuote().getContract().getStrike()).containsExactly(110.0, 90.0, 100.0);
            assertThat(results.get(0).getImpliedVolatility().getVolatility()).isCloseTo(0.22, within(1e-6));
            assertThat(results.get(1).getImpliedVolatility().getVolatility()).isCloseTo(0.28, within(1e-6));
            for (ContractAnalytics analytics : results) {
                assertThat(analytics.isConverged()).isTrue();
                assertThat(analytics.getGreeks()).isNotNull();
                assertThat(analytics.getPricingError()).isCloseTo(0.0, within(1e-8));
            }
        }

        @Test
        @DisplayName("American quotes are inverted on the lattice when no model is given")
        void americanUsesLattice() {
            List<ContractAnalytics> results = service(Runnable::run)
                    .analyze(List.of(quoteAt(OptionKind.PUT, ExerciseStyle.AMERICAN, 105.0, 0.3)), null, null);

            assertThat(results.get(0).getImpliedVolatility().getModel()).isEqualTo(PricingModelType.CRR_BINOMIAL);
            assertThat(results.get(0).getImpliedVolatility().getVolatility()).isCloseTo(0.3, within(1e-6));
        }

        @Test
        @DisplayName("A non-converged quote does not abort the batch and has no Greeks")
        void nonConvergedKeepsGoing() {
            List<OptionQuote> quotes = List.of(
                    quoteWithPrice(50.0, 1.0), quoteAt(OptionKind.CALL, ExerciseStyle.EUROPEAN, 100.0, 0.25));

            List<ContractAnalytics> results = service(Runnable::run).analyze(quotes, null, null);

            assertThat(results.get(0).isConverged()).isFalse();
            assertThat(results.get(0).getImpliedVolatility().getFailureReason())
                    .isEqualTo(NonConvergenceReason.PRICE_BELOW_RANGE);
            assertThat(results.get(0).getGreeks()).isNull();
            assertThat(results.get(0).getModelPrice()).isNull();
            assertThat(results.get(1).isConverged()).isTrue();
            assertThat(meterRegistry.get("iv.solves.non_converged").counter().count()).isEqualTo(1.0);
            assertThat(meterRegistry.get("chain.analytics.duration").timer().count()).isEqualTo(1);
        }

        @Test
        @DisplayName("A lattice solve at the edge of the admissible volatility range still gets Greeks")
        void latticeSolveNearMinimumVolatility() {
            MarketState carry = MARKET.toBuilder().riskFreeRate(0.01).dividendYield(0.03).build();
            BinomialLatticeModel lattice = new BinomialLatticeModel(100);
            OptionContractSpec put = OptionContractSpec.builder()
                    .underlying("SPY")
                    .strike(98.02)
                    .timeToExpiry(1.0)
                    .kind(OptionKind.PUT)
                    .build();
            double sigma = 1.002 * lattice.minimumAdmissibleVolatility(put, carry);
            OptionQuote edge = OptionQuote.builder()
                    .contract(put)
                    .market(carry)
                    .marketPrice(lattice.price(put, carry, sigma))
                    .build();
            OptionQuote regular = quoteAt(OptionKind.CALL, ExerciseStyle.EUROPEAN, 100.0, 0.25);

            List<ContractAnalytics> results = service(Runnable::run)
                    .analyze(List.of(regular, edge), PricingModelType.CRR_BINOMIAL, 100);

            assertThat(results).hasSize(2);
            assertThat(results).allMatch(ContractAnalytics::isConverged);
            assertThat(results.get(1).getImpliedVolatility().getVolatility()).isCloseTo(sigma, within(1e-6));
            assertThat(results.get(1).getGreeks()).isNotNull();
            assertThat(results.get(1).getGreeks().getRho()).isNegative();
        }

        @Test
        @DisplayName("Invalid input fails the whole batch")
        void invalidInputPropagates() {
            List<OptionQuote> quotes = List.of(quoteAt(OptionKind.CALL, ExerciseStyle.EUROPEAN, 100.0, 0.25));

            assertThatThrownBy(() -> service(Runnable::run).analyze(quotes, PricingModelType.CRR_BINOMIAL, 0))
                    .isInstanceOf(InvalidInputException.class);
        }

        @Test
        @DisplayName("Results are identical on a real thread pool")
        void parallelMatchesSequential() {
            List<OptionQuote> quotes = new ArrayList<>();
            for (int i = 0; i < 20; i++) {
                quotes.add(quoteAt(OptionKind.CALL, ExerciseStyle.EUROPEAN, 80.0 + 2.0 * i, 0.2 + 0.005 * i));
            }
            ExecutorService pool = Executors.newFixedThreadPool(4);
            try {
                List<ContractAnalytics> parallel = service(pool).analyze(quotes, null, null);
                List<ContractAnalytics> sequential = service(Runnable::run).analyze(quotes, null, null);

                for (int i = 0; i < quotes.size(); i++) {
                    assertThat(parallel.get(i).getImpliedVolatility().getVolatility())
                            .isEqualTo(sequential.get(i).getImpliedVolatility().getVolatility());
                }
            } finally {
                pool.shutdownNow();
            }
        }
    }

    @Nested
    @DisplayName("Cancellation")
    class Cancellation {

        @Test
        @DisplayName("Cancelling stops pending units and keeps completed results")
        void cancelKeepsCompleted() {
            List<Runnable> queued = new ArrayList<>();
            List<OptionQuote> quotes = List.of(
                    quoteAt(OptionKind.CALL, ExerciseStyle.EUROPEAN, 95.0, 0.2),
                    quoteAt(OptionKind.CALL, ExerciseStyle.EUROPEAN, 100.0, 0.2),
                    quoteAt(OptionKind.CALL, ExerciseStyle.EUROPEAN, 105.0, 0.2));

            ChainAnalyticsJob job = service(queued::add).submit(quotes, null, null);
            queued.get(0).run();

            assertThat(job.cancel()).isEqualTo(2);
            queued.subList(1, queued.size()).forEach(Runnable::run);

            assertThat(job.isDone()).isTrue();
            assertThat(job.isCancelled()).isTrue();
            assertThat(job.completedResults()).hasSize(1);
            assertThat(job.completedResults().get(0).getQuote().getContract().getStrike()).isEqualTo(95.0);
            assertThatThrownBy(job::join).isInstanceOf(CancellationException.class);
        }

        @Test
        @DisplayName("Cancelling a finished batch changes nothing")
        void cancelAfterCompletion() {
            ChainAnalyticsJob job = service(Runnable::run)
                    .submit(List.of(quoteAt(OptionKind.PUT, ExerciseStyle.EUROPEAN, 100.0, 0.2)), null, null);

            assertThat(job.cancel()).isZero();
            assertThat(job.join()).hasSize(1);
        }
    }
}
