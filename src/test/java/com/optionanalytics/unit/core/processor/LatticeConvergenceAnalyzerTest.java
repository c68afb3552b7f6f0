package com.optionanalytics.unit.core.processor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.optionanalytics.config.LatticeConfig;
import com.optionanalytics.core.pricing.BlackScholesMertonModel;
import com.optionanalytics.core.pricing.PricingModelSelector;
import com.optionanalytics.core.processor.LatticeConvergenceAnalyzer;
import com.optionanalytics.domain.enums.ExerciseStyle;
import com.optionanalytics.domain.enums.OptionKind;
import com.optionanalytics.domain.model.ConvergenceReport;
import com.optionanalytics.domain.model.ConvergenceStep;
import com.optionanalytics.domain.model.EarlyExerciseComparison;
import com.optionanalytics.domain.model.MarketState;
import com.optionanalytics.domain.model.OptionContractSpec;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class LatticeConvergenceAnalyzerTest {

    private LatticeConvergenceAnalyzer analyzer;
    private LatticeConfig latticeConfig;

    private final MarketState market = MarketState.builder()
            .spot(100.0)
            .riskFreeRate(0.05)
            .dividendYield(0.0)
            .valuationTime(Instant.parse("2025-06-02T14:30:00Z"))
            .build();

    @BeforeEach
    void setUp() {
        latticeConfig = new LatticeConfig();
        latticeConfig.setConvergenceSteps(List.of(10, 20, 40));
        analyzer = new LatticeConvergenceAnalyzer(
                new PricingModelSelector(new BlackScholesMertonModel(), latticeConfig), latticeConfig);
    }

    private static OptionContractSpec put(ExerciseStyle style) {
        return OptionContractSpec.builder()
                .underlying("SPY")
                .strike(100.0)
                .timeToExpiry(1.0)
                .kind(OptionKind.PUT)
                .exerciseStyle(style)
                .build();
    }

    @Test
    @DisplayName("Report lists each requested step count against the closed-form reference")
    void reportsRequestedSteps() {
        ConvergenceReport report = analyzer.analyze(put(ExerciseStyle.EUROPEAN), market, 0.2, List.of(25, 100, 400));

        assertThat(report.getReferencePrice()).isCloseTo(5.573526022256971, within(1e-9));
        assertThat(report.getSteps()).extracting(ConvergenceStep::getSteps).containsExactly(25, 100, 400);
        for (ConvergenceStep step : report.getSteps()) {
            assertThat(step.getError()).isCloseTo(step.getLatticePrice() - report.getReferencePrice(), within(1e-12));
            assertThat(step.getElapsedMicros()).isNotNegative();
        }
        assertThat(report.getFinalAbsoluteError()).isLessThan(Math.abs(report.getSteps().get(0).getError()));
    }

    @Test
    @DisplayName("American contracts are analyzed as their European counterpart")
    void forcesEuropean() {
        ConvergenceReport report = analyzer.analyze(put(ExerciseStyle.AMERICAN), market, 0.2, List.of(500));

        assertThat(report.getContract().getExerciseStyle()).isEqualTo(ExerciseStyle.EUROPEAN);
        assertThat(report.getFinalAbsoluteError()).isLessThan(0.01);
    }

    @Test
    @DisplayName("Without step counts the configured schedule is used")
    void defaultSchedule() {
        ConvergenceReport report = analyzer.analyze(put(ExerciseStyle.EUROPEAN), market, 0.2, null);

        assertThat(report.getSteps()).extracting(ConvergenceStep::getSteps).containsExactly(10, 20, 40);
    }

    @Test
    @DisplayName("Early-exercise premium of an ATM put is positive")
    void earlyExercisePremium() {
        EarlyExerciseComparison comparison =
                analyzer.compareEarlyExercise(put(ExerciseStyle.EUROPEAN), market, 0.2, 500);

        assertThat(comparison.getSteps()).isEqualTo(500);
        assertThat(comparison.getContract().isAmerican()).isTrue();
        assertThat(comparison.getLatticeAmericanPrice()).isCloseTo(6.0888, within(1e-3));
        assertThat(comparison.getLatticeEuropeanPrice())
                .isCloseTo(comparison.getClosedFormEuropeanPrice(), within(0.01));
        assertThat(comparison.getEarlyExercisePremium()).isGreaterThan(0.5);
    }
}
