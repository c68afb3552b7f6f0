package com.optionanalytics.core.processor;

import com.optionanalytics.config.SurfaceConfig;
import com.optionanalytics.domain.InputChecks;
import com.optionanalytics.domain.enums.OptionKind;
import com.optionanalytics.domain.enums.SurfaceAxis;
import com.optionanalytics.domain.model.ImpliedVolatilityResult;
import com.optionanalytics.domain.model.OptionQuote;
import com.optionanalytics.domain.model.SurfacePoint;
import com.optionanalytics.domain.model.SurfaceSeries;
import com.optionanalytics.domain.model.TermStructureAnchor;
import com.optionanalytics.exception.InvalidInputException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Predicate;
import java.util.function.ToDoubleFunction;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Builds volatility smiles (sigma against strike at one expiry) and term structures (sigma
 * against expiry at one strike or moneyness bucket) from a snapshot of solve results.
 *
 * <p>Every series is sorted ascending by x. Results whose x values fall within the configured
 * tolerance of each other (a call and a put at the same strike, say) are averaged into one
 * point. Non-converged results are skipped unless explicitly included, in which case the
 * series is flagged as quality-degraded. An empty input yields an empty series.
 */
@Slf4j
@Component
public class VolatilitySurfaceAggregator {

    // Absorbs rounding in K/S at the edge of a moneyness bucket
    private static final double MONEYNESS_EPSILON = 1e-12;

    private final SurfaceConfig config;

    public VolatilitySurfaceAggregator(SurfaceConfig config) {
        this.config = config;
    }

    public SurfaceSeries buildSmile(Collection<ImpliedVolatilityResult> results, double fixedExpiry) {
        return buildSmile(results, fixedExpiry, null, config.isIncludeNonConverged());
    }

    /**
     * @param results             solve results, in any order
     * @param fixedExpiry         expiry in years the smile is cut at
     * @param kind                restrict to calls or puts, or null for both
     * @param includeNonConverged let non-converged solves contribute their best sigma
     */
    public SurfaceSeries buildSmile(
            Collection<ImpliedVolatilityResult> results,
            double fixedExpiry,
            OptionKind kind,
            boolean includeNonConverged) {
        InputChecks.requireNonNegative("fixedExpiry", fixedExpiry);
        List<ImpliedVolatilityResult> selected = select(
                results,
                kind,
                includeNonConverged,
                r -> Math.abs(quote(r).getContract().getTimeToExpiry() - fixedExpiry) <= config.getExpiryTolerance());

        return SurfaceSeries.builder()
                .axis(SurfaceAxis.STRIKE)
                .underlying(underlyingOf(selected))
                .fixedValue(fixedExpiry)
                .moneynessAnchored(false)
                .optionKind(kind)
                .points(collapse(selected, r -> quote(r).getContract().getStrike(), config.getStrikeTolerance()))
                .qualityDegraded(hasNonConverged(selected))
                .build();
    }

    /** One smile per distinct expiry present in the results, nearest expiry first. */
    public List<SurfaceSeries> buildSmiles(Collection<ImpliedVolatilityResult> results) {
        return buildSmiles(results, null, config.isIncludeNonConverged());
    }

    public List<SurfaceSeries> buildSmiles(
            Collection<ImpliedVolatilityResult> results, OptionKind kind, boolean includeNonConverged) {
        List<ImpliedVolatilityResult> usable = select(results, kind, includeNonConverged, r -> true);
        List<Double> expiries = usable.stream()
                .map(r -> quote(r).getContract().getTimeToExpiry())
                .sorted()
                .toList();

        List<Double> distinct = new ArrayList<>();
        for (Double expiry : expiries) {
            if (distinct.isEmpty() || expiry - distinct.get(distinct.size() - 1) > config.getExpiryTolerance()) {
                distinct.add(expiry);
            }
        }

        List<SurfaceSeries> smiles = new ArrayList<>(distinct.size());
        for (Double expiry : distinct) {
            smiles.add(buildSmile(usable, expiry, kind, includeNonConverged));
        }
        return smiles;
    }

    public SurfaceSeries buildTermStructure(Collection<ImpliedVolatilityResult> results, TermStructureAnchor anchor) {
        return buildTermStructure(results, anchor, null, config.isIncludeNonConverged());
    }

    /**
     * @param anchor either a fixed strike or a moneyness bucket K/S within value +/- halfWidth
     */
    public SurfaceSeries buildTermStructure(
            Collection<ImpliedVolatilityResult> results,
            TermStructureAnchor anchor,
            OptionKind kind,
            boolean includeNonConverged) {
        InputChecks.requirePresent("anchor", anchor);
        Predicate<ImpliedVolatilityResult> onAnchor = switch (anchor.getType()) {
            case STRIKE -> r ->
                    Math.abs(quote(r).getContract().getStrike() - anchor.getValue()) <= config.getStrikeTolerance();
            case MONEYNESS -> r ->
                    Math.abs(quote(r).getMoneyness() - anchor.getValue()) <= anchor.getHalfWidth() + MONEYNESS_EPSILON;
        };
        List<ImpliedVolatilityResult> selected = select(results, kind, includeNonConverged, onAnchor);

        return SurfaceSeries.builder()
                .axis(SurfaceAxis.EXPIRY)
                .underlying(underlyingOf(selected))
                .fixedValue(anchor.getValue())
                .moneynessAnchored(anchor.getType() == TermStructureAnchor.Type.MONEYNESS)
                .optionKind(kind)
                .points(collapse(
                        selected, r -> quote(r).getContract().getTimeToExpiry(), config.getExpiryTolerance()))
                .qualityDegraded(hasNonConverged(selected))
                .build();
    }

    /** Term structure of the at-the-money bucket, K/S within 1 +/- the configured half-width. */
    public SurfaceSeries buildAtmTermStructure(Collection<ImpliedVolatilityResult> results) {
        return buildTermStructure(
                results, TermStructureAnchor.moneyness(1.0, config.getAtmMoneynessHalfWidth()));
    }

    private List<ImpliedVolatilityResult> select(
            Collection<ImpliedVolatilityResult> results,
            OptionKind kind,
            boolean includeNonConverged,
            Predicate<ImpliedVolatilityResult> onSlice) {
        if (results == null || results.isEmpty()) {
            return List.of();
        }
        List<ImpliedVolatilityResult> selected = results.stream()
                .filter(r -> includeNonConverged || r.isConverged())
                .filter(r -> Double.isFinite(r.getVolatility()))
                .filter(r -> kind == null || quote(r).getContract().getKind() == kind)
                .filter(onSlice)
                .toList();
        log.debug("Selected {} of {} results for surface slice", selected.size(), results.size());
        return selected;
    }

    /**
     * Groups results whose x lies within {@code tolerance} of the first x of the group and
     * averages their volatilities. Returned points are ascending in x.
     */
    private static List<SurfacePoint> collapse(
            List<ImpliedVolatilityResult> results, ToDoubleFunction<ImpliedVolatilityResult> x, double tolerance) {
        List<ImpliedVolatilityResult> sorted = new ArrayList<>(results);
        sorted.sort(Comparator.comparingDouble(x));

        // group anchor x -> [sum of x, sum of sigma, count]
        Map<Double, double[]> groups = new TreeMap<>();
        double anchor = Double.NaN;
        for (ImpliedVolatilityResult result : sorted) {
            double value = x.applyAsDouble(result);
            if (Double.isNaN(anchor) || value - anchor > tolerance) {
                anchor = value;
            }
            double[] acc = groups.computeIfAbsent(anchor, k -> new double[3]);
            acc[0] += value;
            acc[1] += result.getVolatility();
            acc[2] += 1;
        }

        List<SurfacePoint> points = new ArrayList<>(groups.size());
        for (double[] acc : groups.values()) {
            int count = (int) acc[2];
            points.add(new SurfacePoint(acc[0] / count, acc[1] / count, count));
        }
        return points;
    }

    private static String underlyingOf(List<ImpliedVolatilityResult> selected) {
        String underlying = null;
        for (ImpliedVolatilityResult result : selected) {
            String current = quote(result).getContract().getUnderlying();
            if (underlying == null) {
                underlying = current;
            } else if (!underlying.equals(current)) {
                throw new InvalidInputException(
                        "A surface series cannot mix underlyings: " + underlying + " and " + current);
            }
        }
        return underlying;
    }

    private static boolean hasNonConverged(List<ImpliedVolatilityResult> selected) {
        return selected.stream().anyMatch(r -> !r.isConverged());
    }

    private static OptionQuote quote(ImpliedVolatilityResult result) {
        return result.getQuote();
    }
}
