package com.optionanalytics.domain.model;

import com.optionanalytics.domain.enums.OptionKind;
import com.optionanalytics.domain.enums.SurfaceAxis;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Cross-section of implied volatility, sorted ascending by x. Built wholesale from a
 * snapshot of solved quotes and never updated in place.
 *
 * <ul>
 *   <li>Smile: axis STRIKE, {@code fixedValue} is the expiry in years.
 *   <li>Term structure: axis EXPIRY, {@code fixedValue} is the anchor strike or moneyness.
 * </ul>
 */
@Value
public class SurfaceSeries {

    SurfaceAxis axis;

    /** Underlying of the contributing quotes, or null when the series is empty. */
    String underlying;

    double fixedValue;

    /** Set for term structures anchored on moneyness rather than a strike. */
    boolean moneynessAnchored;

    /** Call/put filter applied, or null when both kinds contribute. */
    OptionKind optionKind;

    List<SurfacePoint> points;

    /** True when non-converged solves were allowed to contribute. */
    boolean qualityDegraded;

    @Builder
    public SurfaceSeries(
            SurfaceAxis axis,
            String underlying,
            double fixedValue,
            boolean moneynessAnchored,
            OptionKind optionKind,
            List<SurfacePoint> points,
            boolean qualityDegraded) {
        this.axis = axis;
        this.underlying = underlying;
        this.fixedValue = fixedValue;
        this.moneynessAnchored = moneynessAnchored;
        this.optionKind = optionKind;
        this.points = points != null ? List.copyOf(points) : List.of();
        this.qualityDegraded = qualityDegraded;
    }

    public boolean isEmpty() {
        return points.isEmpty();
    }

    public int size() {
        return points.size();
    }
}
