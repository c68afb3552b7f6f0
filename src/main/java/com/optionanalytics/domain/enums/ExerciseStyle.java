package com.optionanalytics.domain.enums;

/**
 * When the holder may exercise. EUROPEAN only at expiry; AMERICAN at any time up to expiry,
 * which only the lattice model values correctly.
 */
public enum ExerciseStyle {
    EUROPEAN,
    AMERICAN
}
