/* (C)2026 */
package com.ammann.captionbox.model;

import com.ammann.captionbox.enumeration.FeatureName;
import com.ammann.captionbox.exception.DimensionMismatchException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;
import java.util.List;

/**
 * Immutable 26-dimensional feature vector describing one OCR box in its layout context.
 *
 * <p>Values are ordered as declared in {@link FeatureName}.
 */
public final class FeatureVector {

    private final double[] values;

    private FeatureVector(double[] values) {
        this.values = values;
    }

    /**
     * Creates a feature vector from a copy of the given values.
     *
     * @throws DimensionMismatchException if the array does not hold exactly 26 values
     */
    @JsonCreator
    public static FeatureVector of(double... values) {
        if (values == null || values.length != FeatureName.COUNT) {
            throw DimensionMismatchException.of(
                    "features", FeatureName.COUNT, values == null ? 0 : values.length);
        }
        return new FeatureVector(values.clone());
    }

    public static FeatureVector of(List<Double> values) {
        if (values == null) {
            throw DimensionMismatchException.of("features", FeatureName.COUNT, 0);
        }
        return of(values.stream().mapToDouble(Double::doubleValue).toArray());
    }

    public double get(int index) {
        return values[index];
    }

    public double get(FeatureName feature) {
        return values[feature.ordinal()];
    }

    public int size() {
        return values.length;
    }

    /**
     * Returns a copy with one feature replaced.
     */
    public FeatureVector with(FeatureName feature, double value) {
        double[] copy = values.clone();
        copy[feature.ordinal()] = value;
        return new FeatureVector(copy);
    }

    @JsonValue
    public double[] toArray() {
        return values.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FeatureVector other)) return false;
        return Arrays.equals(values, other.values);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "FeatureVector" + Arrays.toString(values);
    }
}
