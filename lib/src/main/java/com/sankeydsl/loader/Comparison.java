package com.sankeydsl.loader;

import java.util.Objects;

/**
 * Outcome of resolving a comparison token: a previous-period value with its computed delta label,
 * a pre-formatted label on its own, or nothing.
 */
public final class Comparison {
    private static final Comparison NONE = new Comparison(null, null);

    private final Double previousValue;
    private final String label;

    private Comparison(Double previousValue, String label) {
        this.previousValue = previousValue;
        this.label = label;
    }

    public static Comparison none() {
        return NONE;
    }

    public static Comparison ofLabel(String label) {
        return new Comparison(null, Objects.requireNonNull(label, "label"));
    }

    public static Comparison ofPrevious(double previousValue, String label) {
        return new Comparison(previousValue, Objects.requireNonNull(label, "label"));
    }

    public Double getPreviousValue() {
        return previousValue;
    }

    public String getLabel() {
        return label;
    }

    public boolean isPresent() {
        return previousValue != null || label != null;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Comparison)) {
            return false;
        }
        Comparison other = (Comparison) obj;
        return Objects.equals(previousValue, other.previousValue) && Objects.equals(label, other.label);
    }

    @Override
    public int hashCode() {
        return Objects.hash(previousValue, label);
    }

    @Override
    public String toString() {
        return "Comparison[previous=" + previousValue + ", label=" + label + "]";
    }
}
