package com.sankeydsl.graph;

import java.util.Objects;

public final class FlowLink {
    private final String sourceId;
    private final String targetId;
    private final double value;
    private final Double previousValue;
    private final String comparisonLabel;

    public FlowLink(
            String sourceId,
            String targetId,
            double value,
            Double previousValue,
            String comparisonLabel) {
        this.sourceId = Objects.requireNonNull(sourceId, "sourceId");
        this.targetId = Objects.requireNonNull(targetId, "targetId");
        if (!(value > 0) || Double.isInfinite(value)) {
            throw new IllegalArgumentException("Link value must be positive and finite: " + value);
        }
        this.value = value;
        this.previousValue = previousValue;
        this.comparisonLabel = comparisonLabel;
    }

    public FlowLink(String sourceId, String targetId, double value) {
        this(sourceId, targetId, value, null, null);
    }

    public String getSourceId() {
        return sourceId;
    }

    public String getTargetId() {
        return targetId;
    }

    public double getValue() {
        return value;
    }

    public Double getPreviousValue() {
        return previousValue;
    }

    public boolean hasPreviousValue() {
        return previousValue != null;
    }

    public String getComparisonLabel() {
        return comparisonLabel;
    }

    public boolean hasComparisonLabel() {
        return comparisonLabel != null && !comparisonLabel.isEmpty();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof FlowLink)) {
            return false;
        }
        FlowLink other = (FlowLink) obj;
        return Double.compare(value, other.value) == 0
                && sourceId.equals(other.sourceId)
                && targetId.equals(other.targetId)
                && Objects.equals(previousValue, other.previousValue)
                && Objects.equals(comparisonLabel, other.comparisonLabel);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sourceId, targetId, value, previousValue, comparisonLabel);
    }

    @Override
    public String toString() {
        return sourceId + " -> " + targetId + " : " + value;
    }
}
