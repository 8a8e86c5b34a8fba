package com.sankeydsl.loader.ast;

import com.sankeydsl.loader.Comparison;
import java.util.Objects;

/** A single declared flow. The value is always positive; recognizers never build one otherwise. */
public final class FlowStatementNode implements StatementNode {

    private final SourceLocation location;
    private final Notation notation;
    private final String sourceName;
    private final String targetName;
    private final double value;
    private final Comparison comparison;

    public FlowStatementNode(
            SourceLocation location,
            Notation notation,
            String sourceName,
            String targetName,
            double value,
            Comparison comparison) {
        this.location = Objects.requireNonNull(location, "location");
        this.notation = Objects.requireNonNull(notation, "notation");
        this.sourceName = Objects.requireNonNull(sourceName, "sourceName");
        this.targetName = Objects.requireNonNull(targetName, "targetName");
        if (!(value > 0) || Double.isInfinite(value)) {
            throw new IllegalArgumentException("Flow value must be positive and finite: " + value);
        }
        this.value = value;
        this.comparison = comparison == null ? Comparison.none() : comparison;
    }

    @Override
    public SourceLocation getLocation() {
        return location;
    }

    public Notation getNotation() {
        return notation;
    }

    public String getSourceName() {
        return sourceName;
    }

    public String getTargetName() {
        return targetName;
    }

    public double getValue() {
        return value;
    }

    public Comparison getComparison() {
        return comparison;
    }
}
