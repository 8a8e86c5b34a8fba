package com.sankeydsl.loader;

import com.sankeydsl.loader.ast.FlowStatementNode;
import com.sankeydsl.loader.ast.Notation;
import com.sankeydsl.loader.ast.RejectedLineNode;
import com.sankeydsl.loader.ast.SourceLocation;
import com.sankeydsl.loader.ast.StatementNode;
import java.util.List;
import java.util.Objects;

/** One data row of a pasted table after column roles have been assigned. */
public final class TabularRow {
    private final SourceLocation location;
    private final List<String> cells;
    private final String source;
    private final String target;
    private final String valueToken;
    private final String comparisonToken;

    public TabularRow(
            SourceLocation location,
            List<String> cells,
            String source,
            String target,
            String valueToken,
            String comparisonToken) {
        this.location = Objects.requireNonNull(location, "location");
        this.cells = List.copyOf(cells);
        this.source = source == null ? "" : source.trim();
        this.target = target == null ? "" : target.trim();
        this.valueToken = valueToken == null ? "" : valueToken.trim();
        this.comparisonToken = comparisonToken == null ? "" : comparisonToken.trim();
    }

    public SourceLocation getLocation() {
        return location;
    }

    public String getSource() {
        return source;
    }

    public String getTarget() {
        return target;
    }

    public String getValueToken() {
        return valueToken;
    }

    public String getComparisonToken() {
        return comparisonToken;
    }

    public double getValue() {
        return NumberParser.parse(valueToken);
    }

    /** Null when the row can become a flow, otherwise why it cannot. */
    public String rejectionReason() {
        if (cells.size() < 2) {
            return "Row has fewer than two columns";
        }
        if (source.isEmpty() || target.isEmpty()) {
            return "Row is missing a source or target";
        }
        if (hasBracket(source) || hasBracket(target)) {
            return "Node names may not contain '[' or ']'";
        }
        if (!(getValue() > 0)) {
            return "Flow value is not a positive number: '" + valueToken + "'";
        }
        return null;
    }

    public boolean isValid() {
        return rejectionReason() == null;
    }

    public StatementNode toStatement() {
        String reason = rejectionReason();
        if (reason != null) {
            return new RejectedLineNode(location, String.join(" | ", cells), reason);
        }
        double value = getValue();
        return new FlowStatementNode(
                location,
                Notation.TABULAR,
                source,
                target,
                value,
                ComparisonResolver.resolve(value, comparisonToken));
    }

    private static boolean hasBracket(String name) {
        return name.indexOf('[') >= 0 || name.indexOf(']') >= 0;
    }
}
