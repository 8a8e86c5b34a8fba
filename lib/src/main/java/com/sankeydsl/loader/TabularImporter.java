package com.sankeydsl.loader;

import com.sankeydsl.writer.NumberFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Converts a pasted table into bracket-notation text so it can be edited and re-parsed like any
 * other flow text. Rows that cannot become flows are left out.
 */
public final class TabularImporter {

    private final TabularAstBuilder tabularBuilder;

    public TabularImporter() {
        this(new TabularAstBuilder());
    }

    public TabularImporter(TabularAstBuilder tabularBuilder) {
        this.tabularBuilder = Objects.requireNonNull(tabularBuilder, "tabularBuilder");
    }

    public String toFlowText(String text) {
        List<String> lines = new ArrayList<>();
        for (TabularRow row : tabularBuilder.readRows("<paste>", text)) {
            if (!row.isValid()) {
                continue;
            }
            String value = NumberFormatter.format(row.getValue());
            String comparison = ComparisonResolver.sanitizeLabel(row.getComparisonToken());
            if (comparison != null) {
                lines.add(row.getSource() + " [" + value + ", " + comparison + "] " + row.getTarget());
            } else {
                lines.add(row.getSource() + " [" + value + "] " + row.getTarget());
            }
        }
        return String.join("\n", lines);
    }
}
