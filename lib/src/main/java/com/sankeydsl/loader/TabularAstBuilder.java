package com.sankeydsl.loader;

import com.sankeydsl.loader.ast.DocumentNode;
import com.sankeydsl.loader.ast.SourceLocation;
import com.sankeydsl.loader.ast.StatementNode;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Reads whole pasted tables (CSV or tab separated, optionally with a header row) into flow
 * statements. With a recognizable header, columns are mapped by role; otherwise rows are positional
 * {@code source, target, value[, comparison]}, switching to {@code source, value, target[,
 * comparison]} when the second cell is numeric. The positional switch is a heuristic and will
 * misread node names that are themselves numbers.
 */
public final class TabularAstBuilder {

    private static final Set<String> SOURCE_HEADERS =
            Set.of("from", "source", "from node", "source node");
    private static final Set<String> TARGET_HEADERS =
            Set.of("to", "target", "to node", "target node");
    private static final List<String> VALUE_HINTS = List.of("amount", "value", "current");
    private static final List<String> COMPARISON_HINTS = List.of("comparison", "previous", "prior");

    public DocumentNode parse(String sourceName, String text) {
        List<StatementNode> statements = new ArrayList<>();
        for (TabularRow row : readRows(sourceName, text)) {
            statements.add(row.toStatement());
        }
        return new DocumentNode(sourceName, statements);
    }

    /** All data rows in input order, including rows that cannot become flows. */
    public List<TabularRow> readRows(String sourceName, String text) {
        List<String> rawLines = FlowTextAstBuilder.splitLines(text);
        List<String> lines = new ArrayList<>();
        List<Integer> lineNumbers = new ArrayList<>();
        boolean hasTab = false;
        for (int index = 0; index < rawLines.size(); index++) {
            String trimmed = rawLines.get(index).trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            lines.add(trimmed);
            lineNumbers.add(index + 1);
            hasTab |= trimmed.indexOf('\t') >= 0;
        }

        List<TabularRow> rows = new ArrayList<>();
        if (lines.isEmpty()) {
            return rows;
        }
        List<List<String>> table = new ArrayList<>(lines.size());
        for (String line : lines) {
            table.add(hasTab ? CsvLineSplitter.splitTabs(line) : CsvLineSplitter.split(line));
        }

        ColumnMap columnMap = ColumnMap.detect(table.get(0));
        int start = columnMap != null ? 1 : 0;
        for (int i = start; i < table.size(); i++) {
            SourceLocation location = new SourceLocation(sourceName, lineNumbers.get(i));
            rows.add(toRow(location, table.get(i), columnMap));
        }
        return rows;
    }

    private static TabularRow toRow(SourceLocation location, List<String> cells, ColumnMap map) {
        if (map != null) {
            return new TabularRow(
                    location,
                    cells,
                    cell(cells, map.sourceIndex),
                    cell(cells, map.targetIndex),
                    cell(cells, map.valueIndex),
                    map.comparisonIndex >= 0 ? cell(cells, map.comparisonIndex) : "");
        }
        if (cells.size() < 3) {
            return new TabularRow(location, cells, cell(cells, 0), "", "", "");
        }
        if (NumberParser.isNumeric(cells.get(1))) {
            return new TabularRow(
                    location, cells, cells.get(0), cells.get(2), cells.get(1), cell(cells, 3));
        }
        return new TabularRow(location, cells, cells.get(0), cells.get(1), cells.get(2), cell(cells, 3));
    }

    private static String cell(List<String> cells, int index) {
        return index >= 0 && index < cells.size() ? cells.get(index) : "";
    }

    private static boolean containsAny(String column, List<String> hints) {
        for (String hint : hints) {
            if (column.contains(hint)) {
                return true;
            }
        }
        return false;
    }

    private static final class ColumnMap {
        private final int sourceIndex;
        private final int targetIndex;
        private final int valueIndex;
        private final int comparisonIndex;

        private ColumnMap(int sourceIndex, int targetIndex, int valueIndex, int comparisonIndex) {
            this.sourceIndex = sourceIndex;
            this.targetIndex = targetIndex;
            this.valueIndex = valueIndex;
            this.comparisonIndex = comparisonIndex;
        }

        static ColumnMap detect(List<String> header) {
            int sourceIndex = -1;
            int targetIndex = -1;
            int firstValueLike = -1;
            int valueIndex = -1;
            for (int i = 0; i < header.size(); i++) {
                String column = header.get(i).trim().toLowerCase(Locale.ROOT);
                if (sourceIndex < 0 && SOURCE_HEADERS.contains(column)) {
                    sourceIndex = i;
                }
                if (targetIndex < 0 && TARGET_HEADERS.contains(column)) {
                    targetIndex = i;
                }
                if (containsAny(column, VALUE_HINTS)) {
                    if (firstValueLike < 0) {
                        firstValueLike = i;
                    }
                    if (valueIndex < 0 && !containsAny(column, COMPARISON_HINTS)) {
                        valueIndex = i;
                    }
                }
            }
            if (valueIndex < 0) {
                valueIndex = firstValueLike;
            }
            if (sourceIndex < 0 || targetIndex < 0 || valueIndex < 0) {
                return null;
            }
            int comparisonIndex = -1;
            for (int i = 0; i < header.size(); i++) {
                String column = header.get(i).trim().toLowerCase(Locale.ROOT);
                if (i != valueIndex && containsAny(column, COMPARISON_HINTS)) {
                    comparisonIndex = i;
                    break;
                }
            }
            return new ColumnMap(sourceIndex, targetIndex, valueIndex, comparisonIndex);
        }
    }
}
