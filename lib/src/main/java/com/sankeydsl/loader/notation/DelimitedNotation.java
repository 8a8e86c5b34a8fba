package com.sankeydsl.loader.notation;

import com.sankeydsl.loader.ComparisonResolver;
import com.sankeydsl.loader.NumberParser;
import com.sankeydsl.loader.ast.FlowStatementNode;
import com.sankeydsl.loader.ast.Notation;
import com.sankeydsl.loader.ast.SourceLocation;
import com.sankeydsl.loader.ast.StatementNode;
import com.sankeydsl.loader.grammar.FlowTextBaseVisitor;
import com.sankeydsl.loader.grammar.FlowTextParser;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.antlr.v4.runtime.tree.ParseTree;
import org.antlr.v4.runtime.tree.TerminalNode;

/**
 * Column rows pasted from spreadsheets: {@code source, target, value[, comparison]} separated by
 * tabs, commas (quote aware) or runs of two or more spaces, tried in that order.
 */
public final class DelimitedNotation implements LineNotation {

    private static final int MIN_COLUMNS = 3;

    @Override
    public Notation notation() {
        return Notation.DELIMITED;
    }

    @Override
    public Optional<StatementNode> recognize(String line, SourceLocation location) {
        List<String> columns = columns(line);
        if (columns == null) {
            return Optional.empty();
        }
        String source = columns.get(0);
        String target = columns.get(1);
        double value = NumberParser.parse(columns.get(2));
        if (source.isEmpty() || target.isEmpty() || !(value > 0)) {
            return Optional.empty();
        }
        if (LineParser.hasBracket(source) || LineParser.hasBracket(target)) {
            return Optional.empty();
        }
        String comparisonToken = columns.size() > 3 ? columns.get(3) : null;
        return Optional.of(
                new FlowStatementNode(
                        location,
                        notation(),
                        source,
                        target,
                        value,
                        ComparisonResolver.resolve(value, comparisonToken)));
    }

    /** Trimmed cells of the first separator that yields at least three columns, or null. */
    static List<String> columns(String line) {
        ColumnVisitor visitor = new ColumnVisitor();
        Optional<List<String>> columns =
                LineParser.parse(line, "tabRow", FlowTextParser::tabRow).map(visitor::visitTabRow);
        if (columns.isEmpty()) {
            columns = LineParser.parse(line, "commaRow", FlowTextParser::commaRow)
                    .map(visitor::visitCommaRow);
        }
        if (columns.isEmpty()) {
            columns = LineParser.parse(line, "spacedRow", FlowTextParser::spacedRow)
                    .map(visitor::visitSpacedRow)
                    .filter(cells -> cells.size() >= MIN_COLUMNS);
        }
        return columns.orElse(null);
    }

    private static final class ColumnVisitor extends FlowTextBaseVisitor<List<String>> {

        @Override
        public List<String> visitTabRow(FlowTextParser.TabRowContext ctx) {
            List<String> cells = new ArrayList<>();
            for (FlowTextParser.TabCellContext cell : ctx.tabCell()) {
                cells.add(LineParser.originalText(cell).trim());
            }
            return cells;
        }

        @Override
        public List<String> visitCommaRow(FlowTextParser.CommaRowContext ctx) {
            List<String> cells = new ArrayList<>();
            for (FlowTextParser.CommaCellContext cell : ctx.commaCell()) {
                StringBuilder text = new StringBuilder();
                appendUnquoted(cell, text);
                cells.add(text.toString().trim());
            }
            return cells;
        }

        // Spaced cells that trim to nothing are dropped, as a run of spaces around a tab would be.
        @Override
        public List<String> visitSpacedRow(FlowTextParser.SpacedRowContext ctx) {
            List<String> cells = new ArrayList<>();
            for (FlowTextParser.SpacedCellContext cell : ctx.spacedCell()) {
                String text = LineParser.originalText(cell).trim();
                if (!text.isEmpty()) {
                    cells.add(text);
                }
            }
            return cells;
        }

        private static void appendUnquoted(ParseTree node, StringBuilder text) {
            if (node instanceof TerminalNode terminal) {
                if (terminal.getSymbol().getType() != FlowTextParser.QUOTE) {
                    text.append(terminal.getText());
                }
                return;
            }
            for (int i = 0; i < node.getChildCount(); i++) {
                appendUnquoted(node.getChild(i), text);
            }
        }
    }
}
