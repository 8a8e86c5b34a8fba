package com.sankeydsl.loader;

import com.sankeydsl.loader.ast.DocumentNode;
import com.sankeydsl.loader.ast.RejectedLineNode;
import com.sankeydsl.loader.ast.SourceLocation;
import com.sankeydsl.loader.ast.StatementNode;
import com.sankeydsl.loader.notation.ArrowNotation;
import com.sankeydsl.loader.notation.BracketNotation;
import com.sankeydsl.loader.notation.ColorDirectiveNotation;
import com.sankeydsl.loader.notation.DelimitedNotation;
import com.sankeydsl.loader.notation.LineNotation;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Turns line-oriented flow text into statements. Each significant line is offered to the
 * configured notations in order; comments ({@code //} or {@code #}) and blank lines are skipped.
 */
public final class FlowTextAstBuilder {

    private final List<LineNotation> notations;

    public FlowTextAstBuilder() {
        this(defaultNotations());
    }

    public FlowTextAstBuilder(List<LineNotation> notations) {
        this.notations = List.copyOf(Objects.requireNonNull(notations, "notations"));
    }

    /** Color directives, bracket, arrow and delimited rows, in recognition priority order. */
    public static List<LineNotation> defaultNotations() {
        return List.of(
                new ColorDirectiveNotation(),
                new BracketNotation(),
                new ArrowNotation(),
                new DelimitedNotation());
    }

    public DocumentNode parse(String sourceName, String text) {
        List<StatementNode> statements = new ArrayList<>();
        List<String> lines = splitLines(text);
        for (int index = 0; index < lines.size(); index++) {
            String trimmed = lines.get(index).trim();
            if (isSkippable(trimmed)) {
                continue;
            }
            SourceLocation location = new SourceLocation(sourceName, index + 1);
            statements.add(recognize(trimmed, location));
        }
        return new DocumentNode(sourceName, statements);
    }

    static boolean isSkippable(String trimmed) {
        return trimmed.isEmpty() || trimmed.startsWith("//") || trimmed.startsWith("#");
    }

    static List<String> splitLines(String text) {
        List<String> lines = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return lines;
        }
        int start = 0;
        int length = text.length();
        for (int i = 0; i < length; i++) {
            char ch = text.charAt(i);
            if (ch == '\n' || ch == '\r') {
                lines.add(text.substring(start, i));
                if (ch == '\r' && i + 1 < length && text.charAt(i + 1) == '\n') {
                    i++;
                }
                start = i + 1;
            }
        }
        lines.add(text.substring(start));
        return lines;
    }

    private StatementNode recognize(String line, SourceLocation location) {
        for (LineNotation notation : notations) {
            Optional<StatementNode> statement = notation.recognize(line, location);
            if (statement.isPresent()) {
                return statement.get();
            }
        }
        return new RejectedLineNode(location, line, "Unrecognized line");
    }
}
