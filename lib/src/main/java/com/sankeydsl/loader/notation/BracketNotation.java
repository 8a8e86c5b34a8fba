package com.sankeydsl.loader.notation;

import com.sankeydsl.loader.Comparison;
import com.sankeydsl.loader.ComparisonResolver;
import com.sankeydsl.loader.NumberParser;
import com.sankeydsl.loader.ast.FlowStatementNode;
import com.sankeydsl.loader.ast.Notation;
import com.sankeydsl.loader.ast.RejectedLineNode;
import com.sankeydsl.loader.ast.SourceLocation;
import com.sankeydsl.loader.ast.StatementNode;
import com.sankeydsl.loader.grammar.FlowTextBaseVisitor;
import com.sankeydsl.loader.grammar.FlowTextParser;
import java.util.Optional;

/**
 * The canonical notation: {@code Source [value] Target} or {@code Source [value, comparison]
 * Target}. The first {@code [} that encloses non-empty content and is followed by a target wins, so
 * targets may themselves contain brackets. Once a line has this shape it is never offered to later
 * notations, even when its value turns out to be unusable.
 */
public final class BracketNotation implements LineNotation {

    @Override
    public Notation notation() {
        return Notation.BRACKET;
    }

    @Override
    public Optional<StatementNode> recognize(String line, SourceLocation location) {
        return LineParser.parse(line, "bracketFlow", FlowTextParser::bracketFlow)
                .map(context -> new BracketVisitor(line, location).visitBracketFlow(context));
    }

    private final class BracketVisitor extends FlowTextBaseVisitor<StatementNode> {
        private final String line;
        private final SourceLocation location;

        BracketVisitor(String line, SourceLocation location) {
            this.line = line;
            this.location = location;
        }

        @Override
        public StatementNode visitBracketFlow(FlowTextParser.BracketFlowContext ctx) {
            String source = LineParser.before(ctx.open).trim();
            String target = LineParser.after(ctx.close).trim();
            if (source.isEmpty() || target.isEmpty()) {
                return null;
            }
            String content = LineParser.originalText(ctx.bracketContent()).trim();
            String valueToken = content;
            String comparisonToken = null;
            int comma = content.indexOf(',');
            if (comma >= 0) {
                valueToken = content.substring(0, comma).trim();
                comparisonToken = content.substring(comma + 1).trim();
            }
            double value = NumberParser.parse(valueToken);
            if (!(value > 0)) {
                return new RejectedLineNode(
                        location, line, "Flow value is not a positive number: '" + valueToken + "'");
            }
            Comparison comparison = ComparisonResolver.resolve(value, comparisonToken);
            return new FlowStatementNode(location, notation(), source, target, value, comparison);
        }
    }
}
