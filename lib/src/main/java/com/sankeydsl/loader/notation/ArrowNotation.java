package com.sankeydsl.loader.notation;

import com.sankeydsl.loader.ComparisonResolver;
import com.sankeydsl.loader.NumberParser;
import com.sankeydsl.loader.ast.FlowStatementNode;
import com.sankeydsl.loader.ast.Notation;
import com.sankeydsl.loader.ast.SourceLocation;
import com.sankeydsl.loader.ast.StatementNode;
import com.sankeydsl.loader.grammar.FlowTextBaseVisitor;
import com.sankeydsl.loader.grammar.FlowTextParser;
import java.util.List;
import java.util.Optional;

/**
 * {@code Source -> Target value [comparison]}. The value is the last whitespace-separated field, or
 * the one before it when that one is a positive number and a comparison follows. Everything between
 * the arrow and the value is the target, so multi-word targets need no quoting. Names holding
 * {@code [} or {@code ]} are declined because they could not be written back as bracket text.
 */
public final class ArrowNotation implements LineNotation {

    @Override
    public Notation notation() {
        return Notation.ARROW;
    }

    @Override
    public Optional<StatementNode> recognize(String line, SourceLocation location) {
        return LineParser.parse(line, "arrowFlow", FlowTextParser::arrowFlow)
                .map(context -> new ArrowVisitor(location).visitArrowFlow(context));
    }

    private final class ArrowVisitor extends FlowTextBaseVisitor<StatementNode> {
        private final SourceLocation location;

        ArrowVisitor(SourceLocation location) {
            this.location = location;
        }

        @Override
        public StatementNode visitArrowFlow(FlowTextParser.ArrowFlowContext ctx) {
            String source = LineParser.before(ctx.arrow).trim();
            List<FlowTextParser.ArrowFieldContext> fields = ctx.arrowField();
            int count = fields.size();
            if (source.isEmpty()) {
                return null;
            }

            int valueIndex = count - 1;
            String comparisonToken = null;
            if (count >= 3 && NumberParser.isPositive(fields.get(count - 2).getText())) {
                valueIndex = count - 2;
                comparisonToken = fields.get(count - 1).getText();
            }
            double value = NumberParser.parse(fields.get(valueIndex).getText());
            if (!(value > 0)) {
                return null;
            }
            String target =
                    LineParser.between(fields.get(0).getStart(), fields.get(valueIndex - 1).getStop())
                            .trim();
            if (LineParser.hasBracket(source) || LineParser.hasBracket(target)) {
                return null;
            }
            return new FlowStatementNode(
                    location,
                    notation(),
                    source,
                    target,
                    value,
                    ComparisonResolver.resolve(value, comparisonToken));
        }
    }
}
