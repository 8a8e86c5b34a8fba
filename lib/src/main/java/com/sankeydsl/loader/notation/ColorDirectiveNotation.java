package com.sankeydsl.loader.notation;

import com.sankeydsl.loader.ast.ColorDirectiveNode;
import com.sankeydsl.loader.ast.Notation;
import com.sankeydsl.loader.ast.RejectedLineNode;
import com.sankeydsl.loader.ast.SourceLocation;
import com.sankeydsl.loader.ast.StatementNode;
import com.sankeydsl.loader.grammar.FlowTextBaseVisitor;
import com.sankeydsl.loader.grammar.FlowTextParser;
import java.util.Optional;

/**
 * {@code Name : #4ade80} or {@code Name :fff}. The color follows the last colon. Names never
 * contain {@code [}, so a bracket flow whose target holds a colon stays a flow.
 */
public final class ColorDirectiveNotation implements LineNotation {

    @Override
    public Notation notation() {
        return Notation.COLOR_DIRECTIVE;
    }

    @Override
    public Optional<StatementNode> recognize(String line, SourceLocation location) {
        return LineParser.parse(line, "colorDirective", FlowTextParser::colorDirective)
                .map(context -> new DirectiveVisitor(line, location).visitColorDirective(context));
    }

    private static final class DirectiveVisitor extends FlowTextBaseVisitor<StatementNode> {
        private final String line;
        private final SourceLocation location;

        DirectiveVisitor(String line, SourceLocation location) {
            this.line = line;
            this.location = location;
        }

        @Override
        public StatementNode visitColorDirective(FlowTextParser.ColorDirectiveContext ctx) {
            String name = LineParser.originalText(ctx.directiveName()).trim();
            String hex = ctx.color.getText();
            boolean hashPrefixed = ctx.HASH() != null;
            if (name.isEmpty()) {
                return null;
            }
            if ((hex.length() == 3 || hex.length() == 6) && isHex(hex)) {
                return new ColorDirectiveNode(location, name, "#" + hex);
            }
            if (hashPrefixed && isAlphanumeric(hex)) {
                return new RejectedLineNode(
                        location, line, "Malformed color '#" + hex + "' for node '" + name + "'");
            }
            return null;
        }
    }

    private static boolean isHex(String text) {
        for (int i = 0; i < text.length(); i++) {
            if (Character.digit(text.charAt(i), 16) < 0) {
                return false;
            }
        }
        return true;
    }

    private static boolean isAlphanumeric(String text) {
        for (int i = 0; i < text.length(); i++) {
            char ch = text.charAt(i);
            if (!((ch >= '0' && ch <= '9') || (ch >= 'a' && ch <= 'z') || (ch >= 'A' && ch <= 'Z'))) {
                return false;
            }
        }
        return true;
    }
}
