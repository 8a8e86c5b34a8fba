package com.sankeydsl.loader.notation;

import com.sankeydsl.loader.DebugFlags;
import com.sankeydsl.loader.grammar.FlowTextLexer;
import com.sankeydsl.loader.grammar.FlowTextParser;
import java.util.Optional;
import java.util.function.Function;
import org.antlr.v4.runtime.BailErrorStrategy;
import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.atn.PredictionMode;
import org.antlr.v4.runtime.misc.Interval;
import org.antlr.v4.runtime.misc.ParseCancellationException;

/** Runs one entry rule of the flow text grammar over a single line. */
final class LineParser {

    private LineParser() {}

    /**
     * @return the parse tree, or empty when the line does not match the rule
     */
    static <T extends ParserRuleContext> Optional<T> parse(
            String line, String entryRule, Function<FlowTextParser, T> rule) {
        FlowTextLexer lexer = new FlowTextLexer(CharStreams.fromString(line, entryRule));
        lexer.removeErrorListeners();
        lexer.addErrorListener(ThrowingErrorListener.INSTANCE);

        FlowTextParser parser = new FlowTextParser(new CommonTokenStream(lexer));
        parser.removeErrorListeners();
        parser.addErrorListener(ThrowingErrorListener.INSTANCE);
        parser.setErrorHandler(new BailErrorStrategy());
        if (DebugFlags.isParserTraceEnabled()) {
            parser.getInterpreter().setPredictionMode(PredictionMode.LL_EXACT_AMBIG_DETECTION);
            parser.addErrorListener(new DebugDiagnosticErrorListener(entryRule));
        }

        try {
            return Optional.of(rule.apply(parser));
        } catch (ParseCancellationException ex) {
            return Optional.empty();
        }
    }

    static String originalText(ParserRuleContext context) {
        if (context == null || context.getStart() == null || context.getStop() == null) {
            return "";
        }
        return between(context.getStart(), context.getStop());
    }

    /** Source text from the start of {@code first} to the end of {@code last}, both inclusive. */
    static String between(Token first, Token last) {
        int start = first.getStartIndex();
        int stop = last.getStopIndex();
        if (stop < start) {
            return "";
        }
        return first.getInputStream().getText(Interval.of(start, stop));
    }

    /** Source text ahead of the token. */
    static String before(Token token) {
        int stop = token.getStartIndex() - 1;
        if (stop < 0) {
            return "";
        }
        return token.getInputStream().getText(Interval.of(0, stop));
    }

    /** Source text after the token, to the end of the line. */
    static String after(Token token) {
        CharStream input = token.getInputStream();
        int start = token.getStopIndex() + 1;
        if (start >= input.size()) {
            return "";
        }
        return input.getText(Interval.of(start, input.size() - 1));
    }

    static boolean hasBracket(String text) {
        return text.indexOf('[') >= 0 || text.indexOf(']') >= 0;
    }
}
