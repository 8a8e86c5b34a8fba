package com.sankeydsl.loader.notation;

import com.sankeydsl.loader.DebugFlags;
import java.util.BitSet;
import org.antlr.v4.runtime.DiagnosticErrorListener;
import org.antlr.v4.runtime.Parser;
import org.antlr.v4.runtime.atn.ATNConfigSet;
import org.antlr.v4.runtime.dfa.DFA;
import org.antlr.v4.runtime.misc.Interval;

/**
 * Records ambiguity reports from the line grammar without failing the parse.
 *
 * <p>{@link DiagnosticErrorListener} routes its reports through {@link
 * Parser#notifyErrorListeners(String)}, which would reach the throwing listener and make every
 * ambiguous line look like a syntax error. The reports go to {@link DebugFlags} instead, prefixed
 * with the notation that was being tried.</p>
 */
final class DebugDiagnosticErrorListener extends DiagnosticErrorListener {

    private final String entryRule;

    DebugDiagnosticErrorListener(String entryRule) {
        super(true);
        this.entryRule = entryRule;
    }

    @Override
    public void reportAmbiguity(
            Parser recognizer,
            DFA dfa,
            int startIndex,
            int stopIndex,
            boolean exact,
            BitSet ambigAlts,
            ATNConfigSet configs) {
        if (exactOnly && !exact) {
            return;
        }
        String decision = getDecisionDescription(recognizer, dfa);
        BitSet conflicting = getConflictingAlts(ambigAlts, configs);
        String input = recognizer.getTokenStream().getText(Interval.of(startIndex, stopIndex));
        DebugFlags.captureDiagnostic(
                String.format(
                        "%s: ambiguity d=%s alts=%s input='%s'", entryRule, decision, conflicting, input));
    }

    @Override
    public void reportAttemptingFullContext(
            Parser recognizer,
            DFA dfa,
            int startIndex,
            int stopIndex,
            BitSet conflictingAlts,
            ATNConfigSet configs) {
        String decision = getDecisionDescription(recognizer, dfa);
        String input = recognizer.getTokenStream().getText(Interval.of(startIndex, stopIndex));
        DebugFlags.captureDiagnostic(
                String.format("%s: full context d=%s input='%s'", entryRule, decision, input));
    }

    @Override
    public void reportContextSensitivity(
            Parser recognizer,
            DFA dfa,
            int startIndex,
            int stopIndex,
            int prediction,
            ATNConfigSet configs) {
        String decision = getDecisionDescription(recognizer, dfa);
        String input = recognizer.getTokenStream().getText(Interval.of(startIndex, stopIndex));
        DebugFlags.captureDiagnostic(
                String.format("%s: context sensitivity d=%s input='%s'", entryRule, decision, input));
    }
}
