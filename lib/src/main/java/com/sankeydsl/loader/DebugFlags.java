package com.sankeydsl.loader;

import java.util.ArrayList;
import java.util.List;

public final class DebugFlags {
    private static final String LINES_PROPERTY = "sankeydsl.debugLines";
    private static final String PARSER_PROPERTY = "sankeydsl.debugParser";
    /** Environment fallback kept for convenience; prefer using system properties. */
    private static final String LINES_ENV = "SANKEYDSL_DEBUG_LINES";
    private static final String PARSER_ENV = "SANKEYDSL_DEBUG_PARSER";
    private static final ThreadLocal<List<String>> CAPTURED_DIAGNOSTICS =
            ThreadLocal.withInitial(ArrayList::new);

    private DebugFlags() {}

    /**
     * When enabled, every recognized line adds an INFO diagnostic naming the notation that matched
     * it, which helps when a pasted table is picked up by an unexpected notation.
     */
    public static boolean isLineTraceEnabled() {
        return flag(LINES_PROPERTY, LINES_ENV);
    }

    /** Ambiguity and full-context reports from the line grammar, surfaced as INFO diagnostics. */
    public static boolean isParserTraceEnabled() {
        return flag(PARSER_PROPERTY, PARSER_ENV);
    }

    public static void captureDiagnostic(String message) {
        CAPTURED_DIAGNOSTICS.get().add(message);
    }

    public static List<String> drainCapturedDiagnostics() {
        List<String> captured = new ArrayList<>(CAPTURED_DIAGNOSTICS.get());
        CAPTURED_DIAGNOSTICS.get().clear();
        return captured;
    }

    private static boolean flag(String property, String env) {
        String value = System.getProperty(property);
        if (value != null) {
            return Boolean.parseBoolean(value);
        }
        return Boolean.parseBoolean(System.getenv(env));
    }
}
