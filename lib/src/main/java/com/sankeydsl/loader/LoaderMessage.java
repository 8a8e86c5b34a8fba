package com.sankeydsl.loader;

import java.util.Objects;

/**
 * A diagnostic produced while turning flow text into a graph. Bad input never raises; it is skipped
 * and described by one of these instead.
 */
public final class LoaderMessage {

    public enum Level {
        INFO,
        WARNING,
        ERROR
    }

    private final Level level;
    private final String message;
    private final String sourceName;
    private final int line;

    public LoaderMessage(Level level, String message, String sourceName, int line) {
        this.level = Objects.requireNonNull(level, "level");
        this.message = Objects.requireNonNull(message, "message");
        this.sourceName = sourceName == null ? "" : sourceName;
        this.line = line;
    }

    public Level getLevel() {
        return level;
    }

    public String getMessage() {
        return message;
    }

    public String getSourceName() {
        return sourceName;
    }

    /** One-based line number, or 0 when the message is not tied to a line. */
    public int getLine() {
        return line;
    }

    @Override
    public String toString() {
        String location = line > 0 ? sourceName + ":" + line : sourceName;
        return level + " " + location + ": " + message;
    }
}
