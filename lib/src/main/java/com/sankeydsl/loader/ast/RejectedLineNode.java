package com.sankeydsl.loader.ast;

import java.util.Objects;

/** A line that was not turned into a statement, kept so the reason can be reported. */
public final class RejectedLineNode implements StatementNode {

    private final SourceLocation location;
    private final String text;
    private final String reason;

    public RejectedLineNode(SourceLocation location, String text, String reason) {
        this.location = Objects.requireNonNull(location, "location");
        this.text = Objects.requireNonNull(text, "text");
        this.reason = Objects.requireNonNull(reason, "reason");
    }

    @Override
    public SourceLocation getLocation() {
        return location;
    }

    public String getText() {
        return text;
    }

    public String getReason() {
        return reason;
    }
}
