package com.sankeydsl.loader.ast;

import java.util.Objects;

public final class ColorDirectiveNode implements StatementNode {

    private final SourceLocation location;
    private final String nodeName;
    private final String color;

    public ColorDirectiveNode(SourceLocation location, String nodeName, String color) {
        this.location = Objects.requireNonNull(location, "location");
        this.nodeName = Objects.requireNonNull(nodeName, "nodeName");
        this.color = Objects.requireNonNull(color, "color");
    }

    @Override
    public SourceLocation getLocation() {
        return location;
    }

    public String getNodeName() {
        return nodeName;
    }

    /** Hex color with its leading {@code #}. */
    public String getColor() {
        return color;
    }
}
