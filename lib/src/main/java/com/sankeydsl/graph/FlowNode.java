package com.sankeydsl.graph;

import java.util.Locale;
import java.util.Objects;

public final class FlowNode {
    private final String id;
    private final String name;
    private final String color;
    private final NodeCategory category;

    public FlowNode(String id, String name, String color, NodeCategory category) {
        this.id = Objects.requireNonNull(id, "id");
        this.name = Objects.requireNonNull(name, "name");
        this.color = color;
        this.category = Objects.requireNonNull(category, "category");
    }

    /**
     * Derives the node id for a display name: lower-cased, with every whitespace run collapsed to a
     * single underscore. Punctuation and non-ASCII characters are kept as-is.
     */
    public static String idFor(String name) {
        String lower = name.toLowerCase(Locale.ROOT);
        StringBuilder builder = new StringBuilder(lower.length());
        boolean inWhitespace = false;
        for (int i = 0; i < lower.length(); i++) {
            char ch = lower.charAt(i);
            if (Character.isWhitespace(ch) || Character.isSpaceChar(ch)) {
                if (!inWhitespace) {
                    builder.append('_');
                    inWhitespace = true;
                }
            } else {
                builder.append(ch);
                inWhitespace = false;
            }
        }
        return builder.toString();
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    /** Hex color including the leading {@code #}, or {@code null} when none was declared. */
    public String getColor() {
        return color;
    }

    public boolean hasColor() {
        return color != null;
    }

    public NodeCategory getCategory() {
        return category;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof FlowNode)) {
            return false;
        }
        FlowNode other = (FlowNode) obj;
        return id.equals(other.id)
                && name.equals(other.name)
                && Objects.equals(color, other.color)
                && category == other.category;
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, color, category);
    }

    @Override
    public String toString() {
        return id + "(" + name + ")";
    }
}
