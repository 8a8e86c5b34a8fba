package com.sankeydsl.graph;

import java.util.Locale;

/** Semantic role of a node, used by renderers to pick default colors. */
public enum NodeCategory {
    REVENUE,
    EXPENSE,
    PROFIT,
    NEUTRAL;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
