package com.sankeydsl;

import com.sankeydsl.graph.FlowGraph;
import com.sankeydsl.loader.FlowTextLoader;
import com.sankeydsl.loader.validation.ValidationRunner;
import com.sankeydsl.writer.FlowTextSerializer;

/**
 * Request/response surface used by editors: parse text on every change, serialize the graph back
 * for the text area. Malformed input never throws; when nothing usable is found the parse methods
 * return {@code null}. Use {@link FlowTextLoader} directly to also receive diagnostics.
 */
public final class SankeyDsl {

    private static final String SOURCE_NAME = "<input>";
    private static final FlowTextLoader LOADER = new FlowTextLoader(ValidationRunner.none());

    private SankeyDsl() {}

    /** Parses bracket, arrow, delimited and color-directive lines. */
    public static FlowGraph parse(String text) {
        return LOADER.load(SOURCE_NAME, text).getGraph();
    }

    /** Parses a pasted table, detecting a header row when present. */
    public static FlowGraph parseTabular(String text) {
        return LOADER.loadTabular(SOURCE_NAME, text).getGraph();
    }

    public static String serialize(FlowGraph graph) {
        return FlowTextSerializer.serialize(graph);
    }
}
