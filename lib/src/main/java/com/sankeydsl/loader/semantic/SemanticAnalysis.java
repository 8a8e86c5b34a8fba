package com.sankeydsl.loader.semantic;

import com.sankeydsl.graph.FlowGraph;
import com.sankeydsl.loader.LoaderMessage;
import java.util.List;

public final class SemanticAnalysis {
    private final String sourceName;
    private final FlowGraph graph;
    private final List<LoaderMessage> messages;

    public SemanticAnalysis(String sourceName, FlowGraph graph, List<LoaderMessage> messages) {
        this.sourceName = sourceName;
        this.graph = graph;
        this.messages = List.copyOf(messages);
    }

    public String getSourceName() {
        return sourceName;
    }

    /** The normalized graph, or {@code null} when the document declared no usable flows. */
    public FlowGraph getGraph() {
        return graph;
    }

    public List<LoaderMessage> getMessages() {
        return messages;
    }
}
