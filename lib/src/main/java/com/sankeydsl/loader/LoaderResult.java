package com.sankeydsl.loader;

import com.sankeydsl.graph.FlowGraph;
import java.util.List;

/**
 * Container for the results of loading flow text: the graph (absent when the input produced no
 * flows), the diagnostics gathered while parsing and normalizing it, and the validation warnings
 * raised against the finished graph.
 */
public final class LoaderResult {
    private final FlowGraph graph;
    private final List<LoaderMessage> messages;
    private final List<LoaderMessage> validationMessages;

    public LoaderResult(
            FlowGraph graph, List<LoaderMessage> messages, List<LoaderMessage> validationMessages) {
        this.graph = graph;
        this.messages = List.copyOf(messages);
        this.validationMessages = List.copyOf(validationMessages);
    }

    /** The canonical graph, or {@code null} when no nodes or no flows were found. */
    public FlowGraph getGraph() {
        return graph;
    }

    public boolean hasGraph() {
        return graph != null;
    }

    public List<LoaderMessage> getMessages() {
        return messages;
    }

    public List<LoaderMessage> getValidationMessages() {
        return validationMessages;
    }
}
