package com.sankeydsl.writer;

import com.sankeydsl.graph.FlowGraph;
import com.sankeydsl.graph.FlowLink;
import com.sankeydsl.graph.FlowNode;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Writes a graph back as bracket-notation text: color directives, a blank separator line when any
 * were written, then one flow per line. Parsing the output reproduces the graph's nodes, links and
 * values.
 */
public final class FlowTextSerializer {

    private FlowTextSerializer() {}

    public static String serialize(FlowGraph graph) {
        Objects.requireNonNull(graph, "graph");
        List<String> lines = new ArrayList<>();
        for (FlowNode node : graph.getNodes()) {
            if (node.hasColor()) {
                lines.add(node.getName() + " :" + node.getColor());
            }
        }
        if (!lines.isEmpty()) {
            lines.add("");
        }
        for (FlowLink link : graph.getLinks()) {
            lines.add(flowLine(graph, link));
        }
        return String.join("\n", lines);
    }

    static String flowLine(FlowGraph graph, FlowLink link) {
        String source = graph.nodeName(link.getSourceId());
        String target = graph.nodeName(link.getTargetId());
        String value = NumberFormatter.format(link.getValue());
        if (link.hasPreviousValue()) {
            return source + " [" + value + ", " + NumberFormatter.format(link.getPreviousValue()) + "] " + target;
        }
        if (link.hasComparisonLabel()) {
            return source + " [" + value + ", " + link.getComparisonLabel() + "] " + target;
        }
        return source + " [" + value + "] " + target;
    }
}
