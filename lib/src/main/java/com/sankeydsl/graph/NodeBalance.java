package com.sankeydsl.graph;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Inflow/outflow totals for one node. A node is balanced when its totals agree within a cent, or
 * when it is a pure source or a pure sink.
 */
public final class NodeBalance {
    static final double TOLERANCE = 0.01;

    private final String id;
    private final String name;
    private final double totalIn;
    private final double totalOut;

    public NodeBalance(String id, String name, double totalIn, double totalOut) {
        this.id = Objects.requireNonNull(id, "id");
        this.name = Objects.requireNonNull(name, "name");
        this.totalIn = totalIn;
        this.totalOut = totalOut;
    }

    /** Computes one balance per node, in the graph's node order. */
    public static List<NodeBalance> compute(FlowGraph graph) {
        Objects.requireNonNull(graph, "graph");
        Map<String, Double> inflow = new HashMap<>();
        Map<String, Double> outflow = new HashMap<>();
        for (FlowLink link : graph.getLinks()) {
            inflow.merge(link.getTargetId(), link.getValue(), Double::sum);
            outflow.merge(link.getSourceId(), link.getValue(), Double::sum);
        }
        List<NodeBalance> balances = new ArrayList<>(graph.getNodes().size());
        for (FlowNode node : graph.getNodes()) {
            balances.add(
                    new NodeBalance(
                            node.getId(),
                            node.getName(),
                            inflow.getOrDefault(node.getId(), 0.0),
                            outflow.getOrDefault(node.getId(), 0.0)));
        }
        return balances;
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public double getTotalIn() {
        return totalIn;
    }

    public double getTotalOut() {
        return totalOut;
    }

    public double getDelta() {
        return totalIn - totalOut;
    }

    public boolean isBalanced() {
        return Math.abs(getDelta()) < TOLERANCE || totalIn == 0 || totalOut == 0;
    }

    /** True for intermediate nodes (both inflow and outflow) whose totals disagree. */
    public boolean isImbalancedPassThrough() {
        return !isBalanced() && totalIn > 0 && totalOut > 0;
    }
}
