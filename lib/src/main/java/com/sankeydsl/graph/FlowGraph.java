package com.sankeydsl.graph;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Canonical, render-ready flow graph. Nodes keep first-seen order and links reference them by id.
 * Instances produced by the loader never contain self-loops, cycles or two links with the same
 * source and target.
 */
public final class FlowGraph {
    private final List<FlowNode> nodes;
    private final List<FlowLink> links;
    private final Map<String, FlowNode> nodesById;

    public FlowGraph(List<FlowNode> nodes, List<FlowLink> links) {
        this.nodes = List.copyOf(Objects.requireNonNull(nodes, "nodes"));
        this.links = List.copyOf(Objects.requireNonNull(links, "links"));
        Map<String, FlowNode> index = new LinkedHashMap<>();
        for (FlowNode node : this.nodes) {
            index.putIfAbsent(node.getId(), node);
        }
        this.nodesById = index;
    }

    public List<FlowNode> getNodes() {
        return nodes;
    }

    public List<FlowLink> getLinks() {
        return links;
    }

    public FlowNode findNode(String id) {
        return nodesById.get(id);
    }

    /** Display name for a node id, falling back to the id itself for unknown nodes. */
    public String nodeName(String id) {
        FlowNode node = nodesById.get(id);
        return node != null ? node.getName() : id;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof FlowGraph)) {
            return false;
        }
        FlowGraph other = (FlowGraph) obj;
        return nodes.equals(other.nodes) && links.equals(other.links);
    }

    @Override
    public int hashCode() {
        return Objects.hash(nodes, links);
    }

    @Override
    public String toString() {
        return "FlowGraph[nodes=" + nodes.size() + ", links=" + links.size() + "]";
    }
}
