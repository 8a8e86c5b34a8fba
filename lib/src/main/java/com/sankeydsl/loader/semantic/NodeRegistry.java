package com.sankeydsl.loader.semantic;

import com.sankeydsl.graph.FlowNode;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-parse node table keyed by derived id, in first-seen order. Colors declared before a node's
 * first use are applied when it is created; the first declaration for an id wins.
 */
public final class NodeRegistry {

    private final Map<String, FlowNode> nodesById = new LinkedHashMap<>();
    private final Map<String, String> pendingColors = new HashMap<>();

    /**
     * Records a color for a node that has not been created yet.
     *
     * @return {@code false} when the directive is ignored because the node already exists or an
     *     earlier directive already chose its color
     */
    public boolean registerColor(String name, String color) {
        String id = FlowNode.idFor(name);
        if (nodesById.containsKey(id)) {
            return false;
        }
        return pendingColors.putIfAbsent(id, color) == null;
    }

    public FlowNode getOrCreate(String name) {
        String id = FlowNode.idFor(name);
        FlowNode existing = nodesById.get(id);
        if (existing != null) {
            return existing;
        }
        FlowNode created =
                new FlowNode(id, name, pendingColors.remove(id), NodeCategorizer.categorize(name));
        nodesById.put(id, created);
        return created;
    }

    public boolean contains(String id) {
        return nodesById.containsKey(id);
    }

    public int size() {
        return nodesById.size();
    }

    public boolean isEmpty() {
        return nodesById.isEmpty();
    }

    public List<FlowNode> nodes() {
        return new ArrayList<>(nodesById.values());
    }
}
