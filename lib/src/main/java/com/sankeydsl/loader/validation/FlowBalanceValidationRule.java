package com.sankeydsl.loader.validation;

import com.sankeydsl.graph.FlowGraph;
import com.sankeydsl.graph.NodeBalance;
import com.sankeydsl.loader.LoaderMessage;
import com.sankeydsl.loader.LoaderMessage.Level;
import com.sankeydsl.loader.semantic.SemanticAnalysis;
import com.sankeydsl.writer.NumberFormatter;
import java.util.ArrayList;
import java.util.List;

/**
 * Flags pass-through nodes whose inflow and outflow disagree, which usually means a flow was
 * mistyped or left out. Pure sources and sinks are never flagged.
 */
final class FlowBalanceValidationRule implements ValidationRule {

    @Override
    public List<LoaderMessage> validate(SemanticAnalysis analysis) {
        FlowGraph graph = analysis.getGraph();
        List<LoaderMessage> messages = new ArrayList<>();
        if (graph == null) {
            return messages;
        }
        for (NodeBalance balance : NodeBalance.compute(graph)) {
            if (!balance.isImbalancedPassThrough()) {
                continue;
            }
            messages.add(
                    new LoaderMessage(
                            Level.WARNING,
                            "Node '"
                                    + balance.getName()
                                    + "' is unbalanced: in "
                                    + NumberFormatter.format(balance.getTotalIn())
                                    + ", out "
                                    + NumberFormatter.format(balance.getTotalOut())
                                    + " (delta "
                                    + NumberFormatter.format(balance.getDelta())
                                    + ")",
                            analysis.getSourceName(),
                            0));
        }
        return messages;
    }
}
