package com.sankeydsl.loader.semantic;

import com.sankeydsl.graph.NodeCategory;
import java.util.List;
import java.util.Locale;

/**
 * Keyword heuristic for a node's financial role. Expense keywords win over revenue ones so that
 * names such as "Cost of Revenue" land on the expense side.
 */
public final class NodeCategorizer {

    private static final List<String> EXPENSE_KEYWORDS =
            List.of("cost", "expense", "cogs", "tax", "depreciation", "amortization");
    private static final List<String> PROFIT_KEYWORDS =
            List.of("profit", "net income", "earnings", "ebit", "ebitda");

    private NodeCategorizer() {}

    public static NodeCategory categorize(String name) {
        String lower = name.toLowerCase(Locale.ROOT);
        if (containsAny(lower, EXPENSE_KEYWORDS)) {
            return NodeCategory.EXPENSE;
        }
        if (lower.contains("revenue")
                || lower.contains("sales")
                || (lower.contains("income") && !lower.contains("net"))) {
            return NodeCategory.REVENUE;
        }
        if (containsAny(lower, PROFIT_KEYWORDS)) {
            return NodeCategory.PROFIT;
        }
        return NodeCategory.NEUTRAL;
    }

    private static boolean containsAny(String text, List<String> keywords) {
        for (String keyword : keywords) {
            if (text.contains(keyword)) {
                return true;
            }
        }
        return false;
    }
}
