package com.sankeydsl.loader.semantic;

import com.sankeydsl.graph.FlowLink;
import com.sankeydsl.loader.Comparison;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Merges repeated declarations of the same source/target pair. Values are summed. Previous values
 * are summed only when both sides carry one, and the label is dropped because the stored percentage
 * no longer matches the merged totals; any other merge drops the comparison entirely. A declaration
 * whose value would push the total past the largest finite double is refused and the earlier total
 * is kept.
 */
public final class LinkAggregator {

    public enum Outcome {
        ADDED,
        MERGED,
        OVERFLOW
    }

    private record LinkKey(String sourceId, String targetId) {}

    private final Map<LinkKey, Entry> entries = new LinkedHashMap<>();

    /** Adds one declaration, merging it into an earlier declaration of the same pair. */
    public Outcome add(String sourceId, String targetId, double value, Comparison comparison, int line) {
        LinkKey key = new LinkKey(sourceId, targetId);
        Entry existing = entries.get(key);
        if (existing == null) {
            entries.put(key, new Entry(sourceId, targetId, value, comparison, line));
            return Outcome.ADDED;
        }
        return existing.merge(value, comparison) ? Outcome.MERGED : Outcome.OVERFLOW;
    }

    /** Aggregated entries in first-occurrence order. */
    public List<Entry> entries() {
        return new ArrayList<>(entries.values());
    }

    public int size() {
        return entries.size();
    }

    public static final class Entry {
        private final String sourceId;
        private final String targetId;
        private final int firstLine;
        private double value;
        private Double previousValue;
        private String comparisonLabel;
        private int declarations = 1;

        private Entry(String sourceId, String targetId, double value, Comparison comparison, int line) {
            this.sourceId = sourceId;
            this.targetId = targetId;
            this.firstLine = line;
            this.value = value;
            this.previousValue = comparison.getPreviousValue();
            this.comparisonLabel = comparison.getLabel();
        }

        private boolean merge(double otherValue, Comparison other) {
            double total = value + otherValue;
            if (Double.isInfinite(total)) {
                return false;
            }
            value = total;
            if (previousValue != null && other.getPreviousValue() != null) {
                double previousTotal = previousValue + other.getPreviousValue();
                previousValue = Double.isInfinite(previousTotal) ? null : previousTotal;
            } else {
                previousValue = null;
            }
            comparisonLabel = null;
            declarations++;
            return true;
        }

        public String getSourceId() {
            return sourceId;
        }

        public String getTargetId() {
            return targetId;
        }

        public int getFirstLine() {
            return firstLine;
        }

        public int getDeclarations() {
            return declarations;
        }

        public FlowLink toLink() {
            return new FlowLink(sourceId, targetId, value, previousValue, comparisonLabel);
        }
    }
}
