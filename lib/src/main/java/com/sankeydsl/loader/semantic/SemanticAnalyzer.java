package com.sankeydsl.loader.semantic;

import com.sankeydsl.graph.FlowGraph;
import com.sankeydsl.graph.FlowLink;
import com.sankeydsl.graph.FlowNode;
import com.sankeydsl.loader.DebugFlags;
import com.sankeydsl.loader.LoaderMessage;
import com.sankeydsl.loader.ast.ColorDirectiveNode;
import com.sankeydsl.loader.ast.DocumentNode;
import com.sankeydsl.loader.ast.FlowStatementNode;
import com.sankeydsl.loader.ast.RejectedLineNode;
import com.sankeydsl.loader.ast.StatementNode;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Builds the canonical graph from recognized statements: nodes are registered in first-seen order,
 * duplicate flows are aggregated and cycle-closing flows are dropped. All state lives in an
 * {@link AnalyzerState} created per call.
 */
public final class SemanticAnalyzer {

    private static final Logger LOGGER = Logger.getLogger(SemanticAnalyzer.class.getName());

    public SemanticAnalysis analyze(DocumentNode document) {
        Objects.requireNonNull(document, "document");
        AnalyzerState state = new AnalyzerState(document.getSourceName());
        boolean traceLines = DebugFlags.isLineTraceEnabled();
        for (StatementNode statement : document.getStatements()) {
            if (traceLines && !(statement instanceof RejectedLineNode)) {
                traceStatement(statement, state);
            }
            if (statement instanceof ColorDirectiveNode directive) {
                applyDirective(directive, state);
            } else if (statement instanceof FlowStatementNode flow) {
                applyFlow(flow, state);
            } else if (statement instanceof RejectedLineNode rejected) {
                state.warn(rejected.getReason() + ": " + rejected.getText(), rejected.getLocation().getLine());
            }
        }

        if (state.registry.isEmpty() || state.flowCount == 0) {
            LOGGER.fine(() -> "No flows found in " + state.sourceName);
            return new SemanticAnalysis(state.sourceName, null, state.messages);
        }
        FlowGraph graph = new FlowGraph(state.registry.nodes(), enforceDag(state));
        LOGGER.fine(
                () ->
                        String.format(
                                Locale.ROOT,
                                "Parsed %s: %d statements, %d nodes, %d links",
                                state.sourceName,
                                document.getStatements().size(),
                                graph.getNodes().size(),
                                graph.getLinks().size()));
        return new SemanticAnalysis(state.sourceName, graph, state.messages);
    }

    private static void applyDirective(ColorDirectiveNode directive, AnalyzerState state) {
        if (!state.registry.registerColor(directive.getNodeName(), directive.getColor())) {
            state.info(
                    "Color directive for '" + directive.getNodeName() + "' ignored; color already decided",
                    directive.getLocation().getLine());
        }
    }

    private static void applyFlow(FlowStatementNode flow, AnalyzerState state) {
        FlowNode source = state.registry.getOrCreate(flow.getSourceName());
        FlowNode target = state.registry.getOrCreate(flow.getTargetName());
        state.flowCount++;
        int line = flow.getLocation().getLine();
        LinkAggregator.Outcome outcome =
                state.aggregator.add(
                        source.getId(), target.getId(), flow.getValue(), flow.getComparison(), line);
        if (outcome == LinkAggregator.Outcome.MERGED) {
            state.info(
                    "Merged duplicate flow " + source.getName() + " -> " + target.getName(), line);
        } else if (outcome == LinkAggregator.Outcome.OVERFLOW) {
            state.warn(
                    "Ignored duplicate flow "
                            + source.getName()
                            + " -> "
                            + target.getName()
                            + ": merged value would overflow",
                    line);
        }
    }

    private static List<FlowLink> enforceDag(AnalyzerState state) {
        DagEnforcer enforcer = new DagEnforcer();
        List<FlowLink> accepted = new ArrayList<>();
        for (LinkAggregator.Entry entry : state.aggregator.entries()) {
            DagEnforcer.Decision decision = enforcer.offer(entry.getSourceId(), entry.getTargetId());
            switch (decision) {
                case ACCEPTED:
                    accepted.add(entry.toLink());
                    break;
                case SELF_LOOP:
                    state.warn("Self-loop on '" + entry.getSourceId() + "' dropped", entry.getFirstLine());
                    break;
                case CLOSES_CYCLE:
                    LOGGER.finer(
                            () -> "Dropping cycle-closing link " + entry.getSourceId() + " -> " + entry.getTargetId());
                    state.warn(
                            "Flow "
                                    + entry.getSourceId()
                                    + " -> "
                                    + entry.getTargetId()
                                    + " would close a cycle and was dropped",
                            entry.getFirstLine());
                    break;
                default:
                    throw new IllegalStateException("Unhandled decision: " + decision);
            }
        }
        return accepted;
    }

    private static void traceStatement(StatementNode statement, AnalyzerState state) {
        String notation =
                statement instanceof FlowStatementNode flow
                        ? flow.getNotation().name().toLowerCase(Locale.ROOT)
                        : "color_directive";
        state.messages.add(
                new LoaderMessage(
                        LoaderMessage.Level.INFO,
                        "[line] " + notation,
                        state.sourceName,
                        statement.getLocation().getLine()));
        if (LOGGER.isLoggable(Level.FINEST)) {
            LOGGER.finest("Line " + statement.getLocation() + " recognized as " + notation);
        }
    }

    private static final class AnalyzerState {
        private final String sourceName;
        private final NodeRegistry registry = new NodeRegistry();
        private final LinkAggregator aggregator = new LinkAggregator();
        private final List<LoaderMessage> messages = new ArrayList<>();
        private int flowCount;

        AnalyzerState(String sourceName) {
            this.sourceName = sourceName;
        }

        void info(String message, int line) {
            messages.add(new LoaderMessage(LoaderMessage.Level.INFO, message, sourceName, line));
        }

        void warn(String message, int line) {
            messages.add(new LoaderMessage(LoaderMessage.Level.WARNING, message, sourceName, line));
        }
    }
}
