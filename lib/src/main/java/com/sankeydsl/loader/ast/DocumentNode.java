package com.sankeydsl.loader.ast;

import java.util.List;

public final class DocumentNode {
    private final String sourceName;
    private final List<StatementNode> statements;

    public DocumentNode(String sourceName, List<StatementNode> statements) {
        this.sourceName = sourceName == null ? "" : sourceName;
        this.statements = List.copyOf(statements);
    }

    public String getSourceName() {
        return sourceName;
    }

    public List<StatementNode> getStatements() {
        return statements;
    }

    /** Number of flow statements, before aggregation and cycle removal. */
    public long flowCount() {
        return statements.stream().filter(FlowStatementNode.class::isInstance).count();
    }
}
