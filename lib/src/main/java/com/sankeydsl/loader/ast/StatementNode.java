package com.sankeydsl.loader.ast;

/** One significant line of flow text after notation recognition. */
public sealed interface StatementNode permits FlowStatementNode, ColorDirectiveNode, RejectedLineNode {

    SourceLocation getLocation();
}
