package com.sankeydsl.loader.validation;

import com.sankeydsl.loader.LoaderMessage;
import com.sankeydsl.loader.semantic.SemanticAnalysis;
import java.util.List;

/**
 * A single check run against a finished graph. Rules only report; they never alter the graph, and
 * they must preserve the order in which they discover problems.
 */
public interface ValidationRule {

    /**
     * Evaluate this rule against the given analysis.
     *
     * @param analysis Parsed and normalized flow graph; its graph may be null.
     * @return A list of diagnostics, possibly empty. Implementations must not return null.
     */
    List<LoaderMessage> validate(SemanticAnalysis analysis);
}
