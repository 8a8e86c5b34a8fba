package com.sankeydsl.loader.notation;

import com.sankeydsl.loader.ast.Notation;
import com.sankeydsl.loader.ast.SourceLocation;
import com.sankeydsl.loader.ast.StatementNode;
import java.util.Optional;

/**
 * Recognizer for one surface notation. Recognizers are tried in a fixed priority order and the
 * first one that returns a statement owns the line.
 */
public interface LineNotation {

    Notation notation();

    /**
     * Attempt to recognize a line.
     *
     * @param line trimmed, non-empty, non-comment line text
     * @param location where the line came from
     * @return the recognized statement, a {@code RejectedLineNode} when the line has this notation's
     *     shape but unusable content, or empty to let the next notation try
     */
    Optional<StatementNode> recognize(String line, SourceLocation location);
}
