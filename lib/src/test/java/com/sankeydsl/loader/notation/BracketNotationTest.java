package com.sankeydsl.loader.notation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.sankeydsl.loader.ast.FlowStatementNode;
import com.sankeydsl.loader.ast.Notation;
import com.sankeydsl.loader.ast.RejectedLineNode;
import com.sankeydsl.loader.ast.SourceLocation;
import com.sankeydsl.loader.ast.StatementNode;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class BracketNotationTest {

    private static final SourceLocation LOCATION = new SourceLocation("flows.txt", 3);

    private final BracketNotation notation = new BracketNotation();

    @Test
    void recognizesSimpleFlow() {
        FlowStatementNode flow = flow("Revenue [1000] Cost of Sales");
        assertEquals("Revenue", flow.getSourceName());
        assertEquals("Cost of Sales", flow.getTargetName());
        assertEquals(1000, flow.getValue());
        assertEquals(Notation.BRACKET, flow.getNotation());
        assertEquals(LOCATION, flow.getLocation());
        assertFalse(flow.getComparison().isPresent());
    }

    @Test
    void readsPreviousValueAfterComma() {
        FlowStatementNode flow = flow("Revenue [1200, 1000] Gross Profit");
        assertEquals(1200, flow.getValue());
        assertEquals(1000.0, flow.getComparison().getPreviousValue());
        assertEquals("+20%", flow.getComparison().getLabel());
    }

    @Test
    void keepsFormattedLabel() {
        FlowStatementNode flow = flow("Revenue [$2.5m, +12%] Gross Profit");
        assertEquals(2_500_000, flow.getValue());
        assertNull(flow.getComparison().getPreviousValue());
        assertEquals("+12%", flow.getComparison().getLabel());
    }

    @Test
    void targetMayContainBrackets() {
        FlowStatementNode flow = flow("Opex [300] Marketing [EMEA]");
        assertEquals("Opex", flow.getSourceName());
        assertEquals("Marketing [EMEA]", flow.getTargetName());
    }

    @Test
    void firstBracketWithContentOwnsTheLine() {
        StatementNode statement = notation.recognize("Product [A] [50] Revenue", LOCATION).orElseThrow();
        assertInstanceOf(RejectedLineNode.class, statement);

        FlowStatementNode flow = flow("Revenue [] [100] Profit");
        assertEquals("Revenue []", flow.getSourceName());
        assertEquals(100, flow.getValue());
    }

    @Test
    void rejectsNonPositiveValueInsteadOfFallingThrough() {
        StatementNode statement = notation.recognize("Revenue [0] Profit", LOCATION).orElseThrow();
        RejectedLineNode rejected = assertInstanceOf(RejectedLineNode.class, statement);
        assertEquals("Revenue [0] Profit", rejected.getText());
        assertTrue(rejected.getReason().contains("'0'"));

        assertInstanceOf(
                RejectedLineNode.class, notation.recognize("Revenue [-5] Profit", LOCATION).orElseThrow());
        assertInstanceOf(
                RejectedLineNode.class, notation.recognize("Revenue [lots] Profit", LOCATION).orElseThrow());
    }

    @Test
    void ignoresLinesWithoutBracketShape() {
        assertEquals(Optional.empty(), notation.recognize("Revenue -> Profit 10", LOCATION));
        assertEquals(Optional.empty(), notation.recognize("[100] Profit", LOCATION));
        assertEquals(Optional.empty(), notation.recognize("Revenue [100]", LOCATION));
        assertEquals(Optional.empty(), notation.recognize("Revenue [] Profit", LOCATION));
        assertEquals(Optional.empty(), notation.recognize("Revenue [100 Profit", LOCATION));
    }

    private FlowStatementNode flow(String line) {
        return assertInstanceOf(FlowStatementNode.class, notation.recognize(line, LOCATION).orElseThrow());
    }
}
