package com.sankeydsl.loader.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.sankeydsl.loader.FlowTextAstBuilder;
import com.sankeydsl.loader.LoaderMessage;
import com.sankeydsl.loader.semantic.SemanticAnalysis;
import com.sankeydsl.loader.semantic.SemanticAnalyzer;
import java.util.List;
import org.junit.jupiter.api.Test;

class FlowBalanceValidationRuleTest {

    @Test
    void flagsUnbalancedPassThroughNodes() {
        SemanticAnalysis analysis =
                analyze("Revenue [600] Gross Profit\nGross Profit [400] Opex\nGross Profit [150] Net Profit");

        List<LoaderMessage> messages = new FlowBalanceValidationRule().validate(analysis);
        assertEquals(1, messages.size());
        LoaderMessage message = messages.get(0);
        assertEquals(LoaderMessage.Level.WARNING, message.getLevel());
        assertEquals("Node 'Gross Profit' is unbalanced: in 600, out 550 (delta 50)", message.getMessage());
        assertEquals(0, message.getLine());
        assertEquals("pl.txt", message.getSourceName());
    }

    @Test
    void balancedGraphHasNoFindings() {
        SemanticAnalysis analysis = analyze("Revenue [600] Gross Profit\nGross Profit [600] Net Profit");
        assertTrue(new FlowBalanceValidationRule().validate(analysis).isEmpty());
    }

    @Test
    void missingGraphHasNoFindings() {
        assertTrue(new FlowBalanceValidationRule().validate(analyze("noise")).isEmpty());
    }

    @Test
    void runnerAggregatesRulesInOrder() {
        SemanticAnalysis analysis = analyze("A [2] B\nB [1] C");
        ValidationRule always =
                ignored -> List.of(new LoaderMessage(LoaderMessage.Level.ERROR, "custom", "pl.txt", 0));
        ValidationRunner runner = new ValidationRunner(List.of(always, new FlowBalanceValidationRule()));

        List<LoaderMessage> messages = runner.run(analysis);
        assertEquals(2, messages.size());
        assertEquals("custom", messages.get(0).getMessage());
        assertEquals(1, ValidationRunner.defaultRules().run(analysis).size());
        assertTrue(ValidationRunner.none().run(analysis).isEmpty());
    }

    private static SemanticAnalysis analyze(String text) {
        return new SemanticAnalyzer().analyze(new FlowTextAstBuilder().parse("pl.txt", text));
    }
}
