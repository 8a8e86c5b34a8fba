package com.sankeydsl.loader;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.sankeydsl.graph.FlowGraph;
import com.sankeydsl.graph.FlowLink;
import com.sankeydsl.graph.FlowNode;
import com.sankeydsl.graph.NodeCategory;
import com.sankeydsl.loader.validation.ValidationRunner;
import com.sankeydsl.testing.TestResources;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

class FlowTextLoaderTest {

    private static final String FIXTURE = "fixtures/income-statement.txt";

    @Test
    void loadsIncomeStatementFixture() throws Exception {
        Path path = TestResources.extractResource(FIXTURE);
        LoaderResult result = new FlowTextLoader().load(path);

        assertTrue(result.hasGraph());
        FlowGraph graph = result.getGraph();
        assertEquals(
                List.of(
                        "product_sales",
                        "revenue",
                        "services",
                        "cost_of_revenue",
                        "gross_profit",
                        "operating_expenses",
                        "net_profit",
                        "r&d",
                        "sales_&_marketing"),
                graph.getNodes().stream().map(FlowNode::getId).collect(Collectors.toList()));
        assertEquals("#4ade80", graph.findNode("revenue").getColor());
        assertEquals("#22c55e", graph.findNode("net_profit").getColor());
        assertEquals(NodeCategory.EXPENSE, graph.findNode("cost_of_revenue").getCategory());
        assertEquals(NodeCategory.PROFIT, graph.findNode("net_profit").getCategory());

        List<FlowLink> links = graph.getLinks();
        assertEquals(8, links.size());
        assertEquals(new FlowLink("product_sales", "revenue", 7_000_000, 6_200_000.0, "+13%"), links.get(0));
        assertEquals(new FlowLink("services", "revenue", 3_000_000, null, "+12%"), links.get(1));
        assertEquals(new FlowLink("revenue", "cost_of_revenue", 4_000_000, 3_800_000.0, "+5%"), links.get(2));
        assertEquals(new FlowLink("gross_profit", "operating_expenses", 3_500_000), links.get(4));
        assertEquals(new FlowLink("gross_profit", "net_profit", 2_500_000), links.get(5));
        assertEquals(new FlowLink("operating_expenses", "r&d", 1_500_000), links.get(6));

        List<Integer> warningLines =
                result.getMessages().stream()
                        .filter(message -> message.getLevel() == LoaderMessage.Level.WARNING)
                        .map(LoaderMessage::getLine)
                        .collect(Collectors.toList());
        assertEquals(List.of(15, 13, 14), warningLines);
        assertTrue(result.getValidationMessages().isEmpty(), "Every pass-through node balances");
    }

    @Test
    void reportsUnbalancedNodesThroughValidation() {
        LoaderResult result = new FlowTextLoader().load("pl.txt", "Revenue [600] Gross Profit\nGross Profit [100] Opex");

        assertEquals(1, result.getValidationMessages().size());
        assertTrue(result.getValidationMessages().get(0).getMessage().contains("Gross Profit"));
        assertTrue(new FlowTextLoader(ValidationRunner.none())
                .load("pl.txt", "Revenue [600] Gross Profit\nGross Profit [100] Opex")
                .getValidationMessages()
                .isEmpty());
    }

    @Test
    void nothingUsableGivesNoGraph() {
        LoaderResult result = new FlowTextLoader().load("empty.txt", "// nothing here\nRevenue :#fff");
        assertFalse(result.hasGraph());
        assertNull(result.getGraph());
        assertFalse(new FlowTextLoader().load("null.txt", null).hasGraph());
    }

    @Test
    void loadsTabularFile() throws IOException, LoaderException {
        Path dir = Files.createTempDirectory("sankeydsl-tabular");
        Path csv = dir.resolve("flows.csv");
        Files.writeString(
                csv,
                String.join(System.lineSeparator(), "From,To,Value,Prior", "Revenue,Profit,120,100", "Revenue,Costs,80,"),
                StandardCharsets.UTF_8);

        LoaderResult result = new FlowTextLoader().loadTabular(csv);
        List<FlowLink> links = result.getGraph().getLinks();
        assertEquals(new FlowLink("revenue", "profit", 120, 100.0, "+20%"), links.get(0));
        assertEquals(new FlowLink("revenue", "costs", 80), links.get(1));
        assertTrue(result.getMessages().isEmpty());
    }

    @Test
    void missingFileRaisesLoaderException() throws IOException {
        Path missing = Files.createTempDirectory("sankeydsl-missing").resolve("absent.txt");
        LoaderException ex = assertThrows(LoaderException.class, () -> new FlowTextLoader().load(missing));
        assertTrue(ex.getMessage().contains("absent.txt"));
        assertInstanceOf(NoSuchFileException.class, ex.getCause());
    }

    @Test
    void messagesFormatWithLocation() {
        LoaderResult result = new FlowTextLoader().load("pl.txt", "Revenue [1] Profit\nnoise");
        assertEquals("WARNING pl.txt:2: Unrecognized line: noise", result.getMessages().get(0).toString());
    }

    @Test
    void parserTraceAddsGrammarDiagnosticsWithoutChangingTheGraph() {
        String text = "A [1] B [2] C";
        FlowGraph plain = new FlowTextLoader().load("trace.txt", text).getGraph();

        String previous = System.getProperty("sankeydsl.debugParser");
        System.setProperty("sankeydsl.debugParser", "true");
        try {
            DebugFlags.drainCapturedDiagnostics();
            LoaderResult traced = new FlowTextLoader().load("trace.txt", text);

            assertEquals(plain, traced.getGraph());
            assertEquals(new FlowLink("a", "b_[2]_c", 1), traced.getGraph().getLinks().get(0));
            List<LoaderMessage> diagnostics =
                    traced.getMessages().stream()
                            .filter(message -> message.getMessage().startsWith("[diagnostic] "))
                            .collect(Collectors.toList());
            assertFalse(diagnostics.isEmpty());
            assertTrue(diagnostics.stream().allMatch(message -> message.getLevel() == LoaderMessage.Level.INFO));
            assertTrue(DebugFlags.drainCapturedDiagnostics().isEmpty());
        } finally {
            if (previous == null) {
                System.clearProperty("sankeydsl.debugParser");
            } else {
                System.setProperty("sankeydsl.debugParser", previous);
            }
        }
    }
}
