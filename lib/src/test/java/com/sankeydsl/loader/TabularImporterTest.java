package com.sankeydsl.loader;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class TabularImporterTest {

    private final TabularImporter importer = new TabularImporter();

    @Test
    void convertsRowsToBracketLines() {
        String csv =
                String.join(
                        System.lineSeparator(),
                        "Source,Target,Amount,Comparison",
                        "Revenue,Cost of Sales,\"1,000\",900",
                        "Revenue,Gross Profit,2.5k,+4%",
                        "Revenue,Other,0,",
                        "Gross Profit,Net Profit,1500,N/A");

        assertEquals(
                String.join(
                        "\n",
                        "Revenue [1000, 900] Cost of Sales",
                        "Revenue [2500, +4%] Gross Profit",
                        "Gross Profit [1500] Net Profit"),
                importer.toFlowText(csv));
    }

    @Test
    void bracketedNamesAndLabelsNeverReachTheText() {
        String csv =
                String.join(
                        System.lineSeparator(),
                        "Source,Target,Amount,Comparison",
                        "Opex,Marketing [EMEA],40,",
                        "Revenue,Segment: B2B,100,up]");

        String text = importer.toFlowText(csv);
        assertEquals("Revenue [100] Segment: B2B", text);
        assertEquals(
                "Node names may not contain '[' or ']'",
                new TabularAstBuilder().readRows("<paste>", csv).get(0).rejectionReason());
    }

    @Test
    void emptyTableGivesEmptyText() {
        assertEquals("", importer.toFlowText(""));
        assertEquals("", importer.toFlowText("Source,Target,Amount"));
    }
}
