package com.sankeydsl.tools;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.sankeydsl.Version;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;

class SankeyDslCliTest {

    private final ByteArrayOutputStream stdout = new ByteArrayOutputStream();
    private final ByteArrayOutputStream stderr = new ByteArrayOutputStream();

    @Test
    void printsCanonicalTextForFile() throws IOException {
        Path file = writeTemp("flows.txt", "Revenue -> Profit 300 250\nRevenue, Costs, 700\nnoise");

        int exit = run("", file.toString());

        assertEquals(SankeyDslCli.EXIT_OK, exit);
        assertEquals(lines("Revenue [300, 250] Profit", "Revenue [700] Costs"), out());
        assertTrue(err().contains("WARNING " + file + ":3: Unrecognized line: noise"), err());
    }

    @Test
    void readsStandardInput() {
        int exit = run("Revenue [5] Profit", "-");
        assertEquals(SankeyDslCli.EXIT_OK, exit);
        assertEquals(lines("Revenue [5] Profit"), out());
    }

    @Test
    void parsesTablesWhenAsked() {
        int exit = run("source,target,value\nRevenue,Profit,1.5k", "--tabular", "-");
        assertEquals(SankeyDslCli.EXIT_OK, exit);
        assertEquals(lines("Revenue [1500] Profit"), out());
    }

    @Test
    void convertsTablesToFlowText() {
        int exit = run("Revenue\tProfit\t2,000\t+4%", "--convert", "-");
        assertEquals(SankeyDslCli.EXIT_OK, exit);
        assertEquals(lines("Revenue [2000, +4%] Profit"), out());
    }

    @Test
    void printsBalanceTable() {
        int exit = run("Revenue [600] Gross Profit\nGross Profit [100] Opex", "--balance", "-");

        assertEquals(SankeyDslCli.EXIT_OK, exit);
        String output = out();
        assertTrue(output.contains("UNBALANCED"), output);
        assertTrue(
                output.lines()
                        .anyMatch(
                                line ->
                                        line.startsWith("Gross Profit")
                                                && line.contains(" profit ")
                                                && line.endsWith("UNBALANCED")));
        assertTrue(err().contains("Node 'Gross Profit' is unbalanced"), err());
    }

    @Test
    void reportsMissingGraph() {
        int exit = run("// nothing", "-");
        assertEquals(SankeyDslCli.EXIT_NO_GRAPH, exit);
        assertEquals("", out());
        assertTrue(err().contains("No flows found in <stdin>"));
    }

    @Test
    void rejectsBadUsage() {
        assertEquals(SankeyDslCli.EXIT_FAILURE, run(""));
        assertTrue(err().contains("Usage"));
        assertEquals(SankeyDslCli.EXIT_FAILURE, run("", "--bogus", "-"));
        assertTrue(err().contains("Unknown option: --bogus"));
        assertEquals(SankeyDslCli.EXIT_FAILURE, run("", "a.txt", "b.txt"));
    }

    @Test
    void reportsMissingFile() throws IOException {
        Path missing = Files.createTempDirectory("sankeydsl-cli").resolve("absent.txt");
        assertEquals(SankeyDslCli.EXIT_FAILURE, run("", missing.toString()));
        assertTrue(err().contains("Flow text file not found"), err());
    }

    @Test
    void printsVersion() {
        assertEquals(SankeyDslCli.EXIT_OK, run("", "--version"));
        assertEquals(lines("sankey-dsl " + Version.FULL), out());
    }

    private int run(String stdin, String... args) {
        return SankeyDslCli.run(
                args,
                new ByteArrayInputStream(stdin.getBytes(StandardCharsets.UTF_8)),
                new PrintStream(stdout, true, StandardCharsets.UTF_8),
                new PrintStream(stderr, true, StandardCharsets.UTF_8));
    }

    private String out() {
        return stdout.toString(StandardCharsets.UTF_8);
    }

    private String err() {
        return stderr.toString(StandardCharsets.UTF_8);
    }

    // The CLI prints the serialized text with println, so its '\n' separators stay as-is.
    private static String lines(String... lines) {
        return String.join("\n", lines) + System.lineSeparator();
    }

    private static Path writeTemp(String name, String content) throws IOException {
        Path dir = Files.createTempDirectory("sankeydsl-cli");
        Path file = dir.resolve(name);
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }
}
