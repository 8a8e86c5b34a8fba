package com.sankeydsl.tools;

import com.sankeydsl.Version;
import com.sankeydsl.graph.FlowGraph;
import com.sankeydsl.graph.NodeBalance;
import com.sankeydsl.loader.FlowTextLoader;
import com.sankeydsl.loader.LoaderException;
import com.sankeydsl.loader.LoaderMessage;
import com.sankeydsl.loader.LoaderResult;
import com.sankeydsl.loader.TabularImporter;
import com.sankeydsl.writer.FlowTextSerializer;
import com.sankeydsl.writer.NumberFormatter;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.logging.ConsoleHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Command-line converter: reads flow text (or a pasted table) from a file or stdin and prints the
 * canonical bracket notation, with diagnostics on stderr.
 */
public final class SankeyDslCli {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_NO_GRAPH = 2;

    private static final String USAGE =
            "Usage: SankeyDslCli [--tabular] [--convert] [--balance] [--verbose] <file|->";
    private static final String BALANCE_ROW = "%-30s %-8s %15s %15s %15s  %s";
    private static final Logger LOGGER = Logger.getLogger(SankeyDslCli.class.getName());

    private record Options(boolean tabular, boolean convert, boolean balance, boolean verbose, String input) {}

    private SankeyDslCli() {}

    public static void main(String[] args) {
        configureLogging();
        System.exit(run(args, System.in, System.out, System.err));
    }

    static int run(String[] args, InputStream stdin, PrintStream out, PrintStream err) {
        if (List.of(args).contains("--version")) {
            out.println("sankey-dsl " + Version.FULL);
            return EXIT_OK;
        }
        Options options = parseOptions(args, err);
        if (options == null) {
            return EXIT_FAILURE;
        }
        if (options.verbose()) {
            enableVerboseLogging();
        }
        String text;
        try {
            text = readInput(options.input(), stdin);
        } catch (LoaderException ex) {
            err.println(ex.getMessage());
            return EXIT_FAILURE;
        }
        String sourceName = "-".equals(options.input()) ? "<stdin>" : options.input();

        if (options.convert()) {
            out.println(new TabularImporter().toFlowText(text));
            return EXIT_OK;
        }

        FlowTextLoader loader = new FlowTextLoader();
        LoaderResult result =
                options.tabular() ? loader.loadTabular(sourceName, text) : loader.load(sourceName, text);
        for (LoaderMessage message : result.getMessages()) {
            if (options.verbose() || message.getLevel() != LoaderMessage.Level.INFO) {
                err.println(message);
            }
        }
        for (LoaderMessage message : result.getValidationMessages()) {
            err.println(message);
        }
        if (!result.hasGraph()) {
            err.println("No flows found in " + sourceName);
            return EXIT_NO_GRAPH;
        }
        FlowGraph graph = result.getGraph();
        LOGGER.fine(() -> "Loaded " + graph + " from " + sourceName);
        out.println(FlowTextSerializer.serialize(graph));
        if (options.balance()) {
            printBalances(graph, out);
        }
        return EXIT_OK;
    }

    private static Options parseOptions(String[] args, PrintStream err) {
        boolean tabular = false;
        boolean convert = false;
        boolean balance = false;
        boolean verbose = false;
        List<String> positional = new ArrayList<>();
        for (String arg : args) {
            switch (arg) {
                case "--tabular":
                    tabular = true;
                    break;
                case "--convert":
                    convert = true;
                    break;
                case "--balance":
                    balance = true;
                    break;
                case "--verbose":
                    verbose = true;
                    break;
                default:
                    if (arg.startsWith("--")) {
                        err.println("Unknown option: " + arg);
                        err.println(USAGE);
                        return null;
                    }
                    positional.add(arg);
            }
        }
        if (positional.size() != 1) {
            err.println(USAGE);
            return null;
        }
        return new Options(tabular, convert, balance, verbose, positional.get(0));
    }

    private static String readInput(String input, InputStream stdin) throws LoaderException {
        try {
            if ("-".equals(input)) {
                return new String(stdin.readAllBytes(), StandardCharsets.UTF_8);
            }
            Path path = Path.of(input).toAbsolutePath().normalize();
            if (!Files.exists(path)) {
                throw new LoaderException("Flow text file not found: " + path);
            }
            return Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new LoaderException("Unable to read " + input + ": " + ex.getMessage(), ex);
        }
    }

    private static void printBalances(FlowGraph graph, PrintStream out) {
        out.println();
        out.println(
                String.format(
                        Locale.ROOT, BALANCE_ROW, "node", "category", "in", "out", "delta", "status"));
        for (NodeBalance balance : NodeBalance.compute(graph)) {
            out.println(
                    String.format(
                            Locale.ROOT,
                            BALANCE_ROW,
                            balance.getName(),
                            graph.findNode(balance.getId()).getCategory().label(),
                            NumberFormatter.format(balance.getTotalIn()),
                            NumberFormatter.format(balance.getTotalOut()),
                            NumberFormatter.format(balance.getDelta()),
                            balance.isBalanced() ? "ok" : "UNBALANCED"));
        }
    }

    private static void configureLogging() {
        try (InputStream in = SankeyDslCli.class.getClassLoader().getResourceAsStream("logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException ex) {
            System.err.println("Unable to load logging configuration: " + ex.getMessage());
        }
    }

    private static void enableVerboseLogging() {
        Logger root = Logger.getLogger("com.sankeydsl");
        root.setLevel(Level.FINE);
        boolean hasConsole = false;
        for (Handler handler : root.getHandlers()) {
            if (handler instanceof ConsoleHandler console) {
                console.setLevel(Level.FINE);
                hasConsole = true;
            }
        }
        if (!hasConsole) {
            ConsoleHandler handler = new ConsoleHandler();
            handler.setLevel(Level.FINE);
            root.addHandler(handler);
            root.setUseParentHandlers(false);
        }
    }
}
