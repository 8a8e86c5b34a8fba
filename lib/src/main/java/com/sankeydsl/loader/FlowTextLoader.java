package com.sankeydsl.loader;

import com.sankeydsl.loader.ast.DocumentNode;
import com.sankeydsl.loader.semantic.SemanticAnalysis;
import com.sankeydsl.loader.semantic.SemanticAnalyzer;
import com.sankeydsl.loader.validation.ValidationRunner;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Entry point for loading flow text with diagnostics. Each call builds its own AST, node registry
 * and graph, so a single loader may be shared between threads.
 */
public final class FlowTextLoader {

    private final FlowTextAstBuilder astBuilder;
    private final TabularAstBuilder tabularBuilder;
    private final ValidationRunner validationRunner;

    public FlowTextLoader() {
        this(ValidationRunner.defaultRules());
    }

    public FlowTextLoader(ValidationRunner validationRunner) {
        this(new FlowTextAstBuilder(), new TabularAstBuilder(), validationRunner);
    }

    public FlowTextLoader(
            FlowTextAstBuilder astBuilder,
            TabularAstBuilder tabularBuilder,
            ValidationRunner validationRunner) {
        this.astBuilder = Objects.requireNonNull(astBuilder, "astBuilder");
        this.tabularBuilder = Objects.requireNonNull(tabularBuilder, "tabularBuilder");
        this.validationRunner = Objects.requireNonNull(validationRunner, "validationRunner");
    }

    /** Line-oriented notations: color directives, bracket, arrow and delimited rows. */
    public LoaderResult load(String sourceName, String text) {
        DocumentNode document = astBuilder.parse(sourceName, text == null ? "" : text);
        List<LoaderMessage> diagnostics = new ArrayList<>();
        if (DebugFlags.isParserTraceEnabled()) {
            for (String diagnostic : DebugFlags.drainCapturedDiagnostics()) {
                diagnostics.add(
                        new LoaderMessage(
                                LoaderMessage.Level.INFO, "[diagnostic] " + diagnostic, sourceName, 0));
            }
        }
        return analyze(document, diagnostics);
    }

    /** Whole-document tables with optional header detection. */
    public LoaderResult loadTabular(String sourceName, String text) {
        return analyze(tabularBuilder.parse(sourceName, text == null ? "" : text), List.of());
    }

    public LoaderResult load(Path path) throws LoaderException {
        return load(path.toString(), read(path));
    }

    public LoaderResult loadTabular(Path path) throws LoaderException {
        return loadTabular(path.toString(), read(path));
    }

    private LoaderResult analyze(DocumentNode document, List<LoaderMessage> diagnostics) {
        SemanticAnalysis analysis = new SemanticAnalyzer().analyze(document);
        List<LoaderMessage> messages = new ArrayList<>(diagnostics);
        messages.addAll(analysis.getMessages());
        return new LoaderResult(analysis.getGraph(), messages, validationRunner.run(analysis));
    }

    private static String read(Path path) throws LoaderException {
        Objects.requireNonNull(path, "path");
        try {
            return Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new LoaderException("Unable to read flow text from " + path, ex);
        }
    }
}
