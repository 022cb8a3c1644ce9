/*
 * Copyright (c) 2025 NormFlow Rule Generator
 * Licensed under the Apache License, Version 2.0
 */
package com.normflow.rules.cli;

import com.normflow.rules.api.IProcessRuleCompiler;
import com.normflow.rules.api.exceptions.CompilationException;
import com.normflow.rules.api.model.CompilationResult;
import com.normflow.rules.export.RuleExporters;
import com.normflow.rules.export.SwrlOntologyExporter;
import com.normflow.rules.infra.logging.LoggingCompilationListener;
import com.normflow.rules.infra.logging.LoggingConfigurator;
import com.normflow.rules.infra.telemetry.TracingService;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Command-line entry point: compiles one BPMN file and writes every rule artifact.
 *
 * <pre>
 * java -jar normflow-cli.jar &lt;input.bpmn&gt; [outputDir]
 * </pre>
 *
 * When arguments are missing the {@code normflow.input} and {@code normflow.output.dir}
 * system properties (or {@code NORMFLOW_INPUT} and {@code NORMFLOW_OUTPUT_DIR}) are used.
 * The output directory defaults to the working directory.
 *
 * <p>Exit codes: 0 on success, 1 when compilation fails, 2 when no input is given or the
 * input file does not exist, 3 on I/O failures while reading or writing, 4 when the compiler
 * cannot be created from its configuration.
 */
public class RuleGeneratorApplication {
    private static final Logger logger = Logger.getLogger(RuleGeneratorApplication.class.getName());

    static final int EXIT_OK = 0;
    static final int EXIT_COMPILATION_FAILED = 1;
    static final int EXIT_USAGE = 2;
    static final int EXIT_IO_FAILED = 3;
    static final int EXIT_CONFIGURATION = 4;

    private final TracingService tracingService;
    private final PrintStream out;

    public RuleGeneratorApplication(TracingService tracingService, PrintStream out) {
        this.tracingService = tracingService;
        this.out = out;
    }

    public static void main(String[] args) {
        LoggingConfigurator.configure();
        TracingService tracingService = TracingService.getInstance();
        int exitCode;
        try {
            exitCode = new RuleGeneratorApplication(tracingService, System.out).run(args);
        } finally {
            tracingService.shutdown();
        }
        System.exit(exitCode);
    }

    int run(String[] args) {
        String input = args.length >= 1 ? args[0] : setting("normflow.input", "NORMFLOW_INPUT", null);
        if (input == null || input.isBlank()) {
            out.println("Usage: RuleGeneratorApplication <input.bpmn> [outputDir]");
            return EXIT_USAGE;
        }
        Path inputPath = Paths.get(input);
        Path outputDir = Paths.get(args.length >= 2
                ? args[1]
                : setting("normflow.output.dir", "NORMFLOW_OUTPUT_DIR", "."));
        String baseIri = setting("normflow.base.iri", "NORMFLOW_BASE_IRI", SwrlOntologyExporter.DEFAULT_BASE_IRI);

        if (!Files.isRegularFile(inputPath)) {
            logger.severe("Input file not found: " + inputPath);
            out.println("Input file not found: " + inputPath);
            return EXIT_USAGE;
        }

        IProcessRuleCompiler compiler;
        try {
            compiler = loadCompiler();
        } catch (ServiceConfigurationError | IllegalStateException e) {
            logger.log(Level.SEVERE, "Could not create the rule compiler: " + e.getMessage(), e);
            return EXIT_CONFIGURATION;
        }

        logger.info("Compiling " + inputPath + " into " + outputDir.toAbsolutePath().normalize());

        try {
            compiler.setTracer(tracingService.getTracer());
            compiler.setCompilationListener(new LoggingCompilationListener());

            CompilationResult result = compiler.compile(inputPath);
            List<Path> written = RuleExporters.writeAll(result, outputDir, RuleExporters.defaults(baseIri));

            printSummary(result, written);
            return EXIT_OK;
        } catch (CompilationException e) {
            logger.log(Level.SEVERE, "Compilation of " + inputPath + " failed: " + e.getMessage(), e);
            return EXIT_COMPILATION_FAILED;
        } catch (IOException e) {
            logger.log(Level.SEVERE, "I/O error: " + e.getMessage(), e);
            return EXIT_IO_FAILED;
        } finally {
            tracingService.flush();
        }
    }

    static IProcessRuleCompiler loadCompiler() {
        return ServiceLoader.load(IProcessRuleCompiler.class).findFirst()
                .orElseThrow(() -> new IllegalStateException(
                        "No " + IProcessRuleCompiler.class.getSimpleName() + " implementation on the classpath"));
    }

    private void printSummary(CompilationResult result, List<Path> written) {
        out.printf("Process %s: %d rules, %d superiority relations, %d label warnings%n",
                result.processId(), result.rules().size(), result.precedence().size(), result.warnings().size());
        for (Path path : written) {
            out.println("Wrote: " + path);
        }
    }

    private static String setting(String property, String environmentVariable, String defaultValue) {
        String value = System.getProperty(property);
        if (value == null || value.isEmpty()) {
            value = System.getenv(environmentVariable);
        }
        return value == null || value.isEmpty() ? defaultValue : value;
    }
}
