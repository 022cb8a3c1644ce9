/*
 * Copyright (c) 2025 NormFlow Rule Generator
 * Licensed under the Apache License, Version 2.0
 */
package com.normflow.rules.compiler;

import com.normflow.rules.api.CompilationListener;
import com.normflow.rules.api.IProcessRuleCompiler;
import com.normflow.rules.api.exceptions.CompilationException;
import com.normflow.rules.api.model.CompilationResult;
import com.normflow.rules.api.model.CompilationStats;
import com.normflow.rules.api.model.LabelFormatWarning;
import com.normflow.rules.api.model.RuleIR;
import com.normflow.rules.compiler.diagram.DiagramArtifacts;
import com.normflow.rules.compiler.diagram.DiagramParser;
import com.normflow.rules.compiler.enumeration.RuleSynthesizer;
import com.normflow.rules.compiler.enumeration.ScenarioCollector;
import com.normflow.rules.compiler.enumeration.ScenarioEnumerator;
import com.normflow.rules.compiler.reduction.GraphReducer;
import com.normflow.rules.compiler.reduction.ReducedGraph;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * Compiles a process diagram into rules in three stages: parsing the markup, reducing the
 * graph to its normatively relevant nodes, and enumerating scenarios into rules.
 *
 * <p>Each stage runs in its own span under a {@code compile-process} span and is reported to
 * the {@link CompilationListener}, if one is set. A failing stage is reported through
 * {@link CompilationListener#onError} and its exception propagates unchanged; no partial
 * result is returned. A diagram file that cannot be opened is reported as a PARSING failure
 * and surfaces from {@link #compile(Path)} as the original {@link IOException}; the file is
 * decoded according to its XML encoding declaration.
 *
 * <p>Instances are not thread-safe. A compiler may be reused for any number of sequential
 * compilations.
 */
public class ProcessRuleCompiler implements IProcessRuleCompiler {
    private static final Logger logger = Logger.getLogger(ProcessRuleCompiler.class.getName());

    static final String STAGE_PARSING = "PARSING";
    static final String STAGE_REDUCTION = "REDUCTION";
    static final String STAGE_ENUMERATION = "ENUMERATION";
    private static final int TOTAL_STAGES = 3;

    private final CompilerOptions options;
    private Tracer tracer;
    private CompilationListener listener;

    /**
     * Creates a compiler with options read from the environment and tracing disabled.
     * This is the constructor used by {@link java.util.ServiceLoader}.
     */
    public ProcessRuleCompiler() {
        this(OpenTelemetry.noop().getTracer("normflow-compiler"), CompilerOptions.fromEnvironment());
    }

    public ProcessRuleCompiler(Tracer tracer) {
        this(tracer, CompilerOptions.fromEnvironment());
    }

    public ProcessRuleCompiler(Tracer tracer, CompilerOptions options) {
        this.tracer = tracer;
        this.options = options;
    }

    @Override
    public void setTracer(Tracer tracer) {
        this.tracer = tracer;
    }

    @Override
    public void setCompilationListener(CompilationListener listener) {
        this.listener = listener;
    }

    @Override
    public CompilationResult compile(Path diagramPath) throws IOException {
        Span span = tracer.spanBuilder("compile-process").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("diagramPath", diagramPath.toString());
            return compileDiagram(parser -> {
                try {
                    return parser.parse(diagramPath);
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
            }, span);
        } catch (UncheckedIOException e) {
            span.recordException(e.getCause());
            throw e.getCause();
        } catch (RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    @Override
    public CompilationResult compile(String diagramXml) {
        Span span = tracer.spanBuilder("compile-process").startSpan();
        try (Scope scope = span.makeCurrent()) {
            return compileDiagram(parser -> parser.parse(diagramXml), span);
        } catch (RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    private CompilationResult compileDiagram(Function<DiagramParser, DiagramArtifacts> source, Span span) {
        long startTime = System.nanoTime();

        DiagramParser parser = new DiagramParser(options.obligationElements());
        DiagramArtifacts artifacts = runStage(STAGE_PARSING, 1,
                () -> source.apply(parser),
                parsed -> Map.of(
                        "nodeCount", parsed.nodes().size(),
                        "flowCount", parsed.flows().size(),
                        "decisionCount", parsed.branchOrder().size()));

        GraphReducer reducer = new GraphReducer();
        ReducedGraph graph = runStage(STAGE_REDUCTION, 2,
                () -> reducer.reduce(artifacts),
                reduced -> Map.of(
                        "keptNodeCount", reduced.keptNodes().size(),
                        "reducedEdgeCount", reduced.edges().size()));

        RuleSynthesizer synthesizer = new RuleSynthesizer(options);
        ScenarioCollector collector = new ScenarioCollector(options.collectPaths());
        runStage(STAGE_ENUMERATION, 3,
                () -> {
                    synthesizer.checkBranchLabels(graph);
                    return new ScenarioEnumerator(synthesizer).enumerate(graph, collector);
                },
                scenarioCount -> Map.of(
                        "ruleCount", scenarioCount,
                        "warningCount", synthesizer.warnings().size()));

        long compilationTime = System.nanoTime() - startTime;
        List<RuleIR> rules = collector.rules();
        List<LabelFormatWarning> warnings = synthesizer.warnings();

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("conditionCount", rules.stream().mapToInt(r -> r.conditions().size()).sum());
        metadata.put("actionCount", rules.stream().mapToInt(r -> r.actions().size()).sum());
        metadata.put("warningCount", warnings.size());
        metadata.put("obligationFreeRules", (int) rules.stream().filter(RuleIR::isObligationFree).count());
        metadata.put("branchLabelPolicy", options.branchLabelPolicy().name());

        CompilationStats stats = new CompilationStats(
                artifacts.nodes().size(),
                artifacts.flows().size(),
                graph.keptNodes().size(),
                graph.edges().size(),
                rules.size(),
                compilationTime,
                metadata);

        span.setAttribute("processId", String.valueOf(artifacts.processId()));
        span.setAttribute("ruleCount", rules.size());
        span.setAttribute("compilationTimeMs", TimeUnit.NANOSECONDS.toMillis(compilationTime));

        logger.info(String.format("Compiled process %s: %d rules from %d reduced edges in %.2f ms",
                artifacts.processId(), rules.size(), graph.edges().size(), compilationTime / 1_000_000.0));

        return new CompilationResult(
                artifacts.processId(),
                graph.keptNodes(),
                graph.edges(),
                graph.branchOrder().asMap(),
                rules,
                collector.precedence(),
                collector.scenarios(),
                warnings,
                stats);
    }

    private <T> T runStage(String stageName,
                           int stageNumber,
                           Supplier<T> stage,
                           Function<T, Map<String, Object>> metrics) {
        Span span = tracer.spanBuilder(stageName.toLowerCase()).startSpan();
        try (Scope scope = span.makeCurrent()) {
            if (listener != null) {
                listener.onStageStart(stageName, stageNumber, TOTAL_STAGES);
            }
            long start = System.nanoTime();
            T result = stage.get();
            long duration = System.nanoTime() - start;

            Map<String, Object> stageMetrics = metrics.apply(result);
            stageMetrics.forEach((key, value) -> span.setAttribute(key, String.valueOf(value)));
            if (listener != null) {
                listener.onStageComplete(stageName,
                        new CompilationListener.StageResult(stageName, duration, stageMetrics));
            }
            return result;
        } catch (CompilationException e) {
            span.recordException(e);
            if (listener != null) {
                listener.onError(stageName, e);
            }
            throw e;
        } catch (UncheckedIOException e) {
            span.recordException(e.getCause());
            if (listener != null) {
                listener.onError(stageName, e.getCause());
            }
            throw e;
        } catch (RuntimeException e) {
            span.recordException(e);
            if (listener != null) {
                listener.onError(stageName, e);
            }
            throw new CompilationException("Unexpected error during " + stageName, e);
        } finally {
            span.end();
        }
    }
}
