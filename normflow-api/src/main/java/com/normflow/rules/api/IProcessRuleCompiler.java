package com.normflow.rules.api;

import com.normflow.rules.api.model.CompilationResult;
import io.opentelemetry.api.trace.Tracer;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Contract for compiling a process diagram into normative rules.
 */
public interface IProcessRuleCompiler {

    /**
     * Compiles a diagram file.
     *
     * @param diagramPath path to the BPMN file
     * @return rules, precedence chain and the reduced graph they came from
     * @throws IOException if the file cannot be read
     * @throws com.normflow.rules.api.exceptions.CompilationException if the diagram is malformed
     *         or structurally invalid
     */
    CompilationResult compile(Path diagramPath) throws IOException;

    /**
     * Compiles diagram markup held in memory.
     *
     * @param diagramXml BPMN markup
     * @return rules, precedence chain and the reduced graph they came from
     */
    CompilationResult compile(String diagramXml);

    /**
     * Sets the tracer for observability.
     *
     * @param tracer the OpenTelemetry tracer
     */
    default void setTracer(Tracer tracer) {
    }

    /**
     * Sets a compilation listener for tracking compilation progress.
     *
     * @param listener the compilation listener (null to disable)
     */
    default void setCompilationListener(CompilationListener listener) {
    }
}
