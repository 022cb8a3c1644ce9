package com.normflow.rules.export;

import com.normflow.rules.api.model.CompilationResult;

import java.io.IOException;
import java.io.Writer;

/**
 * Renders a compiled rule set into one target format.
 *
 * <p>Exporters read only the {@link CompilationResult}; they never look at the diagram.
 * Output must be identical for identical results.
 */
public interface RuleExporter {

    /**
     * Default file name of the artifact inside an output directory.
     */
    String fileName();

    /**
     * Writes the artifact. The writer is not closed.
     */
    void export(CompilationResult result, Writer writer) throws IOException;
}
