package com.normflow.rules.export;

import com.normflow.rules.api.model.CompilationResult;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * The standard exporter set and a helper that writes it to a directory.
 */
public final class RuleExporters {
    private static final Logger logger = Logger.getLogger(RuleExporters.class.getName());

    private RuleExporters() {
    }

    public static List<RuleExporter> defaults() {
        return defaults(SwrlOntologyExporter.DEFAULT_BASE_IRI);
    }

    /**
     * DDL, SWRL/OWL, LegalRuleML, JSON and the text report, in that order.
     */
    public static List<RuleExporter> defaults(String baseIri) {
        return List.of(
                new DefeasibleLogicExporter(),
                new SwrlOntologyExporter(baseIri),
                new LegalRuleMlExporter(),
                new JsonRuleExporter(),
                new CompilationReportWriter());
    }

    /**
     * Writes one UTF-8 file per exporter into {@code outputDir}, creating it if needed.
     *
     * @return the written files, in exporter order
     */
    public static List<Path> writeAll(CompilationResult result, Path outputDir,
                                      List<? extends RuleExporter> exporters) throws IOException {
        Files.createDirectories(outputDir);
        List<Path> written = new ArrayList<>(exporters.size());
        for (RuleExporter exporter : exporters) {
            Path target = outputDir.resolve(exporter.fileName());
            try (Writer writer = Files.newBufferedWriter(target, StandardCharsets.UTF_8)) {
                exporter.export(result, writer);
            }
            logger.info("Wrote: " + target);
            written.add(target);
        }
        return written;
    }
}
