package com.normflow.rules.export;

import com.normflow.rules.api.model.CompilationResult;
import com.normflow.rules.api.model.ProcessNode;
import com.normflow.rules.api.model.ReducedEdge;
import com.normflow.rules.api.model.Scenario;

import java.io.IOException;
import java.io.Writer;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Writes a human-readable account of a compilation: reduced nodes, reduced edges,
 * enumerated paths (when collected), then the rules and superiority in DDL form.
 */
public class CompilationReportWriter implements RuleExporter {

    public static final String FILE_NAME = "report.txt";

    @Override
    public String fileName() {
        return FILE_NAME;
    }

    @Override
    public void export(CompilationResult result, Writer writer) throws IOException {
        Map<String, ProcessNode> nodes = result.keptNodes();
        StringBuilder out = new StringBuilder();

        out.append("=== REDUCED NODES ===\n");
        for (ProcessNode node : new TreeMap<>(nodes).values()) {
            out.append(String.format("- %-18s | %-16s | %s", node.id(), node.kind(), node.label())).append('\n');
        }

        out.append("\n=== REDUCED EDGES ===\n");
        for (ReducedEdge edge : result.reducedEdges()) {
            out.append(edgeLine(edge, nodes)).append('\n');
        }

        if (result.scenarios() != null) {
            List<Scenario> scenarios = result.scenarios();
            out.append("\n=== START → END PATHS (").append(scenarios.size()).append(") ===\n\n");
            int index = 1;
            for (Scenario scenario : scenarios) {
                out.append("Path ").append(index++).append(" (").append(scenario.ruleId()).append("):\n");
                for (ReducedEdge edge : scenario.edges()) {
                    out.append("  ").append(edge.src()).append(guard(edge)).append(" -> ").append(edge.dst())
                            .append(" | tasks: ").append(joinOr(edge.obligations(), "(no tasks)")).append('\n');
                }
                out.append('\n');
            }
        } else {
            out.append('\n');
        }

        DefeasibleLogicExporter.appendRules(out, result);
        writer.write(out.toString());
    }

    private static String edgeLine(ReducedEdge edge, Map<String, ProcessNode> nodes) {
        return edge.src() + guard(edge) + " -> " + edge.dst()
                + " | src='" + label(nodes, edge.src()) + "' dst='" + label(nodes, edge.dst()) + "'"
                + " | tasks: " + joinOr(edge.obligations(), "(no tasks)")
                + " | via_flows: " + joinOr(edge.viaFlows(), "(none)");
    }

    private static String guard(ReducedEdge edge) {
        return edge.guard() == null || edge.guard().isEmpty() ? "" : " [" + edge.guard() + "]";
    }

    private static String label(Map<String, ProcessNode> nodes, String id) {
        ProcessNode node = nodes.get(id);
        return node != null ? node.label() : "";
    }

    private static String joinOr(List<String> items, String empty) {
        return items.isEmpty() ? empty : String.join(", ", items);
    }
}
