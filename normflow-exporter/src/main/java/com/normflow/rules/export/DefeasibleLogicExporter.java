package com.normflow.rules.export;

import com.normflow.rules.api.model.Action;
import com.normflow.rules.api.model.CompilationResult;
import com.normflow.rules.api.model.Condition;
import com.normflow.rules.api.model.Precedence;
import com.normflow.rules.api.model.RuleIR;

import java.io.IOException;
import java.io.Writer;
import java.util.stream.Collectors;

/**
 * Writes rules in Governatori-style defeasible deontic logic.
 *
 * <pre>
 * % RULES
 * r1: AIsystem_generatesContent => O(AIprovider_markContent).
 * r2: not AIsystem_generatesContent => O(AIprovider_none).
 *
 * % SUPERIORITY
 * r1 > r2.
 * </pre>
 */
public class DefeasibleLogicExporter implements RuleExporter {

    public static final String FILE_NAME = "rules_DDL.txt";

    @Override
    public String fileName() {
        return FILE_NAME;
    }

    @Override
    public void export(CompilationResult result, Writer writer) throws IOException {
        StringBuilder out = new StringBuilder();
        appendRules(out, result);
        writer.write(out.toString());
    }

    static void appendRules(StringBuilder out, CompilationResult result) {
        out.append("% RULES\n");
        for (RuleIR rule : result.rules()) {
            out.append(toRule(rule)).append('\n');
        }
        out.append("\n% SUPERIORITY\n");
        for (Precedence precedence : result.precedence()) {
            out.append(toSuperiority(precedence)).append('\n');
        }
    }

    /**
     * Renders {@code id: antecedent => head.}; an empty antecedent is {@code true} and an
     * empty head is {@code O(none)}.
     */
    public static String toRule(RuleIR rule) {
        String antecedent = rule.conditions().isEmpty()
                ? "true"
                : rule.conditions().stream()
                .map(DefeasibleLogicExporter::literal)
                .collect(Collectors.joining(", "));
        String head = rule.actions().isEmpty()
                ? "O(none)"
                : rule.actions().stream()
                .map(DefeasibleLogicExporter::obligation)
                .collect(Collectors.joining(" & "));
        return rule.id() + ": " + antecedent + " => " + head + ".";
    }

    public static String toSuperiority(Precedence precedence) {
        return precedence.higherRuleId() + " > " + precedence.lowerRuleId() + ".";
    }

    private static String literal(Condition condition) {
        String atom = ExportText.toSymbol(condition.actor() + " " + condition.predicate());
        return condition.value() ? atom : "not " + atom;
    }

    private static String obligation(Action action) {
        return "O(" + ExportText.toSymbol(action.actor() + " " + action.name()) + ")";
    }
}
