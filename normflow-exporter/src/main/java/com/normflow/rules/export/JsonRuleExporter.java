package com.normflow.rules.export;

import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.normflow.rules.api.model.Action;
import com.normflow.rules.api.model.CompilationResult;
import com.normflow.rules.api.model.Condition;
import com.normflow.rules.api.model.LabelFormatWarning;
import com.normflow.rules.api.model.Precedence;
import com.normflow.rules.api.model.RuleIR;

import java.io.IOException;
import java.io.Writer;

/**
 * Writes the rule set as JSON for downstream tooling.
 *
 * <p>Field order is fixed and lines end with {@code \n} on every platform.
 */
public class JsonRuleExporter implements RuleExporter {

    public static final String FILE_NAME = "rules.json";

    private final ObjectMapper objectMapper;
    private final ObjectWriter objectWriter;

    public JsonRuleExporter() {
        this.objectMapper = new ObjectMapper();
        DefaultIndenter indenter = new DefaultIndenter("  ", "\n");
        this.objectWriter = objectMapper.writer(new DefaultPrettyPrinter()
                .withObjectIndenter(indenter)
                .withArrayIndenter(indenter));
    }

    @Override
    public String fileName() {
        return FILE_NAME;
    }

    @Override
    public void export(CompilationResult result, Writer writer) throws IOException {
        writer.write(objectWriter.writeValueAsString(toJson(result)));
        writer.write('\n');
    }

    ObjectNode toJson(CompilationResult result) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("processId", result.processId());

        ArrayNode rules = root.putArray("rules");
        for (RuleIR rule : result.rules()) {
            ObjectNode ruleNode = rules.addObject();
            ruleNode.put("id", rule.id());
            ArrayNode conditions = ruleNode.putArray("conditions");
            for (Condition condition : rule.conditions()) {
                conditions.addObject()
                        .put("actor", condition.actor())
                        .put("predicate", condition.predicate())
                        .put("value", condition.value());
            }
            ArrayNode actions = ruleNode.putArray("actions");
            for (Action action : rule.actions()) {
                actions.addObject()
                        .put("actor", action.actor())
                        .put("name", action.name());
            }
        }

        ArrayNode precedence = root.putArray("precedence");
        for (Precedence link : result.precedence()) {
            precedence.addObject()
                    .put("higher", link.higherRuleId())
                    .put("lower", link.lowerRuleId());
        }

        ArrayNode warnings = root.putArray("warnings");
        for (LabelFormatWarning warning : result.warnings()) {
            warnings.addObject()
                    .put("role", warning.role().name())
                    .put("label", warning.label())
                    .put("actor", warning.actor())
                    .put("symbol", warning.symbol());
        }
        return root;
    }
}
