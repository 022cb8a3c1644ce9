/*
 * Copyright (c) 2025 NormFlow Rule Generator
 * Licensed under the Apache License, Version 2.0
 */
package com.normflow.rules.export;

import com.normflow.rules.api.model.Action;
import com.normflow.rules.api.model.CompilationResult;
import com.normflow.rules.api.model.Condition;
import com.normflow.rules.api.model.Precedence;
import com.normflow.rules.api.model.RuleIR;

import java.io.IOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.List;

import static com.normflow.rules.export.ExportText.escapeXml;
import static com.normflow.rules.export.ExportText.pad;
import static com.normflow.rules.export.ExportText.toXmlId;

/**
 * Writes rules as LegalRuleML prescriptive statements with override statements for the
 * superiority chain.
 *
 * <p>Conditions map to {@code Rel=predicate, Var=actor, Data=true|false} and actions to
 * {@code Rel=task, Var=actor, Data=name}. Several atoms are wrapped in {@code ruleml:And};
 * an empty {@code if} or {@code then} block is left out.
 */
public class LegalRuleMlExporter implements RuleExporter {

    public static final String FILE_NAME = "rules_legalruleml.xml";

    static final String LRML_NAMESPACE = "http://docs.oasis-open.org/legalruleml/ns/v1.0/";
    static final String RULEML_NAMESPACE = "http://ruleml.org/spec";

    @Override
    public String fileName() {
        return FILE_NAME;
    }

    @Override
    public void export(CompilationResult result, Writer writer) throws IOException {
        StringBuilder xml = new StringBuilder();
        xml.append("<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n");
        xml.append("<lrml:LegalRuleML\n");
        xml.append("  xmlns:lrml=\"").append(LRML_NAMESPACE).append("\"\n");
        xml.append("  xmlns:ruleml=\"").append(RULEML_NAMESPACE).append("\"\n");
        xml.append("  xmlns:xsi=\"http://www.w3.org/2001/XMLSchema-instance\">\n\n");
        xml.append("  <lrml:Statements>\n");

        for (RuleIR rule : result.rules()) {
            appendStatement(xml, rule);
        }
        for (Precedence precedence : result.precedence()) {
            xml.append("    <lrml:OverrideStatement>\n");
            xml.append("      <lrml:Override over=\"#").append(escapeXml(toXmlId(precedence.higherRuleId())))
                    .append("\" under=\"#").append(escapeXml(toXmlId(precedence.lowerRuleId()))).append("\"/>\n");
            xml.append("    </lrml:OverrideStatement>\n");
        }

        xml.append("  </lrml:Statements>\n\n");
        xml.append("</lrml:LegalRuleML>\n");
        writer.write(xml.toString());
    }

    private static void appendStatement(StringBuilder xml, RuleIR rule) {
        String key = escapeXml(toXmlId(rule.id()));

        List<Atom> ifAtoms = new ArrayList<>();
        for (Condition condition : rule.conditions()) {
            ifAtoms.add(new Atom(condition.predicate(), condition.actor(), "xs:boolean",
                    Boolean.toString(condition.value())));
        }
        List<Atom> thenAtoms = new ArrayList<>();
        for (Action action : rule.actions()) {
            thenAtoms.add(new Atom(SwrlOntologyExporter.TASK_PREDICATE, action.actor(), "xs:string", action.name()));
        }

        xml.append("    <lrml:PrescriptiveStatement key=\"").append(key).append("\">\n");
        xml.append("      <ruleml:Rule key=\"").append(key).append("\">\n");
        appendBlock(xml, "ruleml:if", ifAtoms);
        appendBlock(xml, "ruleml:then", thenAtoms);
        xml.append("      </ruleml:Rule>\n");
        xml.append("    </lrml:PrescriptiveStatement>\n");
    }

    private static void appendBlock(StringBuilder xml, String element, List<Atom> atoms) {
        if (atoms.isEmpty()) {
            return;
        }
        xml.append("        <").append(element).append(">\n");
        if (atoms.size() == 1) {
            appendAtom(xml, atoms.get(0), 10);
        } else {
            xml.append("          <ruleml:And>\n");
            for (Atom atom : atoms) {
                appendAtom(xml, atom, 12);
            }
            xml.append("          </ruleml:And>\n");
        }
        xml.append("        </").append(element).append(">\n");
    }

    private static void appendAtom(StringBuilder xml, Atom atom, int indent) {
        String pad = pad(indent);
        xml.append(pad).append("<ruleml:Atom>\n");
        xml.append(pad).append("  <ruleml:Rel>").append(escapeXml(atom.relation())).append("</ruleml:Rel>\n");
        xml.append(pad).append("  <ruleml:Var>").append(escapeXml(atom.variable())).append("</ruleml:Var>\n");
        xml.append(pad).append("  <ruleml:Data xsi:type=\"").append(atom.type()).append("\">")
                .append(escapeXml(atom.value())).append("</ruleml:Data>\n");
        xml.append(pad).append("</ruleml:Atom>\n");
    }

    private record Atom(String relation, String variable, String type, String value) {
    }
}
