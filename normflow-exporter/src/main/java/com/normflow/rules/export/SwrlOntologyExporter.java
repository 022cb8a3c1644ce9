/*
 * Copyright (c) 2025 NormFlow Rule Generator
 * Licensed under the Apache License, Version 2.0
 */
package com.normflow.rules.export;

import com.normflow.rules.api.model.Action;
import com.normflow.rules.api.model.CompilationResult;
import com.normflow.rules.api.model.Condition;
import com.normflow.rules.api.model.RuleIR;

import java.io.IOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

import static com.normflow.rules.export.ExportText.escapeXml;
import static com.normflow.rules.export.ExportText.pad;

/**
 * Writes rules as SWRL implications inside an RDF/XML OWL ontology.
 *
 * <p>Each condition becomes {@code base#predicate(base#var_Actor, true|false)} and each action
 * becomes {@code base#task(base#var_Actor, "name")}. Rule bodies and heads are proper RDF
 * lists; an empty list is {@code rdf:nil}. Properties and variables are declared once, sorted
 * by name.
 */
public class SwrlOntologyExporter implements RuleExporter {

    public static final String FILE_NAME = "rules_swrl.owl";
    public static final String DEFAULT_BASE_IRI = "http://example.org/bpmn2rules";
    public static final String TASK_PREDICATE = "task";

    private static final String RDF_NIL = "http://www.w3.org/1999/02/22-rdf-syntax-ns#nil";
    private static final String XSD_BOOLEAN = "http://www.w3.org/2001/XMLSchema#boolean";
    private static final String XSD_STRING = "http://www.w3.org/2001/XMLSchema#string";

    private final String baseIri;

    public SwrlOntologyExporter() {
        this(DEFAULT_BASE_IRI);
    }

    public SwrlOntologyExporter(String baseIri) {
        this.baseIri = Objects.requireNonNull(baseIri, "baseIri");
    }

    @Override
    public String fileName() {
        return FILE_NAME;
    }

    public String baseIri() {
        return baseIri;
    }

    @Override
    public void export(CompilationResult result, Writer writer) throws IOException {
        Set<String> predicates = new TreeSet<>();
        Set<String> actors = new TreeSet<>();
        for (RuleIR rule : result.rules()) {
            for (Condition condition : rule.conditions()) {
                predicates.add(condition.predicate());
                actors.add(condition.actor());
            }
            for (Action action : rule.actions()) {
                actors.add(action.actor());
            }
        }
        predicates.add(TASK_PREDICATE);

        StringBuilder xml = new StringBuilder();
        xml.append("<?xml version=\"1.0\"?>\n");
        xml.append("<rdf:RDF\n");
        xml.append("  xmlns:rdf=\"http://www.w3.org/1999/02/22-rdf-syntax-ns#\"\n");
        xml.append("  xmlns:owl=\"http://www.w3.org/2002/07/owl#\"\n");
        xml.append("  xmlns:xsd=\"http://www.w3.org/2001/XMLSchema#\"\n");
        xml.append("  xmlns:rdfs=\"http://www.w3.org/2000/01/rdf-schema#\"\n");
        xml.append("  xmlns:swrl=\"http://www.w3.org/2003/11/swrl#\"\n");
        xml.append("  xmlns:swrlb=\"http://www.w3.org/2003/11/swrlb#\"\n");
        xml.append("  xmlns:ruleml=\"http://www.w3.org/2003/11/ruleml#\"\n");
        xml.append("  xml:base=\"").append(escapeXml(baseIri)).append("\">\n\n");
        xml.append("  <owl:Ontology rdf:about=\"").append(escapeXml(baseIri)).append("\"/>\n\n");

        for (String predicate : predicates) {
            xml.append("  <owl:DatatypeProperty rdf:about=\"")
                    .append(escapeXml(propertyIri(predicate))).append("\"/>\n");
        }
        xml.append('\n');
        for (String actor : actors) {
            xml.append("  <swrl:Variable rdf:about=\"")
                    .append(escapeXml(variableIri(actor))).append("\"/>\n");
        }

        xml.append("\n  <!-- SWRL Rules -->\n");
        for (int i = 0; i < result.rules().size(); i++) {
            if (i > 0) {
                xml.append('\n');
            }
            appendRule(xml, result.rules().get(i));
        }
        xml.append("\n</rdf:RDF>\n");
        writer.write(xml.toString());
    }

    private void appendRule(StringBuilder xml, RuleIR rule) {
        List<Atom> body = new ArrayList<>();
        for (Condition condition : rule.conditions()) {
            body.add(new Atom(propertyIri(condition.predicate()), variableIri(condition.actor()),
                    XSD_BOOLEAN, Boolean.toString(condition.value())));
        }
        List<Atom> head = new ArrayList<>();
        for (Action action : rule.actions()) {
            head.add(new Atom(propertyIri(TASK_PREDICATE), variableIri(action.actor()),
                    XSD_STRING, action.name()));
        }

        xml.append("  <swrl:Imp rdf:about=\"").append(escapeXml(baseIri + "#" + rule.id())).append("\">\n");
        xml.append("    <swrl:body>\n");
        appendAtomList(xml, body, 0, 8);
        xml.append("    </swrl:body>\n");
        xml.append("    <swrl:head>\n");
        appendAtomList(xml, head, 0, 8);
        xml.append("    </swrl:head>\n");
        xml.append("  </swrl:Imp>\n");
    }

    private static void appendAtomList(StringBuilder xml, List<Atom> atoms, int from, int indent) {
        String pad = pad(indent);
        if (from >= atoms.size()) {
            xml.append(pad).append("<rdf:Description rdf:about=\"").append(RDF_NIL).append("\"/>\n");
            return;
        }
        xml.append(pad).append("<swrl:AtomList>\n");
        xml.append(pad).append("  <rdf:first>\n");
        appendAtom(xml, atoms.get(from), indent + 4);
        xml.append(pad).append("  </rdf:first>\n");
        if (from + 1 == atoms.size()) {
            xml.append(pad).append("  <rdf:rest rdf:resource=\"").append(RDF_NIL).append("\"/>\n");
        } else {
            xml.append(pad).append("  <rdf:rest>\n");
            appendAtomList(xml, atoms, from + 1, indent + 4);
            xml.append(pad).append("  </rdf:rest>\n");
        }
        xml.append(pad).append("</swrl:AtomList>\n");
    }

    private static void appendAtom(StringBuilder xml, Atom atom, int indent) {
        String pad = pad(indent);
        xml.append(pad).append("<swrl:DatavaluedPropertyAtom>\n");
        xml.append(pad).append("  <swrl:propertyPredicate rdf:resource=\"")
                .append(escapeXml(atom.propertyIri())).append("\"/>\n");
        xml.append(pad).append("  <swrl:argument1 rdf:resource=\"")
                .append(escapeXml(atom.variableIri())).append("\"/>\n");
        xml.append(pad).append("  <swrl:argument2 rdf:datatype=\"").append(atom.datatype()).append("\">")
                .append(escapeXml(atom.value())).append("</swrl:argument2>\n");
        xml.append(pad).append("</swrl:DatavaluedPropertyAtom>\n");
    }

    private String propertyIri(String localName) {
        return baseIri + "#" + localName;
    }

    private String variableIri(String actor) {
        return baseIri + "#var_" + actor;
    }

    private record Atom(String propertyIri, String variableIri, String datatype, String value) {
    }
}
