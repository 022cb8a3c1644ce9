package com.normflow.rules.export;

import com.normflow.rules.api.model.Action;
import com.normflow.rules.api.model.CompilationResult;
import com.normflow.rules.api.model.Condition;
import com.normflow.rules.api.model.RuleIR;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NodeList;

import java.io.StringWriter;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SwrlOntologyExporterTest {

    private static final String RDF = "http://www.w3.org/1999/02/22-rdf-syntax-ns#";
    private static final String OWL = "http://www.w3.org/2002/07/owl#";
    private static final String SWRL = "http://www.w3.org/2003/11/swrl#";

    private static String export(SwrlOntologyExporter exporter, CompilationResult result)
            throws Exception {
        StringWriter out = new StringWriter();
        exporter.export(result, out);
        return out.toString();
    }

    private static List<String> about(Document document, String namespace, String element) {
        NodeList nodes = document.getElementsByTagNameNS(namespace, element);
        List<String> iris = new ArrayList<>();
        for (int i = 0; i < nodes.getLength(); i++) {
            iris.add(((Element) nodes.item(i)).getAttributeNS(RDF, "about"));
        }
        return iris;
    }

    @Test
    @DisplayName("Should declare sorted properties and variables and one implication per rule")
    void shouldWriteOntology() throws Exception {
        String xml = export(new SwrlOntologyExporter(), SampleResults.aiContentMarking(true));
        Document document = XmlTestSupport.parse(xml);

        assertThat(about(document, OWL, "Ontology")).containsExactly("http://example.org/bpmn2rules");
        assertThat(about(document, OWL, "DatatypeProperty")).containsExactly(
                "http://example.org/bpmn2rules#generatesContent",
                "http://example.org/bpmn2rules#task");
        assertThat(about(document, SWRL, "Variable")).containsExactly(
                "http://example.org/bpmn2rules#var_AIprovider",
                "http://example.org/bpmn2rules#var_AIsystem");
        assertThat(about(document, SWRL, "Imp")).containsExactly(
                "http://example.org/bpmn2rules#r1",
                "http://example.org/bpmn2rules#r2");
    }

    @Test
    @DisplayName("Should type condition atoms as boolean and task atoms as string")
    void shouldTypeAtoms() throws Exception {
        String xml = export(new SwrlOntologyExporter(), SampleResults.aiContentMarking(true));

        assertThat(xml)
                .contains("<swrl:argument2 rdf:datatype=\"http://www.w3.org/2001/XMLSchema#boolean\">true</swrl:argument2>")
                .contains("<swrl:argument2 rdf:datatype=\"http://www.w3.org/2001/XMLSchema#boolean\">false</swrl:argument2>")
                .contains("<swrl:argument2 rdf:datatype=\"http://www.w3.org/2001/XMLSchema#string\">markContent</swrl:argument2>");
    }

    @Test
    @DisplayName("Should nest multi-atom bodies as proper lists and use rdf:nil for empty heads")
    void shouldBuildRdfLists() throws Exception {
        RuleIR rule = new RuleIR("r1",
                List.of(new Condition("User", "consents", true), new Condition("User", "isMinor", false)),
                List.of());
        Document document = XmlTestSupport.parse(
                export(new SwrlOntologyExporter(), SampleResults.ofRules(List.of(rule), List.of())));

        Element body = (Element) document.getElementsByTagNameNS(SWRL, "body").item(0);
        assertThat(body.getElementsByTagNameNS(SWRL, "AtomList").getLength()).isEqualTo(2);
        assertThat(body.getElementsByTagNameNS(SWRL, "DatavaluedPropertyAtom").getLength()).isEqualTo(2);

        Element head = (Element) document.getElementsByTagNameNS(SWRL, "head").item(0);
        Element nil = (Element) head.getElementsByTagNameNS(RDF, "Description").item(0);
        assertThat(nil.getAttributeNS(RDF, "about")).isEqualTo(RDF + "nil");
    }

    @Test
    @DisplayName("Should honour a custom base IRI and escape text content")
    void shouldUseBaseIriAndEscape() throws Exception {
        RuleIR rule = new RuleIR("r1", List.of(), List.of(new Action("Clerk", "file<urgent>&sign")));
        SwrlOntologyExporter exporter = new SwrlOntologyExporter("http://example.com/gdpr");

        String xml = export(exporter, SampleResults.ofRules(List.of(rule), List.of()));
        Document document = XmlTestSupport.parse(xml);

        assertThat(xml).contains("xml:base=\"http://example.com/gdpr\"");
        assertThat(xml).contains("file&lt;urgent&gt;&amp;sign");
        assertThat(document.getElementsByTagNameNS(SWRL, "argument2").item(0).getTextContent())
                .isEqualTo("file<urgent>&sign");
    }

    @Test
    @DisplayName("Should produce identical output on repeated export")
    void shouldBeDeterministic() throws Exception {
        SwrlOntologyExporter exporter = new SwrlOntologyExporter();

        assertThat(export(exporter, SampleResults.aiContentMarking(true)))
                .isEqualTo(export(exporter, SampleResults.aiContentMarking(false)));
    }
}
