package com.normflow.rules.compiler.diagram;

import com.normflow.rules.api.exceptions.MalformedInputException;
import com.normflow.rules.api.model.NodeKind;
import com.normflow.rules.compiler.TestDiagrams;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DiagramParserTest {

    private DiagramParser parser;

    @BeforeEach
    void setUp() {
        parser = new DiagramParser();
    }

    @Test
    @DisplayName("Should read nodes, flows and adjacency of a modeler-exported diagram")
    void shouldReadModelerDiagram() throws IOException {
        DiagramArtifacts artifacts = parser.parse(TestDiagrams.path(TestDiagrams.AI_CONTENT_MARKING));

        assertThat(artifacts.processId()).isEqualTo("Process_ai_marking");
        assertThat(artifacts.nodes()).containsOnlyKeys(
                "StartEvent_1", "Gateway_1", "Activity_mark", "Activity_none", "Event_0a1", "Event_1x9");
        assertThat(artifacts.nodes().get("StartEvent_1").kind()).isEqualTo(NodeKind.ENTRY);
        assertThat(artifacts.nodes().get("Gateway_1").kind()).isEqualTo(NodeKind.DECISION);
        assertThat(artifacts.nodes().get("Gateway_1").label()).isEqualTo("AIsystem generatesContent?");
        assertThat(artifacts.nodes().get("Activity_mark").kind()).isEqualTo(NodeKind.OBLIGATION);
        assertThat(artifacts.nodes().get("Event_0a1").kind()).isEqualTo(NodeKind.EXIT);

        assertThat(artifacts.flows()).hasSize(5);
        assertThat(artifacts.flows().get("Flow_yes").label()).isEqualTo("Yes");
        assertThat(artifacts.flows().get("Flow_0start").label()).isNull();

        // adjacency follows document order, declared order is kept separately
        assertThat(artifacts.outgoingOf("Gateway_1")).containsExactly("Flow_no", "Flow_yes");
        assertThat(artifacts.branchOrder().declaredOrder("Gateway_1")).containsExactly("Flow_yes", "Flow_no");
        assertThat(artifacts.incomingOf("Gateway_1")).containsExactly("Flow_0start");
    }

    @Test
    @DisplayName("Should give every node adjacency lists, even when empty")
    void shouldGiveEveryNodeAdjacency() {
        DiagramArtifacts artifacts = parser.parse(TestDiagrams.read(TestDiagrams.AI_CONTENT_MARKING));

        assertThat(artifacts.outgoing()).containsKeys(artifacts.nodes().keySet().toArray(String[]::new));
        assertThat(artifacts.incoming()).containsKeys(artifacts.nodes().keySet().toArray(String[]::new));
        assertThat(artifacts.outgoingOf("Event_0a1")).isEmpty();
        assertThat(artifacts.incomingOf("StartEvent_1")).isEmpty();
    }

    @Test
    @DisplayName("Should index declared branch positions")
    void shouldIndexBranchPositions() {
        DiagramArtifacts artifacts = parser.parse(TestDiagrams.read(TestDiagrams.AI_CONTENT_MARKING));
        BranchOrderIndex index = artifacts.branchOrder();

        assertThat(index.position("Gateway_1", "Flow_yes")).isZero();
        assertThat(index.position("Gateway_1", "Flow_no")).isEqualTo(1);
        assertThat(index.position("Gateway_1", "Flow_0start")).isEqualTo(BranchOrderIndex.UNDECLARED);
        assertThat(index.position("StartEvent_1", "Flow_0start")).isEqualTo(BranchOrderIndex.UNDECLARED);
    }

    @Test
    @DisplayName("Should skip elements missing required attributes")
    void shouldSkipIncompleteElements() {
        String xml = TestDiagrams.process("""
                <bpmn:startEvent id="Start" />
                <bpmn:task name="Task without id" />
                <bpmn:endEvent id="End" />
                <bpmn:sequenceFlow id="Flow_ok" sourceRef="Start" targetRef="End" />
                <bpmn:sequenceFlow id="Flow_no_target" sourceRef="Start" />
                <bpmn:sequenceFlow sourceRef="Start" targetRef="End" />
                """);

        DiagramArtifacts artifacts = parser.parse(xml);

        assertThat(artifacts.nodes()).containsOnlyKeys("Start", "End");
        assertThat(artifacts.flows()).containsOnlyKeys("Flow_ok");
        assertThat(artifacts.outgoingOf("Start")).containsExactly("Flow_ok");
    }

    @Test
    @DisplayName("Should ignore non flow-node elements and classify other flow nodes")
    void shouldClassifyElements() {
        String xml = TestDiagrams.process("""
                <bpmn:laneSet id="LaneSet_1"><bpmn:lane id="Lane_1" /></bpmn:laneSet>
                <bpmn:textAnnotation id="Annotation_1"><bpmn:text>note</bpmn:text></bpmn:textAnnotation>
                <bpmn:startEvent id="Start" />
                <bpmn:userTask id="Review" name="Officer review" />
                <bpmn:parallelGateway id="Fork" />
                <bpmn:endEvent id="End" />
                """);

        DiagramArtifacts artifacts = parser.parse(xml);

        assertThat(artifacts.nodes()).containsOnlyKeys("Start", "Review", "Fork", "End");
        assertThat(artifacts.nodes().get("Review").kind()).isEqualTo(NodeKind.OTHER);
        assertThat(artifacts.nodes().get("Fork").kind()).isEqualTo(NodeKind.OTHER);
    }

    @Test
    @DisplayName("Should read configured element names as obligations")
    void shouldUseConfiguredObligationElements() {
        String xml = TestDiagrams.process("""
                <bpmn:startEvent id="Start" />
                <bpmn:userTask id="Review" name="Officer review" />
                <bpmn:task id="Note" name="Clerk note" />
                <bpmn:endEvent id="End" />
                """);

        DiagramArtifacts artifacts = new DiagramParser(Set.of("task", "userTask")).parse(xml);

        assertThat(artifacts.nodes().get("Review").kind()).isEqualTo(NodeKind.OBLIGATION);
        assertThat(artifacts.nodes().get("Note").kind()).isEqualTo(NodeKind.OBLIGATION);
    }

    @Test
    @DisplayName("Should accept markup without a namespace prefix")
    void shouldAcceptUnprefixedMarkup() {
        String xml = """
                <definitions xmlns="http://www.omg.org/spec/BPMN/20100524/MODEL">
                  <process id="Plain">
                    <startEvent id="Start" />
                    <endEvent id="End" />
                    <sequenceFlow id="Flow_1" sourceRef="Start" targetRef="End" />
                  </process>
                </definitions>
                """;

        DiagramArtifacts artifacts = parser.parse(new ByteArrayInputStream(xml.getBytes(StandardCharsets.UTF_8)));

        assertThat(artifacts.processId()).isEqualTo("Plain");
        assertThat(artifacts.nodes()).containsOnlyKeys("Start", "End");
        assertThat(artifacts.flows()).containsOnlyKeys("Flow_1");
    }

    @Test
    @DisplayName("Should use the first process container only")
    void shouldUseFirstProcess() {
        String xml = """
                <bpmn:definitions xmlns:bpmn="http://www.omg.org/spec/BPMN/20100524/MODEL">
                  <bpmn:process id="First"><bpmn:startEvent id="A" /></bpmn:process>
                  <bpmn:process id="Second"><bpmn:startEvent id="B" /></bpmn:process>
                </bpmn:definitions>
                """;

        DiagramArtifacts artifacts = parser.parse(xml);

        assertThat(artifacts.processId()).isEqualTo("First");
        assertThat(artifacts.nodes()).containsOnlyKeys("A");
    }

    @Test
    @DisplayName("Should throw exception when no process container exists")
    void shouldThrowWithoutProcess() {
        String xml = """
                <bpmn:definitions xmlns:bpmn="http://www.omg.org/spec/BPMN/20100524/MODEL">
                  <bpmn:collaboration id="Collab" />
                </bpmn:definitions>
                """;

        assertThatThrownBy(() -> parser.parse(xml))
                .isInstanceOf(MalformedInputException.class)
                .hasMessageContaining("No <process> element found");
    }

    @Test
    @DisplayName("Should throw exception for markup that is not XML")
    void shouldThrowForNonXml() {
        assertThatThrownBy(() -> parser.parse("this is not a diagram"))
                .isInstanceOf(MalformedInputException.class)
                .hasMessageContaining("Failed to parse diagram markup");
    }

    @Test
    @DisplayName("Should throw exception for empty markup")
    void shouldThrowForEmptyMarkup() {
        assertThatThrownBy(() -> parser.parse("  "))
                .isInstanceOf(MalformedInputException.class)
                .hasMessageContaining("cannot be null or empty");
    }

    @Test
    @DisplayName("Should reject documents declaring a DOCTYPE")
    void shouldRejectDoctype() {
        String xml = """
                <?xml version="1.0"?>
                <!DOCTYPE definitions [<!ENTITY xxe SYSTEM "file:///etc/passwd">]>
                <definitions><process id="P"><task id="T" name="&xxe;" /></process></definitions>
                """;

        assertThatThrownBy(() -> parser.parse(xml))
                .isInstanceOf(MalformedInputException.class);
    }
}
