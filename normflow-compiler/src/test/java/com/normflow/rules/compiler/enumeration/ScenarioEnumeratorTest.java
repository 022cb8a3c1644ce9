package com.normflow.rules.compiler.enumeration;

import com.normflow.rules.api.model.Action;
import com.normflow.rules.api.model.Condition;
import com.normflow.rules.api.model.Precedence;
import com.normflow.rules.api.model.ReducedEdge;
import com.normflow.rules.api.model.RuleIR;
import com.normflow.rules.api.model.Scenario;
import com.normflow.rules.compiler.CompilerOptions;
import com.normflow.rules.compiler.TestDiagrams;
import com.normflow.rules.compiler.diagram.DiagramParser;
import com.normflow.rules.compiler.reduction.GraphReducer;
import com.normflow.rules.compiler.reduction.ReducedGraph;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ScenarioEnumeratorTest {

    private ScenarioEnumerator enumerator;

    @BeforeEach
    void setUp() {
        enumerator = new ScenarioEnumerator(new RuleSynthesizer(CompilerOptions.defaults()));
    }

    private static ReducedGraph reduce(String xml) {
        return new GraphReducer().reduce(new DiagramParser().parse(xml));
    }

    @Test
    @DisplayName("Should number the declared-first branch r1 regardless of document order")
    void shouldFollowDeclaredBranchOrder() {
        ReducedGraph graph = reduce(TestDiagrams.read(TestDiagrams.AI_CONTENT_MARKING));
        ScenarioCollector collector = new ScenarioCollector(true);

        int count = enumerator.enumerate(graph, collector);

        assertThat(count).isEqualTo(2);
        assertThat(collector.rules()).containsExactly(
                new RuleIR("r1",
                        List.of(new Condition("AIsystem", "generatesContent", true)),
                        List.of(new Action("AIprovider", "markContent"))),
                new RuleIR("r2",
                        List.of(new Condition("AIsystem", "generatesContent", false)),
                        List.of(new Action("AIprovider", "none"))));
        assertThat(collector.precedence()).containsExactly(new Precedence("r1", "r2"));
    }

    @Test
    @DisplayName("Should report each scenario with the edges it took")
    void shouldCollectScenarioPaths() {
        ReducedGraph graph = reduce(TestDiagrams.read(TestDiagrams.AI_CONTENT_MARKING));
        ScenarioCollector collector = new ScenarioCollector(true);

        enumerator.enumerate(graph, collector);

        assertThat(collector.scenarios()).extracting(Scenario::ruleId).containsExactly("r1", "r2");
        assertThat(collector.scenarios().get(0).edges())
                .extracting(ReducedEdge::dst)
                .containsExactly("Gateway_1", "Event_1x9");
    }

    @Test
    @DisplayName("Should not re-enter a decision already on the current path")
    void shouldStopAtPathLocalCycle() {
        ReducedGraph graph = reduce(TestDiagrams.read(TestDiagrams.FORM_INTAKE));
        ScenarioCollector collector = new ScenarioCollector(true);

        enumerator.enumerate(graph, collector);

        assertThat(collector.rules()).containsExactly(
                new RuleIR("r1",
                        List.of(new Condition("Clerk", "formComplete", true)),
                        List.of(new Action("Clerk", "registerapplication"))),
                new RuleIR("r2",
                        List.of(new Condition("Clerk", "formComplete", false),
                                new Condition("Applicant", "providesInfo", false)),
                        List.of()));
        assertThat(collector.precedence()).containsExactly(new Precedence("r1", "r2"));
    }

    @Test
    @DisplayName("Should chain every rule below its predecessor")
    void shouldChainPrecedence() {
        ReducedGraph graph = reduce(TestDiagrams.process("""
                <bpmn:startEvent id="Start" />
                <bpmn:exclusiveGateway id="Risk" name="System highRisk?">
                  <bpmn:outgoing>Flow_high</bpmn:outgoing>
                  <bpmn:outgoing>Flow_low</bpmn:outgoing>
                </bpmn:exclusiveGateway>
                <bpmn:exclusiveGateway id="Public" name="Provider publicSector?">
                  <bpmn:outgoing>Flow_pub</bpmn:outgoing>
                  <bpmn:outgoing>Flow_priv</bpmn:outgoing>
                </bpmn:exclusiveGateway>
                <bpmn:task id="Assess" name="Provider assess impact" />
                <bpmn:endEvent id="End_a" />
                <bpmn:endEvent id="End_b" />
                <bpmn:endEvent id="End_c" />
                <bpmn:sequenceFlow id="Flow_0" sourceRef="Start" targetRef="Risk" />
                <bpmn:sequenceFlow id="Flow_high" name="Yes" sourceRef="Risk" targetRef="Public" />
                <bpmn:sequenceFlow id="Flow_low" name="No" sourceRef="Risk" targetRef="End_c" />
                <bpmn:sequenceFlow id="Flow_pub" name="Yes" sourceRef="Public" targetRef="Assess" />
                <bpmn:sequenceFlow id="Flow_priv" name="No" sourceRef="Public" targetRef="End_b" />
                <bpmn:sequenceFlow id="Flow_assessed" sourceRef="Assess" targetRef="End_a" />
                """));
        ScenarioCollector collector = new ScenarioCollector(false);

        enumerator.enumerate(graph, collector);

        assertThat(collector.rules()).extracting(RuleIR::id).containsExactly("r1", "r2", "r3");
        assertThat(collector.rules().get(0).actions()).containsExactly(new Action("Provider", "assessimpact"));
        assertThat(collector.rules().get(2).conditions()).containsExactly(new Condition("System", "highRisk", false));
        assertThat(collector.precedence()).containsExactly(
                new Precedence("r1", "r2"),
                new Precedence("r2", "r3"));
        assertThat(collector.scenarios()).isNull();
    }

    @Test
    @DisplayName("Should produce the same rules and chain with and without path collection")
    void shouldNotDependOnPathCollection() {
        ReducedGraph graph = reduce(TestDiagrams.read(TestDiagrams.FORM_INTAKE));
        ScenarioCollector withPaths = new ScenarioCollector(true);
        ScenarioCollector withoutPaths = new ScenarioCollector(false);

        new ScenarioEnumerator(new RuleSynthesizer(CompilerOptions.defaults())).enumerate(graph, withPaths);
        new ScenarioEnumerator(new RuleSynthesizer(CompilerOptions.defaults())).enumerate(graph, withoutPaths);

        assertThat(withoutPaths.rules()).isEqualTo(withPaths.rules());
        assertThat(withoutPaths.precedence()).isEqualTo(withPaths.precedence());
    }

    @Test
    @DisplayName("Should stream rules to a custom sink in completion order")
    void shouldStreamToSink() {
        ReducedGraph graph = reduce(TestDiagrams.read(TestDiagrams.AI_CONTENT_MARKING));
        List<String> events = new ArrayList<>();

        enumerator.enumerate(graph, new ScenarioSink() {
            @Override
            public void onRule(RuleIR rule, List<ReducedEdge> path) {
                events.add("rule " + rule.id() + " (" + path.size() + " edges)");
            }

            @Override
            public void onPrecedence(Precedence precedence) {
                events.add(precedence.higherRuleId() + " > " + precedence.lowerRuleId());
            }
        });

        assertThat(events).containsExactly("rule r1 (2 edges)", "rule r2 (2 edges)", "r1 > r2");
    }

    @Test
    @DisplayName("Should compute minimum hop depth from the entry")
    void shouldComputeHopDepths() {
        ReducedGraph graph = reduce(TestDiagrams.read(TestDiagrams.FORM_INTAKE));

        Object2IntMap<String> depth = ScenarioEnumerator.hopDepths(graph);

        assertThat(depth.getInt("StartEvent_1")).isZero();
        assertThat(depth.getInt("Gateway_form")).isEqualTo(1);
        assertThat(depth.getInt("Gateway_info")).isEqualTo(2);
        assertThat(depth.getInt("Event_registered")).isEqualTo(2);
        assertThat(depth.getInt("Event_withdrawn")).isEqualTo(3);
    }
}
