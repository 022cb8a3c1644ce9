package com.normflow.rules.export;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.StringWriter;

import static org.assertj.core.api.Assertions.assertThat;

class CompilationReportWriterTest {

    private static String report(boolean withScenarios) throws IOException {
        StringWriter out = new StringWriter();
        new CompilationReportWriter().export(SampleResults.aiContentMarking(withScenarios), out);
        return out.toString();
    }

    @Test
    @DisplayName("Should list kept nodes sorted by id and reduced edges in result order")
    void shouldListGraph() throws IOException {
        String report = report(true);

        assertThat(report).startsWith("=== REDUCED NODES ===\n- Event_0a1 ");
        assertThat(report).contains("- Gateway_1          | DECISION         | AIsystem generatesContent?\n");
        assertThat(report).contains("Gateway_1 [Yes] -> Event_1x9 | src='AIsystem generatesContent?' dst=''"
                + " | tasks: AIprovider markContent | via_flows: Flow_yes, Flow_0mark\n");
        assertThat(report).contains("StartEvent_1 -> Gateway_1 | src='' dst='AIsystem generatesContent?'"
                + " | tasks: (no tasks) | via_flows: Flow_0start\n");
    }

    @Test
    @DisplayName("Should list each enumerated path with its rule id")
    void shouldListPaths() throws IOException {
        String report = report(true);

        assertThat(report).contains("=== START → END PATHS (2) ===");
        assertThat(report).contains("""
                Path 2 (r2):
                  StartEvent_1 -> Gateway_1 | tasks: (no tasks)
                  Gateway_1 [No] -> Event_0a1 | tasks: AIprovider none
                """);
    }

    @Test
    @DisplayName("Should end with the DDL rules and superiority")
    void shouldEndWithRules() throws IOException {
        assertThat(report(true)).endsWith("""
                % RULES
                r1: AIsystem_generatesContent => O(AIprovider_markContent).
                r2: not AIsystem_generatesContent => O(AIprovider_none).

                % SUPERIORITY
                r1 > r2.
                """);
    }

    @Test
    @DisplayName("Should skip the path section when scenarios were not collected")
    void shouldSkipPathsWhenNotCollected() throws IOException {
        String report = report(false);

        assertThat(report).doesNotContain("PATHS").contains("% RULES");
    }
}
