package com.normflow.rules.export;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ExportTextTest {

    @Test
    @DisplayName("Should strip punctuation and join words with underscores")
    void shouldBuildSymbols() {
        assertThat(ExportText.toSymbol("AIsystem generatesContent")).isEqualTo("AIsystem_generatesContent");
        assertThat(ExportText.toSymbol("  Provider  notify\nuser! ")).isEqualTo("Provider_notify_user");
        assertThat(ExportText.toSymbol("Behörde prüft")).isEqualTo("Behörde_prüft");
    }

    @Test
    @DisplayName("Should fall back to unnamed for empty symbols")
    void shouldFallBackToUnnamed() {
        assertThat(ExportText.toSymbol("?!")).isEqualTo("unnamed");
        assertThat(ExportText.toSymbol(null)).isEqualTo("unnamed");
        assertThat(ExportText.toXmlId(" ")).isEqualTo("unnamed");
    }

    @Test
    @DisplayName("Should replace characters unsafe in XML keys")
    void shouldBuildXmlIds() {
        assertThat(ExportText.toXmlId("r1")).isEqualTo("r1");
        assertThat(ExportText.toXmlId("rule #1")).isEqualTo("rule__1");
    }

    @Test
    @DisplayName("Should escape XML special characters")
    void shouldEscapeXml() {
        assertThat(ExportText.escapeXml("a<b & \"c\" 'd'>"))
                .isEqualTo("a&lt;b &amp; &quot;c&quot; &apos;d&apos;&gt;");
        assertThat(ExportText.escapeXml(null)).isEmpty();
    }
}
