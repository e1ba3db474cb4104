package me.golemcore.artifactor.domain.section;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SectionQualityGateTest {

    private final SectionQualityGate gate = new SectionQualityGate();

    @Test
    void shouldPassCleanContent() {
        String content = "# Features\n\n## Feature Areas\n\n" + "Users can place and track orders. ".repeat(10);

        SectionQualityGate.GateResult result = gate.evaluate("features", content,
                SectionGateConfig.forSection("features"));

        assertTrue(result.passed());
        assertEquals(1.0, result.score());
        assertTrue(result.failures().isEmpty());
    }

    @Test
    void shouldFailShortContent() {
        SectionQualityGate.GateResult result = gate.evaluate("executive_overview", "# Overview\n\nToo short.",
                SectionGateConfig.forSection("executive_overview"));

        assertFalse(result.passed());
        assertEquals("content_length", result.failures().get(0).field());
        assertEquals(SectionQualityGate.Severity.ERROR, result.failures().get(0).severity());
        assertEquals(2.0 / 3.0, result.score(), 1e-9);
    }

    @Test
    void shouldWarnOnMissingHeadingWithoutFailing() {
        String content = "# System Overview\n\n" + "The service exposes a REST API backed by a queue. ".repeat(6);

        SectionQualityGate.GateResult result = gate.evaluate("system_overview", content,
                SectionGateConfig.forSection("system_overview"));

        assertTrue(result.passed());
        assertEquals(0.75, result.score(), 1e-9);
        assertEquals(SectionQualityGate.Severity.WARNING, result.failures().get(0).severity());
        assertTrue(result.failures().get(0).actual().contains("Architecture Diagram"));
    }

    @Test
    void shouldFailOnPlaceholders() {
        String content = "# Overview\n\n[PROJECT NAME] handles [TODO: fill in] requests. " + "Filler text. ".repeat(20);

        SectionQualityGate.GateResult result = gate.evaluate("personas", content, SectionGateConfig.of(50));

        assertFalse(result.passed());
        assertEquals("placeholders", result.failures().get(0).field());
    }

    @Test
    void shouldIgnorePlaceholdersInsideCode() {
        List<String> found = SectionQualityGate.detectPlaceholders(
                "Run `[TODO]` or\n```\nlet x = [PLACEHOLDER];\n```\nthen [EXAMPLE VALUE] and [API KEY].");

        assertEquals(List.of("[EXAMPLE VALUE]"), found);
    }

    @Test
    void shouldWarnOnRepeatedParagraphs() {
        String paragraph = "This paragraph is long enough to count as a duplicate when it repeats.";
        String content = "# Stories\n\n" + paragraph + "\n\n" + paragraph + "\n\n" + paragraph;

        SectionQualityGate.GateResult result = gate.evaluate("user_stories", content, SectionGateConfig.of(50));

        assertTrue(result.passed());
        assertEquals("repetition", result.failures().get(0).field());
        assertTrue(result.failures().get(0).actual().startsWith("2 duplicate"));
    }

    @Test
    void shouldUseDefaultConfigForUnknownSection() {
        assertEquals(SectionGateConfig.DEFAULT, SectionGateConfig.forSection("custom"));
        assertEquals(List.of("Coverage Summary"),
                SectionGateConfig.forSection("security_considerations").requiredHeadings());
    }
}
