package me.golemcore.artifactor.domain.service;

import me.golemcore.artifactor.adapter.outbound.source.LocalSourceAccessAdapter;
import me.golemcore.artifactor.domain.exception.GuardrailViolationException;
import me.golemcore.artifactor.domain.model.Citation;
import me.golemcore.artifactor.domain.model.GuardrailResult;
import me.golemcore.artifactor.infrastructure.config.ArtifactorProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GuardrailEvaluatorTest {

    @TempDir
    Path root;

    private ArtifactorProperties properties;
    private GuardrailEvaluator evaluator;

    @BeforeEach
    void setUp() throws IOException {
        properties = new ArtifactorProperties();
        evaluator = new GuardrailEvaluator(new LocalSourceAccessAdapter(properties), properties);
        Files.createDirectories(root.resolve("src"));
        Files.writeString(root.resolve("src/app.py"), "import os\n\ndef main():\n    return 1\n");
    }

    @Test
    void shouldPassValidCitation() {
        GuardrailResult result = evaluator.verifyCitation(Citation.of("src/app.py", 3, 4), root);

        assertTrue(result.passed());
        assertEquals(GuardrailEvaluator.CHECK_VALID, result.checkName());
    }

    @Test
    void shouldReportFirstFailingCheck() {
        List<GuardrailResult> results = evaluator.verifyCitations(List.of(
                Citation.of("src/missing.py", 1, 1),
                Citation.of("src/app.py", 0, 2),
                Citation.of("src/app.py", 3, 2),
                Citation.of("src/app.py", 1, 99),
                Citation.of("src/app.py", 1, 1)), root);

        assertEquals(5, results.size());
        assertEquals(GuardrailEvaluator.CHECK_FILE_EXISTS, results.get(0).checkName());
        assertEquals(GuardrailEvaluator.CHECK_LINE_START, results.get(1).checkName());
        assertEquals(GuardrailEvaluator.CHECK_LINE_RANGE, results.get(2).checkName());
        assertEquals(GuardrailEvaluator.CHECK_LINE_END, results.get(3).checkName());
        assertTrue(results.get(3).reason().contains("exceeds file length (4)"));
        assertTrue(results.get(4).passed());
    }

    @Test
    void shouldRejectPathEscapingRoot() {
        GuardrailResult result = evaluator.verifyCitation(Citation.of("../outside.py", 1, 1), root);

        assertFalse(result.passed());
        assertEquals(GuardrailEvaluator.CHECK_FILE_EXISTS, result.checkName());
    }

    @Test
    void shouldTrimAndTruncateInput() {
        properties.getGuardrails().setMaxInputLength(5);

        assertEquals("abc", evaluator.validateInput("  abc  "));
        assertEquals("abcde", evaluator.validateInput("abcdefgh"));
    }

    @Test
    void shouldRejectBlankInput() {
        assertThrows(GuardrailViolationException.class, () -> evaluator.validateInput("   "));
        assertThrows(GuardrailViolationException.class, () -> evaluator.validateInput(null));
    }

    @Test
    void shouldPrefixDisclaimerBelowThreshold() {
        GuardrailEvaluator.GatedOutput gated = evaluator.gateLowConfidence("Body", 0.42);
        GuardrailEvaluator.GatedOutput clear = evaluator.gateLowConfidence("Body", 0.60);

        assertTrue(gated.gated());
        assertEquals("[Low confidence: 0.42] Body", gated.content());
        assertFalse(clear.gated());
        assertEquals("Body", clear.content());
    }
}
