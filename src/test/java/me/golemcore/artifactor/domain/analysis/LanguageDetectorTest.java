package me.golemcore.artifactor.domain.analysis;

import me.golemcore.artifactor.adapter.outbound.source.LocalSourceAccessAdapter;
import me.golemcore.artifactor.domain.model.analysis.LanguageInfo;
import me.golemcore.artifactor.domain.model.analysis.LanguageMap;
import me.golemcore.artifactor.infrastructure.config.ArtifactorProperties;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class LanguageDetectorTest {

    @TempDir
    Path root;

    @Test
    void shouldCountKnownLanguagesSortedByLines() throws IOException {
        write("a.py", "import os\nx = 1\ny = 2\n");
        write("b.py", "print('hi')\n");
        write("web/app.ts", "a\nb\nc\nd\ne\n");
        write("README", "no extension\n");
        write("node_modules/lib/index.js", "ignored\n");
        write(".git/config", "ignored\n");

        LanguageMap languages = new LanguageDetector(new LocalSourceAccessAdapter(new ArtifactorProperties()))
                .detect(root);

        assertEquals(List.of("typescript", "python"),
                languages.languages().stream().map(LanguageInfo::name).toList());
        assertEquals("typescript", languages.primaryLanguage());
        assertEquals(3, languages.totalFiles());
        LanguageInfo python = languages.languages().get(1);
        assertEquals(2, python.fileCount());
        assertEquals(4, python.lineCount());
        assertEquals(List.of(".py"), python.extensions());
        assertFalse(languages.contains("javascript"));
    }

    @Test
    void shouldReturnEmptyMapForEmptyTree() {
        LanguageMap languages = new LanguageDetector(new LocalSourceAccessAdapter(new ArtifactorProperties()))
                .detect(root);

        assertTrue(languages.languages().isEmpty());
        assertNull(languages.primaryLanguage());
    }

    @Test
    void shouldResolveLanguageFromExtension() {
        assertEquals(Optional.of("java"), LanguageDetector.languageOf("src/Main.java"));
        assertEquals(Optional.of("typescript"), LanguageDetector.languageOf("ui/App.TSX"));
        assertEquals(Optional.empty(), LanguageDetector.languageOf("my.dir/Makefile"));
        assertEquals(Optional.empty(), LanguageDetector.languageOf("image.png"));
    }

    private void write(String relative, String content) throws IOException {
        Path file = root.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
    }
}
