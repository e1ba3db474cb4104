package me.golemcore.artifactor.adapter.outbound.source;

import me.golemcore.artifactor.infrastructure.config.ArtifactorProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LocalSourceAccessAdapterTest {

    @TempDir
    Path root;

    private LocalSourceAccessAdapter adapter;

    @BeforeEach
    void setUp() throws IOException {
        adapter = new LocalSourceAccessAdapter(new ArtifactorProperties());
        write("app/main.py", "import os\n\nprint('hi')\n");
        write("app/util.py", "def helper():\n    pass\n");
        write("node_modules/lib/index.js", "module.exports = {};\n");
        write(".git/config", "[core]\n");
        write(".env", "SECRET=1\n");
    }

    @Test
    void shouldListFilesSkippingHiddenAndVendoredPaths() {
        List<String> files = adapter.listFiles(root);

        assertEquals(List.of("app/main.py", "app/util.py"), files);
    }

    @Test
    void shouldReturnEmptyListForMissingRoot() {
        assertTrue(adapter.listFiles(root.resolve("absent")).isEmpty());
        assertFalse(adapter.isDirectory(root.resolve("absent")));
    }

    @Test
    void shouldReadAndCountLines() {
        assertEquals(List.of("import os", "", "print('hi')"), adapter.readLines(root, "app/main.py"));
        assertEquals(3, adapter.countLines(root, "app/main.py"));
        assertTrue(adapter.fileExists(root, "app/util.py"));
        assertFalse(adapter.fileExists(root, "app/missing.py"));
    }

    @Test
    void shouldTreatPathsOutsideRootAsMissing() {
        assertFalse(adapter.fileExists(root, "../outside.txt"));
        assertThrows(UncheckedIOException.class, () -> adapter.readLines(root, "../../etc/passwd"));
    }

    private void write(String relativePath, String content) throws IOException {
        Path file = root.resolve(relativePath);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
    }
}
