package me.golemcore.artifactor.adapter.outbound.source;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.artifactor.infrastructure.config.ArtifactorProperties;
import me.golemcore.artifactor.port.outbound.SourceAccessPort;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Reads project sources from the local filesystem. Relative paths that
 * resolve outside the root are treated as missing.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LocalSourceAccessAdapter implements SourceAccessPort {

    private final ArtifactorProperties properties;

    @Override
    public boolean isDirectory(Path root) {
        return root != null && Files.isDirectory(root);
    }

    @Override
    public boolean fileExists(Path root, String relativePath) {
        Path file = resolve(root, relativePath);
        return file != null && Files.isRegularFile(file);
    }

    @Override
    public int countLines(Path root, String relativePath) {
        return readLines(root, relativePath).size();
    }

    @Override
    public List<String> readLines(Path root, String relativePath) {
        Path file = resolve(root, relativePath);
        if (file == null) {
            throw new UncheckedIOException(new NoSuchFileException(relativePath, null, "outside of source root"));
        }
        try {
            String content = new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
            return content.lines().toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read file: " + relativePath, e);
        }
    }

    @Override
    public List<String> listFiles(Path root) {
        if (!isDirectory(root)) {
            return List.of();
        }
        Path normalizedRoot = root.toAbsolutePath().normalize();
        Set<String> skipped = new HashSet<>(properties.getAnalysis().getSkipDirectories());
        List<String> files = new ArrayList<>();
        try {
            Files.walkFileTree(normalizedRoot, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    if (dir.equals(normalizedRoot)) {
                        return FileVisitResult.CONTINUE;
                    }
                    String name = dir.getFileName().toString();
                    return name.startsWith(".") || skipped.contains(name)
                            ? FileVisitResult.SKIP_SUBTREE
                            : FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (attrs.isRegularFile() && !file.getFileName().toString().startsWith(".")) {
                        files.add(normalizedRoot.relativize(file).toString().replace('\\', '/'));
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException e) {
                    log.debug("[Source] Cannot access {}: {}", file, e.getMessage());
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list files under " + root, e);
        }
        Collections.sort(files);
        return files;
    }

    private static Path resolve(Path root, String relativePath) {
        if (root == null || relativePath == null) {
            return null;
        }
        Path normalizedRoot = root.toAbsolutePath().normalize();
        Path file = normalizedRoot.resolve(relativePath).normalize();
        return file.startsWith(normalizedRoot) ? file : null;
    }
}
