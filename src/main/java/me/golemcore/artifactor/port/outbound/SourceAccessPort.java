package me.golemcore.artifactor.port.outbound;

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

import java.nio.file.Path;
import java.util.List;

/**
 * Port for read-only access to a project's source tree. All relative paths are
 * resolved against the given root; a path that escapes the root is treated as
 * nonexistent.
 */
public interface SourceAccessPort {

    /**
     * Check that the root exists and is a directory.
     */
    boolean isDirectory(Path root);

    /**
     * Check that a regular file exists under the root.
     */
    boolean fileExists(Path root, String relativePath);

    /**
     * Count the lines of a file.
     *
     * @throws java.io.UncheckedIOException
     *             if the file cannot be read
     */
    int countLines(Path root, String relativePath);

    /**
     * Read all lines of a file.
     *
     * @throws java.io.UncheckedIOException
     *             if the file cannot be read
     */
    List<String> readLines(Path root, String relativePath);

    /**
     * List regular text files under the root as sorted relative paths, skipping
     * hidden and excluded directories.
     */
    List<String> listFiles(Path root);
}
