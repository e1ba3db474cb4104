package me.golemcore.artifactor.domain.model;

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

/**
 * Reference from a generated claim to a source location. Line bounds are not
 * checked here; a citation becomes trustworthy only after verification against
 * the source tree.
 *
 * @param filePath
 *            path relative to the project root
 * @param functionName
 *            optional symbol name
 * @param lineStart
 *            first cited line, 1-based
 * @param lineEnd
 *            last cited line, inclusive
 * @param confidence
 *            confidence of the claim this citation supports
 */
public record Citation(String filePath, String functionName, int lineStart, int lineEnd, double confidence) {

    public static Citation of(String filePath, int lineStart, int lineEnd) {
        return new Citation(filePath, null, lineStart, lineEnd, 1.0);
    }

    public String location() {
        return filePath + ":" + lineStart;
    }
}
