package me.golemcore.artifactor.domain.analysis;

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

import me.golemcore.artifactor.domain.model.analysis.CodeEntity;
import me.golemcore.artifactor.domain.model.analysis.EntityType;
import me.golemcore.artifactor.domain.model.analysis.ParsedFile;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Line-oriented declaration scanner. Recognizes class and function headers and
 * import statements for the common languages; an entity ends where the next
 * entity of the same file starts.
 */
@Component
public class RegexSourceParser implements SourceParser {

    private static final Pattern CLASS = Pattern.compile(
            "^\\s*(?:export\\s+)?(?:(?:public|private|protected|abstract|final|static|sealed|data|open)\\s+)*"
                    + "(?:class|interface|enum|record|struct|trait)\\s+([A-Za-z_][A-Za-z0-9_]*)");
    private static final Pattern PYTHON_FUNCTION = Pattern.compile(
            "^\\s*(?:async\\s+)?def\\s+([A-Za-z_][A-Za-z0-9_]*)\\s*\\(");
    private static final Pattern JS_FUNCTION = Pattern.compile(
            "^\\s*(?:export\\s+)?(?:default\\s+)?(?:async\\s+)?function\\s*\\*?\\s*([A-Za-z_$][A-Za-z0-9_$]*)\\s*\\(");
    private static final Pattern GO_FUNCTION = Pattern.compile(
            "^func\\s+(?:\\([^)]*\\)\\s*)?([A-Za-z_][A-Za-z0-9_]*)\\s*\\(");
    private static final Pattern RUST_FUNCTION = Pattern.compile(
            "^\\s*(?:pub(?:\\([^)]*\\))?\\s+)?(?:async\\s+)?fn\\s+([A-Za-z_][A-Za-z0-9_]*)");
    private static final Pattern JVM_METHOD = Pattern.compile(
            "^\\s*(?:(?:public|private|protected|static|final|abstract|synchronized|override|suspend)\\s+)+"
                    + "(?:<[^>]+>\\s*)?(?:fun\\s+)?(?:[A-Za-z0-9_<>\\[\\],.?\\s]+\\s+)?"
                    + "([a-zA-Z_][A-Za-z0-9_]*)\\s*\\(");

    private static final Map<String, Pattern> IMPORTS = Map.of(
            "python", Pattern.compile("^\\s*(?:from\\s+([\\w.]+)\\s+import|import\\s+([\\w.]+))"),
            "java", Pattern.compile("^\\s*import\\s+(?:static\\s+)?([\\w.*]+)\\s*;"),
            "kotlin", Pattern.compile("^\\s*import\\s+([\\w.*]+)"),
            "javascript", Pattern.compile("(?:from\\s+|require\\()\\s*['\"]([^'\"]+)['\"]"),
            "typescript", Pattern.compile("(?:from\\s+|require\\()\\s*['\"]([^'\"]+)['\"]"),
            "go", Pattern.compile("^\\s*(?:import\\s+)?(?:\\w+\\s+)?\"([^\"]+)\"\\s*$"),
            "rust", Pattern.compile("^\\s*use\\s+([\\w:]+)"));

    @Override
    public ParsedFile parse(String filePath, String language, List<String> lines) {
        List<int[]> starts = new ArrayList<>();
        List<String> names = new ArrayList<>();
        List<EntityType> types = new ArrayList<>();
        List<String> imports = new ArrayList<>();
        Pattern importPattern = IMPORTS.get(language);

        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            Matcher classMatcher = CLASS.matcher(line);
            if (classMatcher.find()) {
                starts.add(new int[] { i + 1 });
                names.add(classMatcher.group(1));
                types.add(EntityType.CLASS);
                continue;
            }
            String function = matchFunction(language, line);
            if (function != null) {
                starts.add(new int[] { i + 1 });
                names.add(function);
                types.add(EntityType.FUNCTION);
                continue;
            }
            if (importPattern != null) {
                Matcher importMatcher = importPattern.matcher(line);
                if (importMatcher.find()) {
                    imports.add(importMatcher.group(1) != null ? importMatcher.group(1) : importMatcher.group(2));
                }
            }
        }

        List<CodeEntity> entities = new ArrayList<>(names.size());
        for (int i = 0; i < names.size(); i++) {
            int start = starts.get(i)[0];
            int end = i + 1 < names.size() ? Math.max(start, starts.get(i + 1)[0] - 1) : Math.max(start, lines.size());
            entities.add(new CodeEntity(names.get(i), types.get(i), filePath, start, end));
        }
        return new ParsedFile(filePath, language, lines, entities, imports);
    }

    private static String matchFunction(String language, String line) {
        Pattern pattern = switch (language) {
        case "python" -> PYTHON_FUNCTION;
        case "javascript", "typescript" -> JS_FUNCTION;
        case "go" -> GO_FUNCTION;
        case "rust" -> RUST_FUNCTION;
        case "java", "kotlin", "c_sharp" -> JVM_METHOD;
        default -> null;
        };
        if (pattern == null) {
            return null;
        }
        Matcher matcher = pattern.matcher(line);
        if (!matcher.find()) {
            return null;
        }
        String name = matcher.group(1);
        return isKeyword(name) ? null : name;
    }

    private static boolean isKeyword(String name) {
        return switch (name) {
        case "if", "for", "while", "switch", "catch", "return", "new", "else" -> true;
        default -> false;
        };
    }
}
