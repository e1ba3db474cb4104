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

import me.golemcore.artifactor.domain.model.analysis.ApiEndpoints;
import me.golemcore.artifactor.domain.model.analysis.ParsedFile;
import me.golemcore.artifactor.domain.model.analysis.ParsedSources;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Detects HTTP route declarations: decorator and router styles
 * ({@code @app.get("/x")}, {@code router.post('/x')}) and Spring mapping
 * annotations.
 */
@Component
public class ApiEndpointExtractor implements StructureExtractor<ApiEndpoints> {

    private static final Pattern ROUTER = Pattern.compile(
            "@?\\b\\w+\\.(get|post|put|delete|patch)\\(\\s*['\"](/[^'\"]*)['\"]", Pattern.CASE_INSENSITIVE);
    private static final Pattern SPRING = Pattern.compile(
            "@(Get|Post|Put|Delete|Patch)Mapping(?:\\(\\s*(?:value\\s*=\\s*|path\\s*=\\s*)?\"([^\"]*)\")?");

    @Override
    public String getName() {
        return "api_endpoints";
    }

    @Override
    public ApiEndpoints extract(ParsedSources sources) {
        List<ApiEndpoints.Endpoint> endpoints = new ArrayList<>();
        for (ParsedFile file : sources.files()) {
            List<String> lines = file.lines();
            for (int i = 0; i < lines.size(); i++) {
                String line = lines.get(i);
                Matcher router = ROUTER.matcher(line);
                if (router.find()) {
                    endpoints.add(new ApiEndpoints.Endpoint(router.group(1).toUpperCase(Locale.ROOT), router.group(2),
                            file.filePath(), i + 1));
                    continue;
                }
                Matcher spring = SPRING.matcher(line);
                if (spring.find()) {
                    String path = spring.group(2) != null ? spring.group(2) : "";
                    endpoints.add(new ApiEndpoints.Endpoint(spring.group(1).toUpperCase(Locale.ROOT), path,
                            file.filePath(), i + 1));
                }
            }
        }
        return new ApiEndpoints(endpoints);
    }

    @Override
    public ApiEndpoints emptyResult() {
        return ApiEndpoints.empty();
    }
}
