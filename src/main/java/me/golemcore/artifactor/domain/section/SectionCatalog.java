package me.golemcore.artifactor.domain.section;

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

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Known documentation sections with their titles and generation instructions.
 */
public final class SectionCatalog {

    private static final Map<String, String> TITLES = new LinkedHashMap<>();
    private static final Map<String, String> INSTRUCTIONS = new LinkedHashMap<>();

    static {
        register("executive_overview", "Executive Overview",
                "Summarize what the system is for, who uses it and its main capabilities for a non-technical reader.");
        register("features", "Main Application Features",
                "List the user-facing features grouped by area under a '## Feature Areas' heading.");
        register("personas", "User Personas",
                "Describe the kinds of users the system serves, their goals and how they interact with it.");
        register("user_stories", "User Stories",
                "Write user stories in the form 'As a <role>, I want <goal> so that <benefit>' with acceptance"
                        + " criteria.");
        register("security_requirements", "Security Requirements",
                "Derive the security requirements the code enforces: authentication, authorization, validation.");
        register("system_overview", "System Overview",
                "Describe the architecture, its components and their interactions. Include an"
                        + " '## Architecture Diagram' heading with a mermaid diagram.");
        register("data_models", "Data Models",
                "Document the data structures and their fields as markdown tables.");
        register("interfaces", "Interface Specifications",
                "Document the internal module interfaces and the contracts between components.");
        register("ui_specs", "UI Specifications",
                "Describe the user interface screens and interactions the code implies, if any.");
        register("api_specs", "API Specifications",
                "Document each HTTP endpoint with its method, path and purpose as markdown tables.");
        register("integrations", "Integration Points",
                "List external systems, libraries and services the code integrates with.");
        register("tech_stories", "Technical User Stories",
                "Write technical stories for engineers maintaining the system, with acceptance criteria.");
        register("security_considerations", "Security Considerations",
                "Assess security risks visible in the code. End with a '## Coverage Summary' heading.");
    }

    private SectionCatalog() {
    }

    private static void register(String name, String title, String instruction) {
        TITLES.put(name, title);
        INSTRUCTIONS.put(name, instruction);
    }

    public static boolean isKnown(String sectionName) {
        return TITLES.containsKey(sectionName);
    }

    /**
     * Title of a section; unknown names are title-cased.
     */
    public static String title(String sectionName) {
        String title = TITLES.get(sectionName);
        if (title != null) {
            return title;
        }
        return Arrays.stream(sectionName.split("_"))
                .filter(word -> !word.isEmpty())
                .map(word -> word.substring(0, 1).toUpperCase(Locale.ROOT) + word.substring(1))
                .collect(Collectors.joining(" "));
    }

    public static String systemPrompt(String sectionName) {
        return "You are a technical writer producing the \"" + title(sectionName) + "\" section of a software"
                + " documentation set from analysis data.\n"
                + INSTRUCTIONS.getOrDefault(sectionName, "Document this aspect of the codebase.") + "\n"
                + "Write GitHub-flavored markdown starting with '# " + title(sectionName) + "'."
                + " Only state what the context supports and never leave template placeholders.";
    }
}
