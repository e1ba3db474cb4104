package me.golemcore.artifactor.domain.section;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import me.golemcore.artifactor.domain.exception.ArtifactorException;
import me.golemcore.artifactor.domain.model.analysis.ApiEndpoints;
import me.golemcore.artifactor.domain.model.analysis.IntelligenceModel;
import me.golemcore.artifactor.domain.model.analysis.LanguageInfo;
import me.golemcore.artifactor.domain.model.analysis.ModuleNarrative;
import me.golemcore.artifactor.domain.model.analysis.SchemaMap;
import me.golemcore.artifactor.domain.model.analysis.ValidatedEntity;
import org.springframework.stereotype.Component;

/**
 * Serializes the slice of the intelligence model a section prompt sees.
 */
@Component
@RequiredArgsConstructor
public class SectionContextBuilder {

    static final int MAX_ENTITIES = 30;
    static final int MAX_PURPOSES = 15;
    static final int MAX_ENDPOINTS = 30;
    static final int MAX_SCHEMAS = 20;

    private final ObjectMapper objectMapper;

    public record SectionContext(String prompt, int itemCount) {
    }

    public SectionContext build(IntelligenceModel model, String sectionName) {
        ObjectNode root = objectMapper.createObjectNode();
        int items = 0;

        ArrayNode languages = root.putArray("languages");
        for (LanguageInfo language : model.languages().languages()) {
            languages.addObject()
                    .put("name", language.name())
                    .put("files", language.fileCount())
                    .put("lines", language.lineCount());
        }

        ArrayNode entities = root.putArray("entities");
        for (ValidatedEntity entity : model.validation().entities()) {
            if (entities.size() >= MAX_ENTITIES) {
                break;
            }
            entities.addObject()
                    .put("name", entity.name())
                    .put("type", entity.type())
                    .put("file", entity.filePath())
                    .put("line", entity.line())
                    .put("confidence", entity.score().value());
        }
        items += entities.size();

        ArrayNode purposes = root.putArray("purposes");
        for (ModuleNarrative narrative : model.llmAnalysis().narratives()) {
            if (purposes.size() >= MAX_PURPOSES) {
                break;
            }
            if (narrative.isAvailable()) {
                ObjectNode purpose = purposes.addObject()
                        .put("file", narrative.filePath())
                        .put("statement", narrative.purpose());
                ArrayNode behaviors = purpose.putArray("behaviors");
                narrative.behaviors().forEach(behaviors::add);
            }
        }
        items += purposes.size();

        ArrayNode endpoints = root.putArray("endpoints");
        for (ApiEndpoints.Endpoint endpoint : model.staticAnalysis().endpoints().endpoints()) {
            if (endpoints.size() >= MAX_ENDPOINTS) {
                break;
            }
            endpoints.addObject()
                    .put("method", endpoint.method())
                    .put("path", endpoint.path())
                    .put("file", endpoint.filePath())
                    .put("line", endpoint.line());
        }
        items += endpoints.size();

        ArrayNode schemas = root.putArray("schemas");
        for (SchemaMap.Schema schema : model.staticAnalysis().schemas().schemas()) {
            if (schemas.size() >= MAX_SCHEMAS) {
                break;
            }
            ObjectNode node = schemas.addObject()
                    .put("name", schema.name())
                    .put("file", schema.filePath());
            ArrayNode fields = node.putArray("fields");
            schema.fields().forEach(fields::add);
        }
        items += schemas.size();

        try {
            String json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(root);
            String prompt = "<context>\n" + json + "\n</context>\n\nGenerate the "
                    + SectionCatalog.title(sectionName) + " section.";
            return new SectionContext(prompt, items);
        } catch (JsonProcessingException e) {
            throw new ArtifactorException("Failed to serialize section context for " + sectionName, e);
        }
    }
}
