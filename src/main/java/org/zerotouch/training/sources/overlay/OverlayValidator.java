package org.zerotouch.training.sources.overlay;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.zerotouch.training.sources.MalformedSourceException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.Set;

/**
 * Validates overlay YAML files against {@code schemas/overlay_schema.json}.
 * Loading does not run this check; callers decide what to do with the messages.
 */
public class OverlayValidator {
    private static final Logger log = LoggerFactory.getLogger(OverlayValidator.class);

    private static final String SCHEMA_RESOURCE_PATH = "schemas/overlay_schema.json";
    private static final ObjectMapper mapper = new ObjectMapper();
    private static final JsonSchemaFactory factory =
            JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012);

    /**
     * Validates one overlay file.
     *
     * @param overlayPath path to the overlay YAML file
     * @return validation messages, empty if the file is valid or empty
     * @throws MalformedSourceException if the file is not valid YAML
     * @throws IOException               if the file or the schema cannot be read
     */
    public static Set<ValidationMessage> validate(Path overlayPath) throws IOException {
        JsonNode overlayNode;
        try {
            overlayNode = OverlayAssembler.YAML_MAPPER.readTree(overlayPath.toFile());
        } catch (JsonProcessingException e) {
            throw new MalformedSourceException("Malformed overlay " + overlayPath + ": " + e.getOriginalMessage(),
                    overlayPath.toString(), e);
        }
        if (overlayNode == null || overlayNode.isMissingNode() || overlayNode.isNull()) {
            return Set.of();
        }

        Set<ValidationMessage> result = loadSchema().validate(overlayNode);
        if (result.isEmpty()) {
            log.debug("Overlay {} is valid", overlayPath);
        } else {
            result.forEach(message -> log.warn("Overlay {}: {}", overlayPath, message.getMessage()));
        }
        return result;
    }

    private static JsonSchema loadSchema() throws IOException {
        try (InputStream schemaStream = OverlayValidator.class.getClassLoader()
                .getResourceAsStream(SCHEMA_RESOURCE_PATH)) {
            if (schemaStream == null) {
                throw new IllegalArgumentException("Schema resource not found: " + SCHEMA_RESOURCE_PATH);
            }
            JsonNode schemaNode = mapper.readTree(schemaStream);
            return factory.getSchema(schemaNode);
        }
    }
}
