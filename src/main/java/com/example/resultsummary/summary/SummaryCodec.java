package com.example.resultsummary.summary;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.module.SimpleModule;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Map;

/**
 * Reads and writes directory summaries as JSON.
 *
 * <p>Node keys start with {@code /} so they cannot collide with file names, and are kept short to
 * keep summary files small:
 * <pre>
 * {"": {"/S": 7948, "/D": {"control": {"/S": 734}, "debug": {"/S": 7214, "/D": {...}}}}}
 * </pre>
 */
public final class SummaryCodec {
    public static final String ORIGINAL_SIZE_BYTES = "/S";
    public static final String TRIMMED_SIZE_BYTES = "/T";
    public static final String COLLECTED_SIZE_BYTES = "/C";
    public static final String DIRS = "/D";

    private final ObjectMapper mapper;

    public SummaryCodec() {
        this(new ObjectMapper());
    }

    public SummaryCodec(ObjectMapper mapper) {
        this.mapper = mapper.copy().registerModule(module());
    }

    /**
     * Jackson module that maps {@link DirectorySummary} to and from the summary JSON format.
     */
    public static SimpleModule module() {
        SimpleModule module = new SimpleModule("directory-summary");
        module.addSerializer(DirectorySummary.class, new SummarySerializer());
        module.addDeserializer(DirectorySummary.class, new SummaryDeserializer());
        return module;
    }

    public String toJson(DirectorySummary summary) throws IOException {
        return mapper.writeValueAsString(summary);
    }

    public DirectorySummary fromJson(String json) throws IOException {
        return mapper.readValue(json, DirectorySummary.class);
    }

    public DirectorySummary read(Path file) throws IOException {
        return mapper.readValue(file.toFile(), DirectorySummary.class);
    }

    public void write(DirectorySummary summary, Path file) throws IOException {
        Files.createDirectories(file.toAbsolutePath().getParent());
        mapper.writeValue(file.toFile(), summary);
    }

    private static final class SummarySerializer extends JsonSerializer<DirectorySummary> {
        @Override
        public void serialize(DirectorySummary summary, JsonGenerator gen, SerializerProvider provider) throws IOException {
            gen.writeStartObject();
            for (Map.Entry<String, SummaryNode> entry : summary.entries().entrySet()) {
                gen.writeFieldName(entry.getKey());
                writeNode(entry.getValue(), gen);
            }
            gen.writeEndObject();
        }

        private void writeNode(SummaryNode node, JsonGenerator gen) throws IOException {
            gen.writeStartObject();
            gen.writeNumberField(ORIGINAL_SIZE_BYTES, node.originalSize());
            if (node.hasTrimmedSize()) {
                gen.writeNumberField(TRIMMED_SIZE_BYTES, node.trimmedSize());
            }
            if (node.hasCollectedSize()) {
                gen.writeNumberField(COLLECTED_SIZE_BYTES, node.collectedSize());
            }
            if (node instanceof DirectoryNode) {
                gen.writeObjectFieldStart(DIRS);
                for (Map.Entry<String, SummaryNode> child : ((DirectoryNode) node).children().entrySet()) {
                    gen.writeFieldName(child.getKey());
                    writeNode(child.getValue(), gen);
                }
                gen.writeEndObject();
            }
            gen.writeEndObject();
        }
    }

    private static final class SummaryDeserializer extends JsonDeserializer<DirectorySummary> {
        @Override
        public DirectorySummary deserialize(JsonParser parser, DeserializationContext ctxt) throws IOException {
            JsonNode tree = parser.getCodec().readTree(parser);
            if (tree == null || !tree.isObject()) {
                return ctxt.reportInputMismatch(DirectorySummary.class, "Directory summary must be a JSON object");
            }
            DirectorySummary summary = DirectorySummary.empty();
            Iterator<Map.Entry<String, JsonNode>> fields = tree.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                if (!DirectorySummary.ROOT_NAME.equals(field.getKey())) {
                    return ctxt.reportInputMismatch(DirectorySummary.class,
                            "Directory summary may only hold the root entry \"%s\", got '%s'",
                            DirectorySummary.ROOT_NAME, field.getKey());
                }
                summary.entries().put(field.getKey(), readNode(field.getKey(), field.getValue(), ctxt));
            }
            return summary;
        }

        @Override
        public DirectorySummary getNullValue(DeserializationContext ctxt) throws JsonMappingException {
            return ctxt.reportInputMismatch(DirectorySummary.class, "Directory summary must not be null");
        }

        private SummaryNode readNode(String name, JsonNode json, DeserializationContext ctxt) throws IOException {
            if (!json.isObject()) {
                return ctxt.reportInputMismatch(DirectorySummary.class, "Entry '%s' must be a JSON object", name);
            }
            JsonNode original = json.get(ORIGINAL_SIZE_BYTES);
            if (original == null) {
                return ctxt.reportInputMismatch(DirectorySummary.class, "Entry '%s' has no %s size", name, ORIGINAL_SIZE_BYTES);
            }
            long originalSize = readSize(name, ORIGINAL_SIZE_BYTES, original, ctxt);
            Long trimmedSize = optionalSize(name, TRIMMED_SIZE_BYTES, json, ctxt);
            Long collectedSize = optionalSize(name, COLLECTED_SIZE_BYTES, json, ctxt);

            JsonNode dirs = json.get(DIRS);
            if (dirs == null) {
                return new FileNode(originalSize, trimmedSize, collectedSize);
            }
            if (!dirs.isObject()) {
                return ctxt.reportInputMismatch(DirectorySummary.class, "Children of '%s' must be a JSON object", name);
            }
            DirectoryNode directory = new DirectoryNode(originalSize, trimmedSize, collectedSize);
            Iterator<Map.Entry<String, JsonNode>> children = dirs.fields();
            while (children.hasNext()) {
                Map.Entry<String, JsonNode> child = children.next();
                directory.put(child.getKey(), readNode(child.getKey(), child.getValue(), ctxt));
            }
            return directory;
        }

        private Long optionalSize(String name, String key, JsonNode json, DeserializationContext ctxt) throws IOException {
            JsonNode value = json.get(key);
            return value == null || value.isNull() ? null : readSize(name, key, value, ctxt);
        }

        private long readSize(String name, String key, JsonNode value, DeserializationContext ctxt) throws IOException {
            if (!value.isIntegralNumber() || !value.canConvertToLong() || value.asLong() < 0) {
                return ctxt.<Long>reportInputMismatch(DirectorySummary.class,
                        "Size %s of '%s' must be a non-negative integer, got %s", key, name, value);
            }
            return value.asLong();
        }
    }
}
