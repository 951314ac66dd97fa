package com.umitunal.egserial.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.exc.StreamReadException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.core.util.Separators;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.exc.InvalidDefinitionException;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.umitunal.egserial.coercion.CoercionModule;
import com.umitunal.egserial.coercion.CoercionRegistry;
import com.umitunal.egserial.config.SerializationConfig;
import com.umitunal.egserial.core.TypedSerializer;
import com.umitunal.egserial.exception.DocumentMappingException;
import com.umitunal.egserial.exception.MalformedJsonException;
import com.umitunal.egserial.exception.SerializationException;
import com.umitunal.egserial.exception.UnsupportedTypeException;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.util.ArrayList;
import java.util.List;

/**
 * Jackson-backed {@link TypedSerializer}.
 *
 * Reading happens in two steps: the text is parsed to a tree first, so
 * syntax errors are reported as {@link MalformedJsonException} no matter
 * what the target type is, then the tree is mapped to the target type.
 *
 * Instances are immutable and safe to share between threads.
 */
public class JacksonTypedSerializer implements TypedSerializer {
    private final ObjectMapper mapper;
    private final ObjectWriter writer;

    public JacksonTypedSerializer() {
        this(CoercionRegistry.standard(), SerializationConfig.defaults());
    }

    public JacksonTypedSerializer(CoercionRegistry registry) {
        this(registry, SerializationConfig.defaults());
    }

    public JacksonTypedSerializer(CoercionRegistry registry, SerializationConfig config) {
        this.mapper = createMapper(registry, config);
        this.writer = mapper.writer(createPrettyPrinter(config.getIndentWidth()));
    }

    @Override
    public String toRaw(Object value) {
        try {
            return writer.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw translateWrite(value, e);
        }
    }

    @Override
    public void toWriter(Object value, Writer out) throws IOException {
        try {
            writer.writeValue(out, value);
        } catch (JsonProcessingException e) {
            throw translateWrite(value, e);
        }
    }

    @Override
    public <T> T fromRaw(Class<T> type, String raw) {
        return map(parse(raw), mapper.constructType(type));
    }

    @Override
    public <T> T fromRaw(TypeReference<T> type, String raw) {
        return map(parse(raw), mapper.getTypeFactory().constructType(type));
    }

    @Override
    public <T> T fromReader(Class<T> type, Reader reader) throws IOException {
        return map(parse(reader), mapper.constructType(type));
    }

    @Override
    public <T> List<T> listFromReader(Class<T> elementType, Reader reader) throws IOException {
        JsonNode tree = parse(reader);
        if (!tree.isArray()) {
            throw new DocumentMappingException("Expected a JSON array of " + elementType.getSimpleName()
                    + " but found " + tree.getNodeType());
        }

        JavaType javaType = mapper.constructType(elementType);
        List<T> items = new ArrayList<>(tree.size());
        for (int i = 0; i < tree.size(); i++) {
            try {
                items.add(map(tree.get(i), javaType));
            } catch (DocumentMappingException e) {
                throw new DocumentMappingException("Array element " + i + ": " + e.getMessage(), e);
            }
        }
        return items;
    }

    private JsonNode parse(String raw) {
        if (raw == null) {
            throw new MalformedJsonException("No JSON content", null);
        }
        try {
            return requireContent(mapper.readTree(raw));
        } catch (JsonProcessingException e) {
            throw new MalformedJsonException("Malformed JSON: " + e.getOriginalMessage(), e);
        }
    }

    private JsonNode parse(Reader reader) throws IOException {
        try {
            return requireContent(mapper.readTree(reader));
        } catch (JsonProcessingException e) {
            throw new MalformedJsonException("Malformed JSON: " + e.getOriginalMessage(), e);
        }
    }

    private static JsonNode requireContent(JsonNode tree) {
        if (tree == null || tree.isMissingNode()) {
            throw new MalformedJsonException("No JSON content", null);
        }
        return tree;
    }

    private <T> T map(JsonNode tree, JavaType type) {
        try {
            return mapper.treeToValue(tree, type);
        } catch (InvalidDefinitionException e) {
            throw new UnsupportedTypeException("No JSON mapping for " + describe(e, type) + ": "
                    + e.getOriginalMessage(), e);
        } catch (StreamReadException e) {
            throw new MalformedJsonException("Malformed JSON: " + e.getOriginalMessage(), e);
        } catch (JsonProcessingException e) {
            throw new DocumentMappingException("Cannot read " + type.getRawClass().getSimpleName()
                    + ": " + e.getOriginalMessage(), e);
        }
    }

    private static SerializationException translateWrite(Object value, JsonProcessingException e) {
        String typeName = value == null ? "null" : value.getClass().getName();
        if (e instanceof InvalidDefinitionException) {
            return new UnsupportedTypeException("No JSON mapping for " + typeName + ": "
                    + e.getOriginalMessage(), e);
        }
        return new SerializationException("Failed to serialize " + typeName + ": " + e.getOriginalMessage(), e);
    }

    private static String describe(InvalidDefinitionException e, JavaType requested) {
        JavaType failing = e.getType();
        return failing != null ? failing.toString() : requested.toString();
    }

    private static ObjectMapper createMapper(CoercionRegistry registry, SerializationConfig config) {
        JsonMapper.Builder builder = JsonMapper.builder();
        if (config.isSnakeCaseProperties()) {
            builder.propertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
        }
        return builder
                .addModule(new CoercionModule(registry))
                .configure(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY, config.isSortProperties())
                .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, config.isSortProperties())
                .configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, true)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, config.isFailOnUnknownProperties())
                .configure(DeserializationFeature.FAIL_ON_TRAILING_TOKENS, true)
                // Callers own the readers and writers they pass in
                .configure(JsonParser.Feature.AUTO_CLOSE_SOURCE, false)
                .configure(JsonGenerator.Feature.AUTO_CLOSE_TARGET, false)
                .build();
    }

    private static DefaultPrettyPrinter createPrettyPrinter(int indentWidth) {
        DefaultIndenter indenter = new DefaultIndenter(" ".repeat(indentWidth), "\n");
        DefaultPrettyPrinter printer = new DefaultPrettyPrinter(Separators.createDefaultInstance()
                .withObjectFieldValueSpacing(Separators.Spacing.AFTER));
        printer.indentObjectsWith(indenter);
        printer.indentArraysWith(indenter);
        return printer;
    }
}
