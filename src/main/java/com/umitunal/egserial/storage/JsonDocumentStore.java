package com.umitunal.egserial.storage;

import com.umitunal.egserial.coercion.CoercionRegistry;
import com.umitunal.egserial.config.SerializationConfig;
import com.umitunal.egserial.core.TypedSerializer;
import com.umitunal.egserial.serialization.JacksonTypedSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Reads and writes whole JSON documents as files named
 * {@code <name>.<extension>}.
 *
 * Writes create the target directory when missing and overwrite existing
 * files. All operations block the calling thread.
 */
public class JsonDocumentStore {
    private static final Logger log = LoggerFactory.getLogger(JsonDocumentStore.class);

    private final TypedSerializer serializer;
    private final SerializationConfig config;

    public JsonDocumentStore() {
        this(CoercionRegistry.standard(), SerializationConfig.defaults());
    }

    public JsonDocumentStore(CoercionRegistry registry, SerializationConfig config) {
        this(new JacksonTypedSerializer(registry, config), config);
    }

    public JsonDocumentStore(TypedSerializer serializer, SerializationConfig config) {
        this.serializer = serializer;
        this.config = config;
    }

    /**
     * Build {@code <targetDir>/<fileName>.<configured extension>}.
     */
    public Path constructPath(String fileName, Path targetDir) {
        return constructPath(fileName, targetDir, config.getFileExtension());
    }

    public Path constructPath(String fileName, Path targetDir, String extension) {
        return targetDir.resolve(fileName + "." + extension);
    }

    /**
     * Serialize a value to {@code <targetDir>/<fileName>.json}.
     *
     * @return the path written
     */
    public Path toFile(Object value, String fileName, Path targetDir) throws IOException {
        if (Files.notExists(targetDir)) {
            Files.createDirectories(targetDir);
            log.debug("Created directory {}", targetDir);
        }

        Path path = constructPath(fileName, targetDir);
        try (Writer writer = Files.newBufferedWriter(path, config.getCharset())) {
            serializer.toWriter(value, writer);
        }
        log.debug("Wrote {} to {}", value == null ? "null" : value.getClass().getSimpleName(), path);
        return path;
    }

    /**
     * Deserialize a JSON file as the given type.
     */
    public <T> T fromFile(Class<T> type, Path path) throws IOException {
        log.debug("Reading {} from {}", type.getSimpleName(), path);
        try (Reader reader = Files.newBufferedReader(path, config.getCharset())) {
            return serializer.fromReader(type, reader);
        }
    }

    /**
     * Deserialize an open reader as the given type. The reader is not closed.
     */
    public <T> T fromReader(Class<T> type, Reader reader) throws IOException {
        return serializer.fromReader(type, reader);
    }

    /**
     * Deserialize a JSON file holding an array, one element per value.
     */
    public <T> List<T> fromListInFile(Class<T> elementType, Path path) throws IOException {
        log.debug("Reading list of {} from {}", elementType.getSimpleName(), path);
        try (Reader reader = Files.newBufferedReader(path, config.getCharset())) {
            return serializer.listFromReader(elementType, reader);
        }
    }

    /**
     * Deserialize an open reader holding an array. The reader is not closed.
     */
    public <T> List<T> fromListInReader(Class<T> elementType, Reader reader) throws IOException {
        return serializer.listFromReader(elementType, reader);
    }
}
