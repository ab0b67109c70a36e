package com.tooldigest.research.repository;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.tooldigest.research.exception.CatalogException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;

/**
 * A JSON array in a file. Writes go to a sibling temp file that is then moved into place,
 * so a crash mid-write leaves the previous content intact.
 */
@Slf4j
class JsonFileStore<T> {

    private final Path path;
    private final ObjectMapper objectMapper;
    private final JavaType listType;

    JsonFileStore(Path path, ObjectMapper objectMapper, Class<T> elementType) {
        this.path = path;
        this.objectMapper = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
        this.listType = objectMapper.getTypeFactory().constructCollectionType(List.class, elementType);
    }

    synchronized List<T> readAll() {
        if (!Files.exists(path)) {
            return new ArrayList<>();
        }
        try {
            if (Files.size(path) == 0) {
                return new ArrayList<>();
            }
            List<T> items = objectMapper.readValue(path.toFile(), listType);
            return items == null ? new ArrayList<>() : new ArrayList<>(items);
        } catch (IOException e) {
            throw new CatalogException("Failed to read " + path + ": " + e.getMessage(), e);
        }
    }

    synchronized void writeAll(List<T> items) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path temp = path.resolveSibling(path.getFileName() + ".tmp");
            objectMapper.writeValue(temp.toFile(), items);
            try {
                Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
            }
            log.debug("Wrote {} entries to {}", items.size(), path);
        } catch (IOException e) {
            throw new CatalogException("Failed to write " + path + ": " + e.getMessage(), e);
        }
    }
}
