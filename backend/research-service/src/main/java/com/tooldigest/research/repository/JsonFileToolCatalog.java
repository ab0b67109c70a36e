package com.tooldigest.research.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tooldigest.research.config.ResearchProperties;
import com.tooldigest.research.entity.StoredTool;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

import java.nio.file.Path;
import java.util.List;

@Repository
@Slf4j
public class JsonFileToolCatalog implements ToolCatalog {

    private final JsonFileStore<StoredTool> store;

    @Autowired
    public JsonFileToolCatalog(ResearchProperties properties, ObjectMapper objectMapper) {
        this(Path.of(properties.getCatalog().getPath()), objectMapper);
    }

    JsonFileToolCatalog(Path path, ObjectMapper objectMapper) {
        this.store = new JsonFileStore<>(path, objectMapper, StoredTool.class);
        log.info("Tool catalog at {}", path.toAbsolutePath());
    }

    @Override
    public List<StoredTool> load() {
        return store.readAll();
    }

    @Override
    public void save(List<StoredTool> tools) {
        store.writeAll(tools);
    }
}
