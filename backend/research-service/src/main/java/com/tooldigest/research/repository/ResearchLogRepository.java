package com.tooldigest.research.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tooldigest.research.config.ResearchProperties;
import com.tooldigest.research.entity.ResearchLogEntry;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

import java.nio.file.Path;
import java.util.List;

/**
 * research_log.json: one entry per finished run, newest last, bounded length.
 */
@Repository
public class ResearchLogRepository {

    private final JsonFileStore<ResearchLogEntry> store;
    private final int limit;

    @Autowired
    public ResearchLogRepository(ResearchProperties properties, ObjectMapper objectMapper) {
        this(Path.of(properties.getCatalog().getLogPath()), objectMapper, properties.getCatalog().getLogLimit());
    }

    ResearchLogRepository(Path path, ObjectMapper objectMapper, int limit) {
        this.store = new JsonFileStore<>(path, objectMapper, ResearchLogEntry.class);
        this.limit = Math.max(1, limit);
    }

    public synchronized void append(ResearchLogEntry entry) {
        List<ResearchLogEntry> entries = store.readAll();
        entries.add(entry);
        if (entries.size() > limit) {
            entries = entries.subList(entries.size() - limit, entries.size());
        }
        store.writeAll(List.copyOf(entries));
    }

    public List<ResearchLogEntry> findAll() {
        return store.readAll();
    }
}
