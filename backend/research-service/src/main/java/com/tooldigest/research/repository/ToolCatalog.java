package com.tooldigest.research.repository;

import com.tooldigest.research.entity.StoredTool;

import java.util.List;

/**
 * Persisted tool catalog. Whole-list load and save only.
 *
 * @throws com.tooldigest.research.exception.CatalogException on IO failure
 */
public interface ToolCatalog {

    List<StoredTool> load();

    void save(List<StoredTool> tools);
}
