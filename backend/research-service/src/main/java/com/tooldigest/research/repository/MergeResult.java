package com.tooldigest.research.repository;

import com.tooldigest.research.entity.StoredTool;

import java.util.List;

public record MergeResult(List<StoredTool> added, int skipped, int catalogSize) {

    public MergeResult {
        added = added == null ? List.of() : List.copyOf(added);
    }

    public int addedCount() {
        return added.size();
    }
}
