package com.tooldigest.research.service.pipeline;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * One element of the extraction reply array. Fields are loosely typed; the model
 * is not trusted to fill them.
 */
record ExtractedToolPayload(
        String title,
        String description,
        String url,
        String category,
        List<String> features,
        Double confidence,
        @JsonProperty("source_url") String sourceUrl
) {
}
