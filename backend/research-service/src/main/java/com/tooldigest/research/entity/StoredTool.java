package com.tooldigest.research.entity;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.tooldigest.research.dto.SentimentSummary;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Tool catalog entry as persisted in tools.json.
 *
 * Other catalog clients write fields this service does not model (stars, version,
 * usageNiche, ...). Those are kept in {@link #additionalFields} so a load/save
 * cycle never drops them.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class StoredTool {

    private Long id;

    private String title;

    private String description;

    private String category;

    private String url;

    private List<String> features;

    private Double confidence;

    // ========== Validation ==========

    private Double qualityScore;

    private String qualityReason;

    // ========== Discovery provenance ==========

    /**
     * ISO-8601 instant the tool was first discovered
     */
    private String discoveredAt;

    private String discoveryQuery;

    /**
     * Search provider that served the discovery query (tavily, duckduckgo)
     */
    private String searchProvider;

    /**
     * When the research session was conducted
     */
    private String searchTimestamp;

    // ========== Sentiment ==========

    /**
     * positive | neutral | negative | unknown
     */
    private String publicSentiment;

    private SentimentSummary sentimentSummary;

    private String sentimentAnalyzedAt;

    private List<SentimentSource> sentimentSources;

    // ========== GitHub ==========

    private Integer githubStars;

    private String githubUrl;

    private String githubLastPushed;

    private Long githubDaysAgo;

    @Builder.Default
    private Map<String, Object> additionalFields = new LinkedHashMap<>();

    @JsonAnySetter
    public void setAdditionalField(String name, Object value) {
        if (additionalFields == null) {
            additionalFields = new LinkedHashMap<>();
        }
        additionalFields.put(name, value);
    }

    @JsonAnyGetter
    public Map<String, Object> getAdditionalFields() {
        return additionalFields;
    }

    /**
     * Source article used for sentiment analysis.
     */
    public record SentimentSource(String title, String url) {
    }
}
