package com.tooldigest.research.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Size;

import java.util.List;

public record ResearchStartRequest(
        @Size(max = 20, message = "At most 20 focus areas are allowed") List<String> focusAreas,
        @Min(value = 1, message = "maxTools must be at least 1")
        @Max(value = 50, message = "maxTools must be at most 50") Integer maxTools
) {
    public ResearchStartRequest {
        focusAreas = focusAreas == null ? List.of() : focusAreas.stream()
                .filter(area -> area != null && !area.isBlank())
                .map(String::trim)
                .toList();
    }
}
