package com.tooldigest.research.dto;

public record ResearchStartResponse(String status, String runId) {

    public static ResearchStartResponse started(String runId) {
        return new ResearchStartResponse("started", runId);
    }
}
