package com.tooldigest.research.exception;

import lombok.Getter;

@Getter
public class ResearchAlreadyRunningException extends ResearchException {

    private final String runId;

    public ResearchAlreadyRunningException(String runId) {
        super("ALREADY_RUNNING", "Research is already running (run " + runId + ")");
        this.runId = runId;
    }
}
