package com.tooldigest.research.exception;

import lombok.Getter;

/**
 * Base exception for the research service.
 */
@Getter
public class ResearchException extends RuntimeException {

    private final String errorCode;

    public ResearchException(String message) {
        super(message);
        this.errorCode = "RESEARCH_ERROR";
    }

    public ResearchException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public ResearchException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
