package com.tooldigest.research.exception;

public class ModelClientException extends ResearchException {

    public ModelClientException(String message) {
        super("MODEL_ERROR", message);
    }

    public ModelClientException(String message, Throwable cause) {
        super("MODEL_ERROR", message, cause);
    }

    public static ModelClientException emptyResponse(String provider) {
        return new ModelClientException(provider + " returned no text content");
    }

    public static ModelClientException notConfigured(String provider) {
        return new ModelClientException(provider + " API key is not configured");
    }
}
