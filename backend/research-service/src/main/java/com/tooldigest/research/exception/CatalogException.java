package com.tooldigest.research.exception;

/**
 * Reading or writing a JSON store failed. Fatal for the research run that hit it.
 */
public class CatalogException extends ResearchException {

    public CatalogException(String message, Throwable cause) {
        super("CATALOG_IO", message, cause);
    }
}
