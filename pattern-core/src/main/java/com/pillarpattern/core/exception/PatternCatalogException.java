package com.pillarpattern.core.exception;

public class PatternCatalogException extends PatternEngineException {
    private final String resource;

    public PatternCatalogException(String resource, String message) {
        super("[" + resource + "] " + message);
        this.resource = resource;
    }

    public PatternCatalogException(String resource, String message, Throwable cause) {
        super("[" + resource + "] " + message, cause);
        this.resource = resource;
    }

    public String getResource() {
        return resource;
    }
}
