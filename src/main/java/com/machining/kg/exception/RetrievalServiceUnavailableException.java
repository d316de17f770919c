package com.machining.kg.exception;

import lombok.Getter;

import java.util.Map;

/**
 * The embedding or generation service failed, timed out or is not configured.
 */
@Getter
public class RetrievalServiceUnavailableException extends MachiningKgException {

    public enum Service {
        EMBEDDING,
        GENERATION
    }

    private final Service service;

    public RetrievalServiceUnavailableException(Service service, String message) {
        this(service, message, null);
    }

    public RetrievalServiceUnavailableException(Service service, String message, Throwable cause) {
        super(ErrorCode.RETRIEVAL_SERVICE_UNAVAILABLE, message, Map.of("service", service.name()), cause);
        this.service = service;
    }
}
