package com.machining.kg.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Error codes surfaced to callers of the pipeline.
 */
@Getter
public enum ErrorCode {

    SCHEMA_VIOLATION(HttpStatus.UNPROCESSABLE_ENTITY, "Source row does not match the table schema"),
    STORE_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE, "Graph store is unreachable"),
    INDEX_BUILD_FAILURE(HttpStatus.INTERNAL_SERVER_ERROR, "Knowledge index could not be built"),
    RETRIEVAL_SERVICE_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE, "Embedding or generation service is unavailable"),
    RESOLUTION_FAILURE(HttpStatus.NOT_FOUND, "No relevant knowledge found"),
    QUERY_CANCELLED(HttpStatus.CONFLICT, "Query was cancelled");

    private final HttpStatus status;
    private final String description;

    ErrorCode(HttpStatus status, String description) {
        this.status = status;
        this.description = description;
    }
}
