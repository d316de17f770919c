package com.machining.kg.exception;

import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base exception of the knowledge pipeline.
 * Carries an {@link ErrorCode} and a small context map (row number, column, service name ...)
 * that is logged and returned in structured error responses.
 */
@Getter
public class MachiningKgException extends RuntimeException {

    private final ErrorCode code;
    private final Map<String, Object> context;

    public MachiningKgException(ErrorCode code, String message) {
        this(code, message, Map.of(), null);
    }

    public MachiningKgException(ErrorCode code, String message, Throwable cause) {
        this(code, message, Map.of(), cause);
    }

    public MachiningKgException(ErrorCode code, String message, Map<String, ?> context, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.context = Collections.unmodifiableMap(new LinkedHashMap<>(context));
    }
}
