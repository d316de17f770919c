package com.machining.kg.exception;

/**
 * The question could not be mapped to any indexed unit or graph fact.
 */
public class ResolutionFailureException extends MachiningKgException {

    public ResolutionFailureException(String message) {
        super(ErrorCode.RESOLUTION_FAILURE, message);
    }
}
