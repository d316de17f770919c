package com.machining.kg.exception;

import java.util.Map;

/**
 * The graph store could not be reached, or an operation on it timed out.
 */
public class StoreUnavailableException extends MachiningKgException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(ErrorCode.STORE_UNAVAILABLE, message, cause);
    }

    public StoreUnavailableException(String message, Map<String, ?> context, Throwable cause) {
        super(ErrorCode.STORE_UNAVAILABLE, message, context, cause);
    }
}
