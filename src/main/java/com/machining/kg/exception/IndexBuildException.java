package com.machining.kg.exception;

public class IndexBuildException extends MachiningKgException {

    public IndexBuildException(String message) {
        super(ErrorCode.INDEX_BUILD_FAILURE, message);
    }

    public IndexBuildException(String message, Throwable cause) {
        super(ErrorCode.INDEX_BUILD_FAILURE, message, cause);
    }
}
