package com.jewelrec.common.exception;

public class UnknownDatasetException extends RecommenderException {

    public UnknownDatasetException(String message) {
        super(message);
    }

    public UnknownDatasetException(String message, Throwable cause) {
        super(message, cause);
    }
}
