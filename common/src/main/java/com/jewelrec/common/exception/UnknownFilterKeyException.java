package com.jewelrec.common.exception;

public class UnknownFilterKeyException extends RecommenderException {

    public UnknownFilterKeyException(String message) {
        super(message);
    }

    public UnknownFilterKeyException(String message, Throwable cause) {
        super(message, cause);
    }
}
