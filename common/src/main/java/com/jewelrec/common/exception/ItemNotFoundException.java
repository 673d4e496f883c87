package com.jewelrec.common.exception;

public class ItemNotFoundException extends RecommenderException {

    public ItemNotFoundException(String message) {
        super(message);
    }

    public ItemNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
