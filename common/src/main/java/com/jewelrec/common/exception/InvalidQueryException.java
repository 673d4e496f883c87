package com.jewelrec.common.exception;

/** Query carries nothing that can be embedded. */
public class InvalidQueryException extends RecommenderException {

    public InvalidQueryException(String message) {
        super(message);
    }

    public InvalidQueryException(String message, Throwable cause) {
        super(message, cause);
    }
}
