package com.jewelrec.common.exception;

/** Filter value that cannot form a valid criterion, e.g. min above max. */
public class InvalidFilterException extends RecommenderException {

    public InvalidFilterException(String message) {
        super(message);
    }

    public InvalidFilterException(String message, Throwable cause) {
        super(message, cause);
    }
}
