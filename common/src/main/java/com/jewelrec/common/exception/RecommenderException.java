package com.jewelrec.common.exception;

/**
 * Base class for all errors raised by the recommender.
 */
public class RecommenderException extends RuntimeException {

    public RecommenderException(String message) {
        super(message);
    }

    public RecommenderException(String message, Throwable cause) {
        super(message, cause);
    }
}
