package com.jewelrec.common.exception;

public class EmbeddingUnavailableException extends RecommenderException {

    public EmbeddingUnavailableException(String message) {
        super(message);
    }

    public EmbeddingUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
