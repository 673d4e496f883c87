package com.jewelrec.common.exception;

/** Failure reading or writing a persisted user profile. */
public class ProfileStoreException extends RecommenderException {

    public ProfileStoreException(String message) {
        super(message);
    }

    public ProfileStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
