package com.jewelrec.common.exception;

/** Pool files are missing, corrupt or misaligned. Fatal at load time. */
public class IndexBuildException extends RecommenderException {

    public IndexBuildException(String message) {
        super(message);
    }

    public IndexBuildException(String message, Throwable cause) {
        super(message, cause);
    }
}
