package com.astroinsight.astroinsight_backend.exception;

/**
 * The classifier could not produce a reply at all (transport failure, provider error, timeout).
 * A reply that is merely unexpected is not an exception; callers validate labels themselves.
 */
public class ClassifierException extends Exception {

    public ClassifierException(String message) {
        super(message);
    }

    public ClassifierException(String message, Throwable cause) {
        super(message, cause);
    }
}
