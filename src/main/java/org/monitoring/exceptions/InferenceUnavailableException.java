package org.monitoring.exceptions;

/**
 * The mapping inference capability could not be reached or did not answer in time.
 */
public class InferenceUnavailableException extends RuntimeException {

    public InferenceUnavailableException(String message) {
        super(message);
    }

    public InferenceUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
