package com.nightscan.predict;

/**
 * An optional sub-model could not produce output for a symbol.
 */
public class ModelUnavailableException extends Exception {

    public ModelUnavailableException(String message) {
        super(message);
    }

    public ModelUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
