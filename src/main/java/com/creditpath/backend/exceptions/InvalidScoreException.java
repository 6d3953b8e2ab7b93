package com.creditpath.backend.exceptions;

/**
 * Raised when a score observation cannot be recorded as given.
 */
public class InvalidScoreException extends BusinessException {

    public InvalidScoreException(String message) {
        super(message);
    }
}
