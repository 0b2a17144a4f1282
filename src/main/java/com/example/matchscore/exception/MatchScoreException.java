package com.example.matchscore.exception;

/**
 * Base of every error raised by the scoring engine.
 */
public class MatchScoreException extends RuntimeException {
    public MatchScoreException(String message) {
        super(message);
    }

    public MatchScoreException(String message, Throwable cause) {
        super(message, cause);
    }

    /** Short machine-readable category, used in batch failure reports. */
    public String errorType() {
        return "INTERNAL";
    }
}
