package com.example.matchscore.exception;

public class PersistenceException extends MatchScoreException {
    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String errorType() {
        return "PERSISTENCE";
    }
}
