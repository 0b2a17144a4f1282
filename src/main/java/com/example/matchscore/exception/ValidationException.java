package com.example.matchscore.exception;

public class ValidationException extends MatchScoreException {
    public ValidationException(String message) {
        super(message);
    }

    @Override
    public String errorType() {
        return "VALIDATION";
    }
}
