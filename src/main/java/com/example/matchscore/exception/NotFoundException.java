package com.example.matchscore.exception;

public class NotFoundException extends MatchScoreException {
    public NotFoundException(String message) {
        super(message);
    }

    public static NotFoundException of(String what, String id) {
        return new NotFoundException(what + " not found: " + id);
    }

    @Override
    public String errorType() {
        return "NOT_FOUND";
    }
}
