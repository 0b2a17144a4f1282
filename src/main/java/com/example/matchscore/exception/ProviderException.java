package com.example.matchscore.exception;

/** Language-model provider failure: transport error, bad status, empty or malformed reply. */
public class ProviderException extends MatchScoreException {
    public ProviderException(String message) {
        super(message);
    }

    public ProviderException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String errorType() {
        return "PROVIDER";
    }
}
