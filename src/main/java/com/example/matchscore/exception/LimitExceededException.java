package com.example.matchscore.exception;

public class LimitExceededException extends MatchScoreException {
    private final String resourceType;
    private final long limit;

    public LimitExceededException(String resourceType, long limit) {
        super("Monthly limit reached for " + resourceType + " (" + limit + ")");
        this.resourceType = resourceType;
        this.limit = limit;
    }

    public String getResourceType() {
        return resourceType;
    }

    public long getLimit() {
        return limit;
    }

    @Override
    public String errorType() {
        return "LIMIT_EXCEEDED";
    }
}
