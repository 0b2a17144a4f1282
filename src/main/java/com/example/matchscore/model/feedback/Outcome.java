package com.example.matchscore.model.feedback;

import com.example.matchscore.exception.ValidationException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Bid outcome reported after the fact")
public enum Outcome {
    WON("won"),
    LOST("lost"),
    NO_BID("no_bid"),
    WITHDRAWN("withdrawn");

    private final String value;

    Outcome(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static Outcome from(String s) {
        if (s == null || s.isBlank()) return null;
        String t = s.trim().toLowerCase();
        for (Outcome o : values()) {
            if (o.value.equals(t)) return o;
        }
        throw new ValidationException("Unknown outcome: " + s);
    }
}
