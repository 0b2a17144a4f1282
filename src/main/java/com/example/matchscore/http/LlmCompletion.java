package com.example.matchscore.http;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class LlmCompletion {
    private final String text;
    private final String model;
    private final int promptTokens;
    private final int completionTokens;
    private final double costUsd;

    public int getTotalTokens() {
        return promptTokens + completionTokens;
    }
}
