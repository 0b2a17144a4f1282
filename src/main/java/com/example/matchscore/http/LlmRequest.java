package com.example.matchscore.http;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.time.Duration;

@Getter
@AllArgsConstructor
public class LlmRequest {
    private final String prompt;
    private final String model;
    private final int maxTokens;
    private final double temperature;
    private final Duration timeout;
}
