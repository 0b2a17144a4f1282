package com.example.matchscore.service.dispatch;

import com.example.matchscore.model.request.BatchScoreRequest;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class BatchScorePayload {
    private final String organizationId;
    private final BatchScoreRequest request;
}
