package com.example.matchscore.model.request;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
@Schema(description = "Opportunities to look up existing scores for, without computing")
public class BulkCheckRequest {
    private String profileId;

    @Schema(description = "1 to 100 opportunity ids")
    private List<String> opportunityIds = new ArrayList<>();

    @Schema(description = "Only scores newer than this many hours count (1-168)", example = "24")
    private Integer maxAgeHours;
}
