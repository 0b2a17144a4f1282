package com.example.matchscore.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Certification held by a profile")
public class Certification {
    @Schema(description = "Certification type", example = "8a")
    private String type;

    @Schema(description = "Status; blank counts as active", example = "ACTIVE")
    private String status;

    public boolean isActive() {
        if (status == null || status.isBlank()) return true;
        String s = status.trim().toUpperCase();
        return s.equals("ACTIVE") || s.equals("VALID");
    }
}
