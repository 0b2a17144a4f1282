package com.example.matchscore.model;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Security clearance level, ordered from lowest to highest")
public enum SecurityClearance {
    NONE,
    PUBLIC_TRUST,
    SECRET,
    TOP_SECRET;

    public boolean covers(SecurityClearance required) {
        if (required == null) return true;
        return ordinal() >= required.ordinal();
    }

    public static SecurityClearance from(String s) {
        if (s == null || s.isBlank()) return NONE;
        String t = s.trim().toUpperCase().replace(' ', '_').replace('-', '_');
        for (SecurityClearance c : values()) {
            if (c.name().equals(t)) return c;
        }
        if (t.equals("TS") || t.startsWith("TS_")) return TOP_SECRET;
        return NONE;
    }
}
