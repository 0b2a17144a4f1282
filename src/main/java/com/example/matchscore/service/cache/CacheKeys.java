package com.example.matchscore.service.cache;

import com.example.matchscore.model.ScoringMethod;

import java.time.YearMonth;

/**
 * Composite cache keys. Segments run from broad to narrow so that a prefix or a
 * {@code *} glob selects an organization, a profile or a single pair.
 */
public final class CacheKeys {

    private CacheKeys() {}

    public static String score(String orgId, String profileId, String opportunityId,
                               ScoringMethod method, String algorithmVersion) {
        return "match:" + orgId + ":" + profileId + ":" + opportunityId + ":" + method.value() + ":" + algorithmVersion;
    }

    /** Every method and version cached for one pair. */
    public static String pairPattern(String orgId, String profileId, String opportunityId) {
        return "match:" + orgId + ":" + profileId + ":" + opportunityId + ":*";
    }

    public static String organizationPattern(String orgId) {
        return "match:" + orgId + ":*";
    }

    public static String recent(String orgId, int hours) {
        return "recent:" + orgId + ":" + hours;
    }

    public static String recentPrefix(String orgId) {
        return "recent:" + orgId + ":";
    }

    public static String usage(String orgId, YearMonth period) {
        return "usage:" + orgId + ":" + period;
    }
}
