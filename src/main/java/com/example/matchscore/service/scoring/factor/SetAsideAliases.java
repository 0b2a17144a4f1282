package com.example.matchscore.service.scoring.factor;

import java.util.Locale;
import java.util.Map;
import java.util.Set;

/** Canonical set-aside and certification codes, with the programs each one implies. */
final class SetAsideAliases {

    private static final Map<String, String> CANONICAL = Map.ofEntries(
            Map.entry("8a", "8a"), Map.entry("8_a", "8a"), Map.entry("eight_a", "8a"), Map.entry("eighta", "8a"),
            Map.entry("hubzone", "hubzone"), Map.entry("hub_zone", "hubzone"),
            Map.entry("wosb", "wosb"), Map.entry("edwosb", "wosb"), Map.entry("woman_owned", "wosb"),
            Map.entry("women_owned", "wosb"),
            Map.entry("vosb", "vosb"), Map.entry("veteran_owned", "vosb"),
            Map.entry("sdvosb", "sdvosb"), Map.entry("sdvob", "sdvosb"),
            Map.entry("service_disabled_veteran", "sdvosb"),
            Map.entry("service_disabled_veteran_owned", "sdvosb"),
            Map.entry("small_business", "small_business"), Map.entry("sb", "small_business"),
            Map.entry("total_small_business", "small_business"), Map.entry("sba", "small_business"));

    private static final Map<String, Set<String>> IMPLIES = Map.of(
            "sdvosb", Set.of("vosb", "small_business"),
            "vosb", Set.of("small_business"),
            "wosb", Set.of("small_business"),
            "8a", Set.of("small_business"),
            "hubzone", Set.of("small_business"));

    private SetAsideAliases() {}

    static String canonical(String code) {
        if (code == null) return "";
        String n = code.trim().toLowerCase(Locale.ROOT)
                .replace("(", "").replace(")", "")
                .replaceAll("[\\s\\-/]+", "_");
        return CANONICAL.getOrDefault(n, n);
    }

    /** True when holding {@code held} makes a firm eligible for {@code required}. */
    static boolean satisfies(String held, String required) {
        String h = canonical(held);
        String r = canonical(required);
        if (h.isEmpty() || r.isEmpty()) return false;
        return h.equals(r) || IMPLIES.getOrDefault(h, Set.of()).contains(r);
    }
}
