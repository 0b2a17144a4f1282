package com.example.matchscore.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
@Schema(description = "Past performance narrative and itemized prior contracts")
public class PastPerformance {
    @Schema(description = "Free-text narrative")
    private String description;

    private List<PastProject> projects = new ArrayList<>();

    @Getter
    @Setter
    @Schema(description = "Prior contract")
    public static class PastProject {
        private String name;
        private String customer;

        @Schema(description = "FEDERAL, STATE, LOCAL or COMMERCIAL", example = "FEDERAL")
        private String customerType;

        @Schema(description = "Contract value in USD", example = "2500000")
        private Double value;

        private Integer completionYear;
        private String description;

        public boolean isGovernment() {
            if (customerType != null) {
                String t = customerType.trim().toUpperCase();
                if (t.equals("FEDERAL") || t.equals("STATE") || t.equals("LOCAL")) return true;
            }
            if (customer == null) return false;
            String c = customer.toLowerCase();
            return c.contains("department") || c.contains("agency") || c.contains("government");
        }
    }
}
