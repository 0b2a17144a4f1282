package com.example.matchscore.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Getter;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
@Document(collection = "opportunities")
@Schema(description = "Contract solicitation (read-only snapshot while scoring)")
public class Opportunity {
    @Id
    private String id;

    private String title;

    @Schema(description = "Issuing agency", example = "Department of Veterans Affairs")
    private String agency;

    @Schema(description = "Industry (NAICS) codes", example = "[\"541511\"]")
    private List<String> industryCodes = new ArrayList<>();

    @Schema(description = "Place of performance (state code)", example = "VA")
    private String state;

    private String city;

    @Schema(description = "Nationwide or multiple places of performance")
    private boolean nationwide;

    private EstimatedValue estimatedValue;

    private Instant responseDeadline;

    @Schema(description = "Set-aside classification", example = "8a")
    private String setAsideType;

    private List<String> requiredCertifications = new ArrayList<>();

    private SecurityClearance securityClearanceRequired;

    private String description;

    private Instant updatedAt;

    @Getter
    @Setter
    @Schema(description = "Estimated value: a point value or a min/max range (USD)")
    public static class EstimatedValue {
        private Double value;
        private Double min;
        private Double max;

        /** Point value, else the range midpoint, else whichever bound is known. */
        public Double resolve() {
            if (value != null && value > 0) return value;
            if (min != null && max != null) return (min + max) / 2.0;
            if (max != null) return max;
            return min;
        }
    }
}
