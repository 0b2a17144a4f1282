package com.example.matchscore.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Getter;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
@Document(collection = "profiles")
@Schema(description = "Business capability profile (read-only snapshot while scoring)")
public class Profile {
    @Id
    private String id;

    @Indexed
    @Schema(description = "Owning organization")
    private String organizationId;

    @Schema(description = "Company name", example = "Acme Federal Solutions")
    private String companyName;

    @Schema(description = "Primary industry (NAICS) code", example = "541511")
    private String primaryIndustryCode;

    @Schema(description = "Secondary industry codes")
    private List<String> secondaryIndustryCodes = new ArrayList<>();

    @Schema(description = "Home jurisdiction (state code)", example = "VA")
    private String state;

    private String city;

    @Schema(description = "Held certifications")
    private List<Certification> certifications = new ArrayList<>();

    @Schema(description = "Set-aside eligibility flags", example = "[\"8a\", \"small_business\"]")
    private List<String> setAsides = new ArrayList<>();

    private SecurityClearance securityClearance;

    @Schema(description = "Preferred government levels")
    private List<GovernmentLevel> governmentLevels = new ArrayList<>();

    @Schema(description = "Capability keywords used for competency matching")
    private List<String> capabilityKeywords = new ArrayList<>();

    private PastPerformance pastPerformance;

    private boolean samRegistered;
    private String uei;
    private String cageCode;

    @Schema(description = "Profile completeness (0-100)", example = "85")
    private Integer completenessPercentage;

    private Instant updatedAt;
}
