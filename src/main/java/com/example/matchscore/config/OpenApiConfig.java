package com.example.matchscore.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.media.StringSchema;
import io.swagger.v3.oas.models.parameters.HeaderParameter;
import org.springdoc.core.customizers.OpenApiCustomizer;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI openAPI(@Value("${matchscore.scoring.algorithm-version:v4.0-research-based}") String algorithmVersion) {
        return new OpenAPI()
                .info(new Info()
                        .title("match-score-engine API")
                        .version("0.1.0")
                        .description("Profile/opportunity match scoring, batch scoring and feedback. Algorithm "
                                + algorithmVersion));
    }

    /** Documents the trusted organization header on every operation. */
    @Bean
    public OpenApiCustomizer organizationHeaderDocs() {
        return openApi -> {
            if (openApi.getPaths() == null) return;
            openApi.getPaths().values().forEach(item -> item.readOperations().forEach(op -> {
                boolean present = op.getParameters() != null && op.getParameters().stream()
                        .anyMatch(p -> "X-Organization-Id".equals(p.getName()));
                if (!present) {
                    op.addParametersItem(new HeaderParameter()
                            .name("X-Organization-Id")
                            .required(true)
                            .description("Caller organization (trusted)")
                            .schema(new StringSchema()));
                }
            }));
        };
    }
}
