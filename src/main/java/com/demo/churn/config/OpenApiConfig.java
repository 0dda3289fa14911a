package com.demo.churn.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.tags.Tag;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI churnOpenAPI(@Value("${churn.refresh.ttl-hours:24}") long ttlHours) {
        return new OpenAPI()
                .info(new Info()
                        .title("Customer Churn Scoring API")
                        .description("Scores every customer in the churn feature table, explains each score and "
                                + "flags business-rule churn. The feature table is rebuilt at most every "
                                + ttlHours + "h before a run.")
                        .version("v1"))
                .tags(List.of(
                        new Tag().name("runs").description("Trigger a scoring run"),
                        new Tag().name("refresh").description("Refresh gate status"),
                        new Tag().name("connectivity").description("Database check")));
    }
}
