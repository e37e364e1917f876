package com.ai.jobmatch.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "geo")
public class GeoApiConfig {

    private String baseUrl = "https://geo.api.gouv.fr";

    private int limit = 10;

    /**
     * 이보다 짧은 검색어는 조회하지 않음
     */
    private int minQueryLength = 2;

    private int connectTimeoutSeconds = 3;

    private int readTimeoutSeconds = 10;
}
