package com.ai.jobmatch.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.time.Duration;

@Configuration
public class HttpClientConfig {

    @Bean(name = "franceTravailRestClient")
    public RestClient franceTravailRestClient(RestClient.Builder builder, FranceTravailConfig config) {
        return builder.clone()
                .requestFactory(requestFactory(config.getConnectTimeoutSeconds(), config.getReadTimeoutSeconds()))
                .build();
    }

    @Bean(name = "geoRestClient")
    public RestClient geoRestClient(RestClient.Builder builder, GeoApiConfig config) {
        return builder.clone()
                .baseUrl(config.getBaseUrl())
                .requestFactory(requestFactory(config.getConnectTimeoutSeconds(), config.getReadTimeoutSeconds()))
                .build();
    }

    private SimpleClientHttpRequestFactory requestFactory(int connectTimeoutSeconds, int readTimeoutSeconds) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(Duration.ofSeconds(connectTimeoutSeconds));
        factory.setReadTimeout(Duration.ofSeconds(readTimeoutSeconds));
        return factory;
    }
}
