package com.ai.jobmatch.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "francetravail")
public class FranceTravailConfig {

    private String clientId;

    private String clientSecret;

    /**
     * client_credentials 토큰 발급 엔드포인트
     */
    private String tokenUrl = "https://entreprise.francetravail.fr/connexion/oauth2/access_token?realm=%2Fpartenaire";

    private String scope = "api_offresdemploiv2 o2dsoffre";

    private String baseUrl = "https://api.francetravail.io";

    private String searchPath = "/partenaire/offresdemploi/v2/offres/search";

    /**
     * 한 번의 검색에서 가져오는 최대 공고 수 (range 0-49)
     */
    private int pageSize = 50;

    /**
     * 코뮌 단위 검색시 기본 반경 (km)
     */
    private int defaultRadiusKm = 25;

    /**
     * 만료 몇 초 전부터 토큰을 갱신할지
     */
    private long tokenRefreshMarginSeconds = 60;

    private int connectTimeoutSeconds = 5;

    private int readTimeoutSeconds = 20;
}
