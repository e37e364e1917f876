package com.ai.jobmatch.service.impl;

import com.ai.jobmatch.config.FranceTravailConfig;
import com.ai.jobmatch.dto.AccessTokenResponse;
import com.ai.jobmatch.dto.JobSearchFilters;
import com.ai.jobmatch.dto.JobSearchResponse;
import com.ai.jobmatch.dto.LocationConstraint;
import com.ai.jobmatch.entity.JobPosting;
import com.ai.jobmatch.exception.ExternalAuthException;
import com.ai.jobmatch.exception.ExternalSearchException;
import com.ai.jobmatch.service.FranceTravailService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.time.Clock;
import java.time.Instant;
import java.util.List;

@Service
@Slf4j
public class FranceTravailServiceImpl implements FranceTravailService {

    private final RestClient restClient;
    private final FranceTravailConfig config;
    private final Clock clock;

    // 프로세스 로컬 토큰 캐시. 동시 갱신은 마지막 값이 남아도 무방하다.
    private final Object tokenLock = new Object();
    private volatile CachedToken cachedToken;

    @Autowired
    public FranceTravailServiceImpl(@Qualifier("franceTravailRestClient") RestClient restClient,
                                    FranceTravailConfig config) {
        this(restClient, config, Clock.systemUTC());
    }

    FranceTravailServiceImpl(RestClient restClient, FranceTravailConfig config, Clock clock) {
        this.restClient = restClient;
        this.config = config;
        this.clock = clock;
    }

    @Override
    public List<JobPosting> searchJobs(String keywords, LocationConstraint location, JobSearchFilters filters) {
        String token = getAccessToken();
        URI uri = buildSearchUri(keywords, location, filters);

        ResponseEntity<JobSearchResponse> response;
        try {
            response = restClient.get()
                    .uri(uri)
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + token)
                    .accept(MediaType.APPLICATION_JSON)
                    .retrieve()
                    .onStatus(status -> !status.is2xxSuccessful(), (request, res) -> {
                        throw new ExternalSearchException(res.getStatusCode().value(),
                                "France Travail 검색 실패: HTTP " + res.getStatusCode().value());
                    })
                    .toEntity(JobSearchResponse.class);
        } catch (ExternalSearchException e) {
            log.warn("France Travail 검색 오류 - 키워드: '{}', 상태: {}", keywords, e.getStatusCode());
            throw e;
        } catch (RestClientException e) {
            throw new ExternalSearchException("France Travail 검색 호출 실패: " + e.getMessage(), e);
        }

        if (response.getStatusCode().isSameCodeAs(HttpStatus.NO_CONTENT) || response.getBody() == null) {
            log.info("France Travail 검색 결과 없음 - 키워드: '{}', 지역: {}", keywords, describe(location));
            return List.of();
        }

        List<JobPosting> jobs = response.getBody().getResults() == null ? List.of() : response.getBody().getResults();
        log.info("France Travail 검색 완료 - 키워드: '{}', 지역: {}, 결과: {}개",
                keywords, describe(location), jobs.size());
        return jobs;
    }

    /**
     * 내부 필터를 France Travail 파라미터로 변환한다.
     */
    URI buildSearchUri(String keywords, LocationConstraint location, JobSearchFilters filters) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromUriString(config.getBaseUrl() + config.getSearchPath())
                .queryParam("range", "0-" + (config.getPageSize() - 1));

        if (keywords != null && !keywords.isBlank()) {
            builder.queryParam("motsCles", keywords.trim());
        }

        LocationConstraint effective = (location == null ? LocationConstraint.national() : location).normalized();
        if (effective.getCommuneCode() != null) {
            builder.queryParam("commune", effective.getCommuneCode());
            builder.queryParam("distance", effective.getRadiusKm() != null
                    ? effective.getRadiusKm() : config.getDefaultRadiusKm());
        } else if (effective.getDepartmentCode() != null) {
            builder.queryParam("departement", effective.getDepartmentCode());
        } else if (effective.getRegionCode() != null) {
            builder.queryParam("region", effective.getRegionCode());
        }

        JobSearchFilters f = filters == null ? JobSearchFilters.NONE : filters;
        if (f.getExperienceLevel() != null) {
            builder.queryParam("experience", f.getExperienceLevel().getCode());
        }
        if (f.getExperienceRequirement() != null) {
            builder.queryParam("experienceExigence", f.getExperienceRequirement().getCode());
        }
        if (f.getContractType() != null && !f.getContractType().isBlank()) {
            builder.queryParam("typeContrat", f.getContractType());
        }
        if (f.getFullTime() != null) {
            builder.queryParam("tempsPlein", f.getFullTime());
        }
        if (f.getDomainCode() != null) {
            builder.queryParam("domaine", f.getDomainCode());
        }
        if (f.getPublishedWithinDays() != null) {
            builder.queryParam("publieeDepuis", f.getPublishedWithinDays());
        }
        if (f.getSort() != null) {
            builder.queryParam("sort", f.getSort());
        }

        return builder.encode().build().toUri();
    }

    /**
     * 토큰이 없거나 만료 60초 전이면 client_credentials로 재발급한다.
     */
    String getAccessToken() {
        CachedToken current = cachedToken;
        if (isValid(current)) {
            return current.value();
        }

        synchronized (tokenLock) {
            current = cachedToken;
            if (isValid(current)) {
                return current.value();
            }
            cachedToken = requestToken();
            return cachedToken.value();
        }
    }

    private boolean isValid(CachedToken token) {
        return token != null
                && clock.instant().isBefore(token.expiresAt().minusSeconds(config.getTokenRefreshMarginSeconds()));
    }

    private CachedToken requestToken() {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("grant_type", "client_credentials");
        form.add("client_id", config.getClientId());
        form.add("client_secret", config.getClientSecret());
        form.add("scope", config.getScope());

        AccessTokenResponse body;
        try {
            body = restClient.post()
                    .uri(URI.create(config.getTokenUrl()))
                    .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                    .body(form)
                    .retrieve()
                    .body(AccessTokenResponse.class);
        } catch (RestClientException e) {
            log.error("France Travail 토큰 발급 실패: {}", e.getMessage());
            throw new ExternalAuthException("France Travail 토큰 발급에 실패했습니다.", e);
        }

        if (body == null || body.getAccessToken() == null || body.getAccessToken().isBlank()) {
            throw new ExternalAuthException("France Travail 토큰 응답에 access_token이 없습니다.");
        }

        Instant expiresAt = clock.instant().plusSeconds(body.getExpiresIn());
        log.info("France Travail 토큰 발급 완료 - 만료: {}", expiresAt);
        return new CachedToken(body.getAccessToken(), expiresAt);
    }

    private static String describe(LocationConstraint location) {
        if (location == null || location.isNational()) {
            return "전국";
        }
        LocationConstraint effective = location.normalized();
        if (effective.getCommuneCode() != null) {
            return "commune " + effective.getCommuneCode();
        }
        if (effective.getDepartmentCode() != null) {
            return "departement " + effective.getDepartmentCode();
        }
        return "region " + effective.getRegionCode();
    }

    private record CachedToken(String value, Instant expiresAt) {
    }
}
