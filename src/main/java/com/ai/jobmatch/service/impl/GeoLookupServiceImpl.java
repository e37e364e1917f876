package com.ai.jobmatch.service.impl;

import com.ai.jobmatch.config.GeoApiConfig;
import com.ai.jobmatch.dto.GeoPlace;
import com.ai.jobmatch.service.GeoLookupService;
import com.ai.jobmatch.util.TextUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.util.UriBuilder;

import java.net.URI;
import java.util.List;
import java.util.function.Function;
import java.util.regex.Pattern;

@Service
@Slf4j
public class GeoLookupServiceImpl implements GeoLookupService {

    private static final String COMMUNE_FIELDS = "nom,code,codesPostaux,departement,region";
    private static final String DEPARTMENT_FIELDS = "nom,code,codeRegion";
    private static final String REGION_FIELDS = "nom,code";

    private static final Pattern POSTAL_CODE = Pattern.compile("\\d{5}");
    // 01~95, 2A/2B, 971~976
    private static final Pattern DEPARTMENT_CODE = Pattern.compile("\\d{2}|2[AaBb]|97\\d");

    private static final ParameterizedTypeReference<List<GeoPlace>> PLACE_LIST = new ParameterizedTypeReference<>() {};

    private final RestClient geoRestClient;
    private final GeoApiConfig config;

    public GeoLookupServiceImpl(@Qualifier("geoRestClient") RestClient geoRestClient, GeoApiConfig config) {
        this.geoRestClient = geoRestClient;
        this.config = config;
    }

    @Override
    public List<GeoPlace> searchCities(String query) {
        if (!isSearchable(query)) {
            return List.of();
        }
        String trimmed = query.trim();
        // 5자리 숫자는 우편번호 정확 일치, 그 외는 이름 검색
        String param = POSTAL_CODE.matcher(trimmed).matches() ? "codePostal" : "nom";

        return fetch("communes", trimmed, uriBuilder -> uriBuilder
                .path("/communes")
                .queryParam(param, trimmed)
                .queryParam("fields", COMMUNE_FIELDS)
                .queryParam("boost", "population")
                .queryParam("limit", config.getLimit())
                .build());
    }

    @Override
    public List<GeoPlace> searchDepartments(String query) {
        if (TextUtils.isBlank(query)) {
            return List.of();
        }
        String trimmed = query.trim();
        boolean byCode = DEPARTMENT_CODE.matcher(trimmed).matches();
        if (!byCode && !isSearchable(trimmed)) {
            return List.of();
        }

        return fetch("departements", trimmed, uriBuilder -> uriBuilder
                .path("/departements")
                .queryParam(byCode ? "code" : "nom", byCode ? trimmed.toUpperCase() : trimmed)
                .queryParam("fields", DEPARTMENT_FIELDS)
                .queryParam("limit", config.getLimit())
                .build());
    }

    @Override
    public List<GeoPlace> searchRegions(String query) {
        if (!isSearchable(query)) {
            return List.of();
        }
        String trimmed = query.trim();

        return fetch("regions", trimmed, uriBuilder -> uriBuilder
                .path("/regions")
                .queryParam("nom", trimmed)
                .queryParam("fields", REGION_FIELDS)
                .queryParam("limit", config.getLimit())
                .build());
    }

    private List<GeoPlace> fetch(String resource, String query, Function<UriBuilder, URI> uriFunction) {
        try {
            List<GeoPlace> places = geoRestClient.get()
                    .uri(uriFunction)
                    .retrieve()
                    .body(PLACE_LIST);
            log.debug("geo {} 조회 완료: '{}' -> {}개", resource, query, places == null ? 0 : places.size());
            return places == null ? List.of() : places;
        } catch (Exception e) {
            log.warn("geo {} 조회 실패: '{}' - {}", resource, query, e.getMessage());
            return List.of();
        }
    }

    private boolean isSearchable(String query) {
        return !TextUtils.isBlank(query) && query.trim().length() >= config.getMinQueryLength();
    }
}
