package com.ai.jobmatch.service;

import com.ai.jobmatch.dto.GeoPlace;

import java.util.List;

/**
 * geo.api.gouv.fr 조회. 결과는 인구 순(출처 기준)으로 정렬되어 있고, 실패하면 빈 목록을 반환한다.
 */
public interface GeoLookupService {
    List<GeoPlace> searchCities(String query);
    List<GeoPlace> searchDepartments(String query);
    List<GeoPlace> searchRegions(String query);
}
