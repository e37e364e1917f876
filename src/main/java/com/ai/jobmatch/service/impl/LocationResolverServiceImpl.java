package com.ai.jobmatch.service.impl;

import com.ai.jobmatch.dto.GeoPlace;
import com.ai.jobmatch.dto.LocationType;
import com.ai.jobmatch.dto.ResolvedLocation;
import com.ai.jobmatch.service.GeoLookupService;
import com.ai.jobmatch.service.LocationResolverService;
import com.ai.jobmatch.util.TextUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Service
@RequiredArgsConstructor
@Slf4j
public class LocationResolverServiceImpl implements LocationResolverService {

    private static final List<LocationType> DEFAULT_ORDER =
            List.of(LocationType.REGION, LocationType.DEPARTMENT, LocationType.COMMUNE);

    private final GeoLookupService geoLookupService;

    @Override
    public ResolvedLocation resolve(String raw, LocationType hint) {
        if (TextUtils.isBlank(raw)) {
            return ResolvedLocation.none();
        }

        for (LocationType type : lookupOrder(hint)) {
            Optional<ResolvedLocation> resolved = lookup(raw, type);
            if (resolved.isPresent()) {
                return resolved.get();
            }
        }

        log.warn("위치 해석 실패, 지역 조건 없이 검색합니다: '{}' (힌트: {})", raw, hint);
        return ResolvedLocation.none();
    }

    /**
     * 힌트로 받은 종류를 먼저, 나머지는 레지옹 -> 데파르트망 -> 코뮌 순서
     */
    static List<LocationType> lookupOrder(LocationType hint) {
        if (hint == null || hint == LocationType.UNKNOWN) {
            return DEFAULT_ORDER;
        }
        List<LocationType> order = new ArrayList<>(DEFAULT_ORDER.size());
        order.add(hint);
        for (LocationType type : DEFAULT_ORDER) {
            if (type != hint) {
                order.add(type);
            }
        }
        return order;
    }

    private Optional<ResolvedLocation> lookup(String raw, LocationType type) {
        switch (type) {
            case REGION -> {
                List<GeoPlace> regions = geoLookupService.searchRegions(raw);
                if (!regions.isEmpty()) {
                    GeoPlace region = regions.get(0);
                    log.info("위치 해석: '{}' -> 레지옹 {} ({})", raw, region.getName(), region.getCode());
                    return Optional.of(ResolvedLocation.region(region.getCode()));
                }
            }
            case DEPARTMENT -> {
                List<GeoPlace> departments = geoLookupService.searchDepartments(raw);
                if (!departments.isEmpty()) {
                    GeoPlace department = departments.get(0);
                    log.info("위치 해석: '{}' -> 데파르트망 {} ({})", raw, department.getName(), department.getCode());
                    return Optional.of(ResolvedLocation.department(department.getCode()));
                }
            }
            case COMMUNE -> {
                List<GeoPlace> cities = geoLookupService.searchCities(raw);
                if (!cities.isEmpty()) {
                    GeoPlace city = cities.get(0);
                    log.info("위치 해석: '{}' -> 코뮌 {} ({}, 데파르트망 {})",
                            raw, city.getName(), city.getCode(), city.parentDepartmentCode());
                    return Optional.of(ResolvedLocation.commune(city.getCode(), city.parentDepartmentCode()));
                }
            }
            default -> {
                // UNKNOWN은 lookupOrder에서 걸러짐
            }
        }
        return Optional.empty();
    }
}
