package com.ai.jobmatch.dto;

import lombok.Builder;
import lombok.Value;

/**
 * Planner가 만든 검색 변형 하나. 생성 이후 변경되지 않는다.
 */
@Value
@Builder(toBuilder = true)
public class SearchVariation {
    String keywords;
    String locationRaw;
    @Builder.Default
    LocationType locationType = LocationType.UNKNOWN;
    ExperienceLevel experienceLevel;
    ExperienceRequirement experienceRequirement;
    String contractType;
    Boolean fullTime;

    /**
     * 추론 실패시 사용하는 단일 폴백 변형
     */
    public static SearchVariation fallback(String userQuery) {
        return SearchVariation.builder()
                .keywords(userQuery)
                .build();
    }

    public boolean hasLocation() {
        return locationRaw != null && !locationRaw.isBlank();
    }

    public JobSearchFilters toFilters() {
        return JobSearchFilters.builder()
                .experienceLevel(experienceLevel)
                .experienceRequirement(experienceRequirement)
                .contractType(contractType)
                .fullTime(fullTime)
                .build();
    }
}
