package com.ai.jobmatch.dto;

import lombok.Builder;
import lombok.Value;

/**
 * France Travail 검색 필터. 모든 필드는 선택이며 null이면 요청에서 생략된다.
 */
@Value
@Builder
public class JobSearchFilters {

    public static final JobSearchFilters NONE = JobSearchFilters.builder().build();

    ExperienceLevel experienceLevel;
    ExperienceRequirement experienceRequirement;
    String contractType;
    Boolean fullTime;
    // 업무 분야 코드 (domaine)
    String domainCode;
    // 최근 N일 이내 게시 (publieeDepuis: 1, 3, 7, 14, 31)
    Integer publishedWithinDays;
    // 0: 관련도, 1: 날짜, 2: 거리
    Integer sort;
}
