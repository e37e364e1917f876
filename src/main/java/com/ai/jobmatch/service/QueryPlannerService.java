package com.ai.jobmatch.service;

import com.ai.jobmatch.dto.SearchVariation;

import java.util.List;

public interface QueryPlannerService {

    /**
     * 검색어와 프로필 요약으로 1~3개의 검색 변형을 만든다.
     * 결과는 항상 평탄한 목록이며, 추론에 실패하면 검색어 그대로의 변형 하나를 반환한다.
     */
    List<SearchVariation> predict(String userQuery, String profileSummary);
}
