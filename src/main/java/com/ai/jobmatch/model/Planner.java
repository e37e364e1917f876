package com.ai.jobmatch.model;

/**
 * 자연어 검색 요청을 구조화된 검색 계획(JSON)으로 바꾸는 추론 모델
 */
@FunctionalInterface
public interface Planner {

    /**
     * @param userQuery      사용자 검색어
     * @param profileSummary 후보자 요약 텍스트
     * @return 모델이 생성한 원본 응답 (variations 배열을 포함한 JSON 텍스트)
     */
    String plan(String userQuery, String profileSummary);
}
