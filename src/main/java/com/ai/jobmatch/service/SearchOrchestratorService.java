package com.ai.jobmatch.service;

import com.ai.jobmatch.dto.SearchVariation;
import com.ai.jobmatch.entity.JobPosting;

import java.util.List;
import java.util.Set;

public interface SearchOrchestratorService {

    /**
     * 검색 변형들을 병렬로 실행하고 id 기준으로 중복을 제거한다.
     * 아무 결과도 없으면 지역 조건 없는 전국 검색을 한 번 더 시도한다. 예외를 던지지 않는다.
     *
     * @param variations    Planner가 만든 검색 변형
     * @param appliedJobIds 후보자가 이미 지원한 공고 id
     * @param rawQuery      변형이 하나도 없을 때 전국 검색에 쓰는 원래 검색어
     */
    List<JobPosting> execute(List<SearchVariation> variations, Set<String> appliedJobIds, String rawQuery);

    default List<JobPosting> execute(List<SearchVariation> variations, Set<String> appliedJobIds) {
        return execute(variations, appliedJobIds, null);
    }
}
