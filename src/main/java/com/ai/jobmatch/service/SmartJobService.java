package com.ai.jobmatch.service;

import com.ai.jobmatch.entity.JobPosting;

import java.util.List;

public interface SmartJobService {

    /**
     * 후보자 프로필 기반 검색: 검색 계획 → 병렬 검색 → 관련도 순위.
     *
     * @param query 비어 있으면 프로필만으로 검색하고 순위도 프로필 점수만 사용
     * @throws com.ai.jobmatch.exception.CandidateNotFoundException 후보자가 없을 때
     */
    List<JobPosting> smartSearch(String candidateId, String query);
}
