package com.ai.jobmatch.service;

import com.ai.jobmatch.dto.JobSearchFilters;
import com.ai.jobmatch.dto.LocationConstraint;
import com.ai.jobmatch.entity.JobPosting;

import java.util.List;

/**
 * France Travail 채용공고 검색 API 클라이언트
 */
public interface FranceTravailService {

    /**
     * 검색 1회 호출. 204 응답은 빈 목록이고, 그 외 비정상 응답은
     * {@link com.ai.jobmatch.exception.ExternalSearchException}, 토큰 발급 실패는
     * {@link com.ai.jobmatch.exception.ExternalAuthException}으로 전달된다. 재시도는 하지 않는다.
     */
    List<JobPosting> searchJobs(String keywords, LocationConstraint location, JobSearchFilters filters);
}
