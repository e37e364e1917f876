package com.ai.jobmatch.service;

import com.ai.jobmatch.entity.JobPosting;

import java.util.List;

public interface RelevanceRankingService {

    /**
     * 프로필(및 검색어)과 공고의 임베딩 유사도로 점수를 매기고 내림차순 정렬한다.
     * 임베딩을 쓸 수 없으면 입력을 그대로 돌려준다.
     *
     * @param query null 또는 공백이면 프로필 점수만 사용
     */
    List<JobPosting> rank(String profileSummary, List<JobPosting> jobs, String query);
}
