package com.ai.jobmatch.service.impl;

import com.ai.jobmatch.config.JobSearchConfig;
import com.ai.jobmatch.dto.Candidate;
import com.ai.jobmatch.dto.CandidateProfileSummary;
import com.ai.jobmatch.dto.SearchVariation;
import com.ai.jobmatch.entity.JobPosting;
import com.ai.jobmatch.exception.CandidateNotFoundException;
import com.ai.jobmatch.service.CandidateService;
import com.ai.jobmatch.service.QueryPlannerService;
import com.ai.jobmatch.service.RelevanceRankingService;
import com.ai.jobmatch.service.SearchOrchestratorService;
import com.ai.jobmatch.service.SmartJobService;
import com.ai.jobmatch.util.TextUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
@Slf4j
@RequiredArgsConstructor
public class SmartJobServiceImpl implements SmartJobService {

    private final CandidateService candidateService;
    private final QueryPlannerService queryPlannerService;
    private final SearchOrchestratorService searchOrchestratorService;
    private final RelevanceRankingService relevanceRankingService;
    private final JobSearchConfig jobSearchConfig;

    @Override
    public List<JobPosting> smartSearch(String candidateId, String query) {
        long startTime = System.currentTimeMillis();

        Candidate candidate = candidateService.findById(candidateId)
                .orElseThrow(() -> new CandidateNotFoundException(candidateId));

        String profileSummary = CandidateProfileSummary.from(candidate).render();
        String userQuery = TextUtils.isBlank(query) ? null : query.trim();
        String plannerQuery = userQuery != null ? userQuery : jobSearchConfig.getDefaultQuery();

        log.info("스마트 검색 시작 - 후보자: {}, 검색어: '{}'", candidateId, plannerQuery);

        List<SearchVariation> variations = queryPlannerService.predict(plannerQuery, profileSummary);
        List<JobPosting> jobs = searchOrchestratorService.execute(variations, candidate.getAppliedJobIds(), plannerQuery);

        // 순위는 사용자가 입력한 검색어만 반영 (기본 질의는 제외)
        List<JobPosting> ranked = relevanceRankingService.rank(profileSummary, jobs, userQuery);

        log.info("스마트 검색 완료 - 결과 {}개, {}ms", ranked.size(), System.currentTimeMillis() - startTime);
        return ranked;
    }
}
