package com.ai.jobmatch.service.impl;

import com.ai.jobmatch.dto.JobSearchFilters;
import com.ai.jobmatch.dto.LocationConstraint;
import com.ai.jobmatch.dto.ResolvedLocation;
import com.ai.jobmatch.dto.SearchVariation;
import com.ai.jobmatch.entity.JobPosting;
import com.ai.jobmatch.service.AppliedStatusAnnotator;
import com.ai.jobmatch.service.FranceTravailService;
import com.ai.jobmatch.service.LocationResolverService;
import com.ai.jobmatch.service.SearchOrchestratorService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

@Service
@Slf4j
public class SearchOrchestratorServiceImpl implements SearchOrchestratorService {

    private final FranceTravailService franceTravailService;
    private final LocationResolverService locationResolverService;
    private final AppliedStatusAnnotator appliedStatusAnnotator;
    private final Executor searchExecutor;

    public SearchOrchestratorServiceImpl(FranceTravailService franceTravailService,
                                         LocationResolverService locationResolverService,
                                         AppliedStatusAnnotator appliedStatusAnnotator,
                                         @Qualifier("searchExecutor") Executor searchExecutor) {
        this.franceTravailService = franceTravailService;
        this.locationResolverService = locationResolverService;
        this.appliedStatusAnnotator = appliedStatusAnnotator;
        this.searchExecutor = searchExecutor;
    }

    @Override
    public List<JobPosting> execute(List<SearchVariation> variations, Set<String> appliedJobIds, String rawQuery) {
        List<SearchVariation> plan = variations == null ? List.of() : variations;

        // 1. 변형별 위치 해석 (병렬)
        List<ResolvedLocation> locations = resolveLocations(plan);

        // 2. 1차 검색 + 코뮌 해석시 상위 데파르트망 2차 검색
        List<SearchTask> tasks = new ArrayList<>();
        for (int i = 0; i < plan.size(); i++) {
            SearchVariation variation = plan.get(i);
            ResolvedLocation location = locations.get(i);
            JobSearchFilters filters = variation.toFilters();

            LocationConstraint primary = LocationConstraint.from(location);
            tasks.add(new SearchTask("변형 " + (i + 1) + " 1차", variation.getKeywords(), primary, filters));

            if (needsDepartmentCascade(location, primary)) {
                tasks.add(new SearchTask("변형 " + (i + 1) + " 데파르트망",
                        variation.getKeywords(),
                        LocationConstraint.department(location.getParentDepartmentCode()),
                        filters));
            }
        }

        // 3. 병렬 실행. 개별 실패는 빈 결과로 처리하고 다른 작업에 영향을 주지 않는다.
        log.info("검색 작업 {}개 병렬 실행 (변형 {}개)", tasks.size(), plan.size());
        List<CompletableFuture<List<JobPosting>>> futures = new ArrayList<>(tasks.size());
        for (SearchTask task : tasks) {
            futures.add(submit(task));
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        // 4. 제출 순서대로 병합, 먼저 나온 id 유지
        List<JobPosting> merged = new ArrayList<>();
        Set<String> seenIds = new HashSet<>();
        for (int i = 0; i < futures.size(); i++) {
            List<JobPosting> result = futures.get(i).join();
            int added = 0;
            for (JobPosting job : result) {
                if (job.getId() != null && seenIds.add(job.getId())) {
                    merged.add(job);
                    added++;
                }
            }
            log.info("{} 결과 {}개 (신규 {}개)", tasks.get(i).label(), result.size(), added);
        }

        // 5. 전국 검색 폴백
        if (merged.isEmpty()) {
            String fallbackKeywords = plan.isEmpty() ? rawQuery : plan.get(0).getKeywords();
            merged = nationalFallback(fallbackKeywords);
        }

        // 6. 지원 여부 표시
        appliedStatusAnnotator.annotate(merged, appliedJobIds);
        return merged;
    }

    private List<ResolvedLocation> resolveLocations(List<SearchVariation> plan) {
        List<CompletableFuture<ResolvedLocation>> futures = new ArrayList<>(plan.size());
        for (SearchVariation variation : plan) {
            if (!variation.hasLocation()) {
                futures.add(CompletableFuture.completedFuture(ResolvedLocation.none()));
                continue;
            }
            try {
                futures.add(CompletableFuture
                        .supplyAsync(() -> locationResolverService.resolve(variation.getLocationRaw(), variation.getLocationType()),
                                searchExecutor)
                        .exceptionally(ex -> {
                            log.warn("위치 해석 중 오류, 지역 조건 없이 진행: '{}' - {}", variation.getLocationRaw(), ex.getMessage());
                            return ResolvedLocation.none();
                        }));
            } catch (RejectedExecutionException e) {
                log.warn("검색 풀이 가득 차 위치 해석 생략: '{}' - {}", variation.getLocationRaw(), e.getMessage());
                futures.add(CompletableFuture.completedFuture(ResolvedLocation.none()));
            }
        }

        List<ResolvedLocation> locations = new ArrayList<>(futures.size());
        for (CompletableFuture<ResolvedLocation> future : futures) {
            locations.add(future.join());
        }
        return locations;
    }

    /**
     * 코뮌으로 해석되었고 상위 데파르트망을 알며, 1차 검색이 이미 데파르트망 단위(파리 등)가 아닐 때
     */
    private boolean needsDepartmentCascade(ResolvedLocation location, LocationConstraint primary) {
        return location.getKind() == ResolvedLocation.Kind.COMMUNE
                && location.getParentDepartmentCode() != null
                && !primary.normalized().isDepartmentScoped();
    }

    private CompletableFuture<List<JobPosting>> submit(SearchTask task) {
        CompletableFuture<List<JobPosting>> future;
        try {
            future = CompletableFuture.supplyAsync(
                    () -> franceTravailService.searchJobs(task.keywords(), task.location(), task.filters()),
                    searchExecutor);
        } catch (RejectedExecutionException e) {
            log.warn("{} 검색 작업 거부됨 (검색 풀 포화) - 키워드: '{}'", task.label(), task.keywords());
            return CompletableFuture.completedFuture(List.of());
        }
        return future
                .handle((jobs, ex) -> {
                    if (ex != null) {
                        Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
                        log.warn("{} 검색 실패 - 키워드: '{}', 원인: {}", task.label(), task.keywords(), cause.getMessage());
                        return List.<JobPosting>of();
                    }
                    return jobs == null ? List.<JobPosting>of() : jobs;
                });
    }

    private List<JobPosting> nationalFallback(String keywords) {
        log.info("모든 범위에서 결과 없음, 전국 검색 재시도 - 키워드: '{}'", keywords);
        try {
            List<JobPosting> jobs = franceTravailService.searchJobs(keywords, LocationConstraint.national(), JobSearchFilters.NONE);
            List<JobPosting> result = jobs == null ? new ArrayList<>() : new ArrayList<>(jobs);
            log.info("전국 검색 결과 {}개", result.size());
            return result;
        } catch (Exception e) {
            log.error("전국 검색도 실패했습니다: {}", e.getMessage());
            return new ArrayList<>();
        }
    }

    private record SearchTask(String label, String keywords, LocationConstraint location, JobSearchFilters filters) {
    }
}
