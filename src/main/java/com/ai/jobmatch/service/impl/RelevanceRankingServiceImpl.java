package com.ai.jobmatch.service.impl;

import com.ai.jobmatch.config.JobSearchConfig;
import com.ai.jobmatch.entity.JobPosting;
import com.ai.jobmatch.model.Embedder;
import com.ai.jobmatch.service.RelevanceRankingService;
import com.ai.jobmatch.util.TextUtils;
import com.ai.jobmatch.util.VectorUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

@Service
@Slf4j
public class RelevanceRankingServiceImpl implements RelevanceRankingService {

    static final String NOT_RANKED = "not ranked";

    private final Embedder embedder;
    private final JobSearchConfig.Ranking ranking;
    private final Executor embeddingExecutor;

    public RelevanceRankingServiceImpl(Embedder embedder,
                                       JobSearchConfig jobSearchConfig,
                                       @Qualifier("embeddingExecutor") Executor embeddingExecutor) {
        this.embedder = embedder;
        this.ranking = jobSearchConfig.getRanking();
        this.embeddingExecutor = embeddingExecutor;
    }

    @Override
    public List<JobPosting> rank(String profileSummary, List<JobPosting> jobs, String query) {
        if (jobs == null || jobs.isEmpty()) {
            return jobs;
        }
        if (!embedder.isAvailable()) {
            log.warn("임베딩 모델을 사용할 수 없어 순위 없이 반환합니다");
            return jobs;
        }

        boolean hasQuery = !TextUtils.isBlank(query);

        // 임베딩 대상 선별: 텍스트가 부족하거나 배치 한도를 넘는 공고는 제외
        List<JobPosting> candidates = new ArrayList<>();
        List<String> documents = new ArrayList<>();
        List<JobPosting> excluded = new ArrayList<>();
        for (JobPosting job : jobs) {
            String title = TextUtils.nullToEmpty(job.getTitle());
            String description = TextUtils.truncate(TextUtils.nullToEmpty(job.getDescription()), ranking.getDescriptionMaxChars());

            if ((title.isEmpty() && description.length() < ranking.getMinDescriptionChars())
                    || candidates.size() >= ranking.getBatchCap()) {
                excluded.add(job);
                continue;
            }
            candidates.add(job);
            documents.add("Title: " + title + "\nDescription: " + description);
        }

        if (candidates.isEmpty()) {
            log.info("임베딩 가능한 공고가 없습니다 ({}개 모두 제외)", jobs.size());
            excluded.forEach(job -> job.markRanked(0, NOT_RANKED));
            return jobs;
        }

        String profileText = TextUtils.truncate(TextUtils.nullToEmpty(profileSummary), ranking.getProfileMaxChars());

        try {
            // 블로킹 임베딩 호출은 전용 풀에서 실행
            CompletableFuture<float[]> profileFuture =
                    CompletableFuture.supplyAsync(() -> embedder.embedQuery(profileText), embeddingExecutor);
            CompletableFuture<float[]> queryFuture = hasQuery
                    ? CompletableFuture.supplyAsync(() -> embedder.embedQuery(query), embeddingExecutor)
                    : CompletableFuture.completedFuture(null);
            CompletableFuture<List<float[]>> documentsFuture =
                    CompletableFuture.supplyAsync(() -> embedder.embedDocuments(documents), embeddingExecutor);

            long timeout = ranking.getEmbeddingTimeoutSeconds();
            float[] profileVector = profileFuture.get(timeout, TimeUnit.SECONDS);
            float[] queryVector = queryFuture.get(timeout, TimeUnit.SECONDS);
            List<float[]> jobVectors = documentsFuture.get(timeout, TimeUnit.SECONDS);

            if (jobVectors == null || jobVectors.size() != candidates.size()) {
                log.warn("임베딩 결과 수 불일치: 요청 {}개, 응답 {}개", candidates.size(),
                        jobVectors == null ? 0 : jobVectors.size());
                return jobs;
            }

            int[] scores = new int[candidates.size()];
            for (int i = 0; i < candidates.size(); i++) {
                float[] jobVector = jobVectors.get(i);
                double profileSimilarity = VectorUtils.cosineSimilarity(jobVector, profileVector);
                double querySimilarity = hasQuery ? VectorUtils.cosineSimilarity(jobVector, queryVector) : 0.0;
                scores[i] = score(profileSimilarity, querySimilarity, hasQuery);
            }

            List<JobPosting> ranked = new ArrayList<>(jobs.size());
            for (int i = 0; i < candidates.size(); i++) {
                candidates.get(i).markRanked(scores[i], reasoning(scores[i], hasQuery));
                ranked.add(candidates.get(i));
            }
            // List.sort는 안정 정렬이므로 동점은 입력 순서 유지
            ranked.sort(Comparator.comparingInt(JobPosting::getRelevanceScore).reversed());

            for (JobPosting job : excluded) {
                job.markRanked(0, NOT_RANKED);
                ranked.add(job);
            }

            log.info("공고 {}개 순위 산정 완료 (제외 {}개, 검색어 반영: {})", candidates.size(), excluded.size(), hasQuery);
            return ranked;

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("임베딩 대기 중 인터럽트, 순위 없이 반환합니다");
            return jobs;
        } catch (Exception e) {
            log.error("순위 산정 실패, 순위 없이 반환합니다: {}", e.getMessage());
            return jobs;
        }
    }

    /**
     * 하이브리드 점수. 검색어가 있으면 검색어 유사도 70%, 프로필 유사도 30%.
     */
    int score(double profileSimilarity, double querySimilarity, boolean hasQuery) {
        double raw = hasQuery
                ? ranking.getQueryWeight() * querySimilarity * 100 + (1 - ranking.getQueryWeight()) * profileSimilarity * 100
                : profileSimilarity * 100;
        long rounded = Math.round(raw);
        return (int) Math.max(0, Math.min(100, rounded));
    }

    static String reasoning(int score, boolean hasQuery) {
        String label;
        if (score >= 85) {
            label = "excellent match";
        } else if (score >= 70) {
            label = "strong match";
        } else if (score >= 50) {
            label = "moderate match";
        } else {
            label = "limited relevance";
        }
        if (score >= 60) {
            label += hasQuery ? " - aligned with your search" : " - aligned with your profile";
        }
        return label;
    }
}
