package com.ai.jobmatch.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "job-search")
public class JobSearchConfig {

    /**
     * 사용자 검색어가 없을 때 Planner에 넘기는 기본 질의
     */
    private String defaultQuery = "Find jobs matching my profile";

    /**
     * Planner가 반환할 수 있는 최대 검색 변형 수
     */
    private int maxVariations = 3;

    private Ranking ranking = new Ranking();

    @Data
    public static class Ranking {
        /**
         * 프로필 텍스트 최대 길이 (임베딩 모델 입력 제한, 약 2048 토큰)
         */
        private int profileMaxChars = 8000;

        /**
         * 공고 설명 최대 길이
         */
        private int descriptionMaxChars = 2000;

        /**
         * 제목이 없을 때 임베딩 대상이 되기 위한 최소 설명 길이
         */
        private int minDescriptionChars = 10;

        /**
         * 한 번에 임베딩하는 최대 공고 수
         */
        private int batchCap = 100;

        /**
         * 하이브리드 점수에서 검색어 유사도 가중치 (나머지는 프로필)
         */
        private double queryWeight = 0.7;

        /**
         * 임베딩 호출 대기 시간 (초)
         */
        private int embeddingTimeoutSeconds = 60;
    }
}
