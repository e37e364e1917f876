package com.ai.jobmatch.service;

import com.ai.jobmatch.config.AiModelConfig;
import com.ai.jobmatch.exception.ReasoningException;
import com.ai.jobmatch.model.Planner;
import dev.langchain4j.model.chat.ChatLanguageModel;
import dev.langchain4j.model.googleai.GoogleAiGeminiChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * LangChain4j 채팅 모델 기반 Planner.
 * 검색어와 프로필을 받아 France Travail 검색 변형 목록(JSON)을 생성한다.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReasoningService implements Planner {

    private final AiModelConfig config;

    private ChatLanguageModel chatModel;

    // 지역 코드 참고표 (모델이 "Sud", "Bretagne" 같은 표현을 레지옹으로 매핑하도록)
    private static final String REGION_CODES = """
            01: Guadeloupe
            02: Martinique
            03: Guyane
            04: La Réunion
            06: Mayotte
            11: Île-de-France (Paris, suburbs)
            24: Centre-Val de Loire
            27: Bourgogne-Franche-Comté
            28: Normandie
            32: Hauts-de-France (Lille, Nord)
            44: Grand Est (Strasbourg, Alsace)
            52: Pays de la Loire (Nantes)
            53: Bretagne (Rennes, Brest)
            75: Nouvelle-Aquitaine (Bordeaux, Poitiers, Limoges)
            76: Occitanie (Toulouse, Montpellier)
            84: Auvergne-Rhône-Alpes (Lyon, Grenoble)
            93: Provence-Alpes-Côte d'Azur (Marseille, Nice, 'Sud', 'Sud-Est')
            94: Corse
            """;

    @PostConstruct
    public void init() {
        log.info("=== ReasoningService 초기화 시작 - AI Model Type: {} ===", config.getAiModelType());

        try {
            switch (config.getAiModelType().toLowerCase()) {
                case "gemini" -> {
                    if (config.getGemini().getApiKey() != null && !config.getGemini().getApiKey().isBlank()) {
                        chatModel = GoogleAiGeminiChatModel.builder()
                                .apiKey(config.getGemini().getApiKey())
                                .modelName(config.getGemini().getAiChatModel())
                                .temperature(config.getGemini().getTemperature())
                                .timeout(Duration.ofSeconds(config.getTimeoutSeconds()))
                                .build();
                    }
                }
                case "openai" -> {
                    var openai = config.getOpenai();
                    if (openai.getApiKey() != null && !openai.getApiKey().isBlank()) {
                        var builder = OpenAiChatModel.builder()
                                .apiKey(openai.getApiKey())
                                .modelName(openai.getAiChatModel())
                                .temperature(openai.getTemperature())
                                .timeout(Duration.ofSeconds(config.getTimeoutSeconds()));
                        if (openai.getBaseUrl() != null && !openai.getBaseUrl().isBlank()) {
                            builder.baseUrl(openai.getBaseUrl());
                        }
                        chatModel = builder.build();
                    }
                }
                default -> log.warn("지원하지 않는 AI 모델 타입: {}", config.getAiModelType());
            }
        } catch (Exception e) {
            log.error("Planner 모델 생성 실패, 단일 키워드 검색으로 동작합니다.", e);
            chatModel = null;
        }

        if (chatModel == null) {
            log.warn("Planner 모델을 사용할 수 없습니다. 검색어를 그대로 사용합니다.");
        }
        log.info("=== ReasoningService 초기화 완료 ===");
    }

    boolean isAvailable() {
        return chatModel != null;
    }

    @Override
    public String plan(String userQuery, String profileSummary) {
        if (chatModel == null) {
            throw new ReasoningException("Planner 모델이 설정되지 않았습니다.");
        }

        String prompt = createSearchPlanPrompt(userQuery, profileSummary);
        try {
            long startTime = System.currentTimeMillis();
            String response = chatModel.generate(prompt);
            log.info("Planner 응답 수신 - 응답시간: {}ms, 길이: {}",
                    System.currentTimeMillis() - startTime, response == null ? 0 : response.length());
            return response;
        } catch (Exception e) {
            throw new ReasoningException("Planner 호출에 실패했습니다.", e);
        }
    }

    String createSearchPlanPrompt(String userQuery, String profileSummary) {
        return String.format("""
                You are an expert job search assistant for France.
                Translate the user's job search request into a PLAN of 1 to 3 search variations
                for the France Travail job board. The job board only does literal keyword matching,
                so order the variations from precise (the inferred job title) to broad (an alternate
                or literal term). Split compound skill lists into separate variations:
                  BAD:  {"keywords": "Java, Python, React"}
                  GOOD: [{"keywords": "Java"}, {"keywords": "Python"}]

                Rules:
                - location_raw is the place name exactly as the user wrote it (e.g. "Lyon", "Sud"), or null.
                - location_type is one of: region, department, commune, unknown.
                - experience_level is one of: none, junior, mid, senior, or null.
                - experience_requirement is one of: beginner_ok, desired, required, or null.
                - A junior or beginner request implies experience_level "junior" and experience_requirement "beginner_ok".
                - contract_type is a France Travail code (CDI, CDD, MIS, ALE) or null.
                - full_time is true, false or null.

                Reference region codes:
                %s
                Candidate profile:
                %s

                User request:
                %s

                Answer with JSON only, no markdown:
                {"rationale": "<short explanation>", "variations": [{"keywords": "...", "location_raw": null,
                "location_type": "unknown", "experience_level": null, "experience_requirement": null,
                "contract_type": null, "full_time": null}]}
                """, REGION_CODES, profileSummary, userQuery);
    }
}
