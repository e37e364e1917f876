package com.ai.jobmatch.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "langchain")
public class AiModelConfig {
    private String modelType = "gemini"; // 임베딩 모델 타입 (gemini, openai, onnx)
    private String aiModelType = "gemini"; // 검색 계획(Planner) 모델 타입 (gemini, openai)
    private Integer targetDimensions;
    private int timeoutSeconds = 30;

    private OpenAiConfig openai = new OpenAiConfig();
    private GeminiConfig gemini = new GeminiConfig();

    @Data
    public static class OpenAiConfig {
        private String apiKey;
        private String baseUrl; // Groq 등 OpenAI 호환 엔드포인트
        private String embeddingModel;
        private String aiChatModel;
        private double temperature = 0.0;
    }

    @Data
    public static class GeminiConfig {
        private String apiKey;
        private String embeddingModel = "text-embedding-004";
        private String aiChatModel = "gemini-1.5-flash";
        private double temperature = 0.0;
    }
}
