package com.ai.jobmatch.service;

import com.ai.jobmatch.config.AiModelConfig;
import com.ai.jobmatch.exception.RankingUnavailableException;
import com.ai.jobmatch.model.Embedder;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.embedding.onnx.allminilml6v2.AllMiniLmL6V2EmbeddingModel;
import dev.langchain4j.model.googleai.GoogleAiEmbeddingModel;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * LangChain4j 임베딩 모델 어댑터.
 * Gemini는 질의용(RETRIEVAL_QUERY)과 문서용(RETRIEVAL_DOCUMENT) 모델을 따로 만든다.
 * API 키가 없으면 초기화는 성공하고 isAvailable()만 false가 된다.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EmbeddingService implements Embedder {

    private final AiModelConfig config;

    private EmbeddingModel queryModel;
    private EmbeddingModel documentModel;

    @PostConstruct
    public void init() {
        log.info("=== EmbeddingService 초기화 시작 ===");
        log.info("Model Type: {}", config.getModelType());

        try {
            switch (config.getModelType().toLowerCase()) {
                case "onnx" -> initOnnxModel();
                case "openai" -> {
                    if (hasKey(config.getOpenai().getApiKey())) {
                        initOpenAiModel();
                    } else {
                        log.warn("OpenAI API Key가 설정되지 않았습니다. 랭킹이 비활성화됩니다.");
                    }
                }
                case "gemini" -> {
                    if (hasKey(config.getGemini().getApiKey())) {
                        initGeminiModel();
                    } else {
                        log.warn("Gemini API Key가 설정되지 않았습니다. 랭킹이 비활성화됩니다.");
                    }
                }
                default -> log.warn("지원하지 않는 임베딩 모델 타입: {}. 랭킹이 비활성화됩니다.", config.getModelType());
            }
        } catch (Exception e) {
            log.error("임베딩 모델 생성 실패, 랭킹이 비활성화됩니다.", e);
            queryModel = null;
            documentModel = null;
        }

        log.info("=== EmbeddingService 초기화 완료 (available={}) ===", isAvailable());
    }

    private void initOnnxModel() {
        log.info("ONNX 모델 생성 시작...");
        queryModel = new AllMiniLmL6V2EmbeddingModel();
        documentModel = queryModel;
        log.info("ONNX 모델 생성 완료");
    }

    private void initOpenAiModel() {
        log.info("OpenAI 모델 생성 시작...");
        var openai = config.getOpenai();
        var builder = OpenAiEmbeddingModel.builder()
                .apiKey(openai.getApiKey())
                .timeout(Duration.ofSeconds(config.getTimeoutSeconds()));

        if (openai.getBaseUrl() != null && !openai.getBaseUrl().isBlank()) {
            builder.baseUrl(openai.getBaseUrl());
        }
        if (openai.getEmbeddingModel() != null) {
            builder.modelName(openai.getEmbeddingModel());
        }
        if (config.getTargetDimensions() != null) {
            builder.dimensions(config.getTargetDimensions());
        }

        queryModel = builder.build();
        documentModel = queryModel;
        log.info("OpenAI 모델 생성 완료 - Model: {}", openai.getEmbeddingModel() != null ? openai.getEmbeddingModel() : "default");
    }

    private void initGeminiModel() {
        log.info("Gemini 모델 생성 시작...");
        var gemini = config.getGemini();

        queryModel = geminiModel(GoogleAiEmbeddingModel.TaskType.RETRIEVAL_QUERY);
        documentModel = geminiModel(GoogleAiEmbeddingModel.TaskType.RETRIEVAL_DOCUMENT);

        log.info("Gemini 모델 생성 완료 - Model: {}", gemini.getEmbeddingModel());
    }

    private EmbeddingModel geminiModel(GoogleAiEmbeddingModel.TaskType taskType) {
        var builder = GoogleAiEmbeddingModel.builder()
                .apiKey(config.getGemini().getApiKey())
                .modelName(config.getGemini().getEmbeddingModel())
                .taskType(taskType)
                .timeout(Duration.ofSeconds(config.getTimeoutSeconds()));

        if (config.getTargetDimensions() != null) {
            builder.outputDimensionality(config.getTargetDimensions());
        }
        return builder.build();
    }

    private static boolean hasKey(String apiKey) {
        return apiKey != null && !apiKey.isBlank();
    }

    @Override
    public boolean isAvailable() {
        return queryModel != null && documentModel != null;
    }

    @Override
    public float[] embedQuery(String text) {
        if (!isAvailable()) {
            throw new RankingUnavailableException("임베딩 모델을 사용할 수 없습니다.");
        }
        if (text == null || text.trim().isEmpty()) {
            throw new IllegalArgumentException("임베딩할 텍스트가 비어있습니다.");
        }
        try {
            return queryModel.embed(text).content().vector();
        } catch (Exception e) {
            log.error("질의 임베딩 생성 실패 - 길이: {}", text.length(), e);
            throw new RankingUnavailableException("임베딩 생성에 실패했습니다.", e);
        }
    }

    @Override
    public List<float[]> embedDocuments(List<String> texts) {
        if (!isAvailable()) {
            throw new RankingUnavailableException("임베딩 모델을 사용할 수 없습니다.");
        }
        if (texts.isEmpty()) {
            return List.of();
        }

        List<TextSegment> segments = new ArrayList<>(texts.size());
        for (String text : texts) {
            segments.add(TextSegment.from(text));
        }

        List<Embedding> embeddings;
        try {
            embeddings = documentModel.embedAll(segments).content();
        } catch (Exception e) {
            log.error("문서 임베딩 생성 실패 - 문서 수: {}", texts.size(), e);
            throw new RankingUnavailableException("일괄 임베딩 생성에 실패했습니다.", e);
        }

        if (embeddings == null || embeddings.size() != texts.size()) {
            throw new RankingUnavailableException("임베딩 결과 수가 입력과 다릅니다: "
                    + (embeddings == null ? 0 : embeddings.size()) + " != " + texts.size());
        }

        List<float[]> vectors = new ArrayList<>(embeddings.size());
        for (Embedding embedding : embeddings) {
            vectors.add(embedding.vector());
        }
        return vectors;
    }
}
