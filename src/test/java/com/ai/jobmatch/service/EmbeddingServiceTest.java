package com.ai.jobmatch.service;

import com.ai.jobmatch.config.AiModelConfig;
import com.ai.jobmatch.exception.RankingUnavailableException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EmbeddingServiceTest {

    @Test
    void missingApiKeyDisablesRanking() {
        EmbeddingService service = new EmbeddingService(new AiModelConfig());
        service.init();

        assertThat(service.isAvailable()).isFalse();
        assertThatThrownBy(() -> service.embedQuery("python")).isInstanceOf(RankingUnavailableException.class);
        assertThatThrownBy(() -> service.embedDocuments(List.of("python")))
                .isInstanceOf(RankingUnavailableException.class);
    }

    @Test
    void unsupportedModelTypeDisablesRanking() {
        AiModelConfig config = new AiModelConfig();
        config.setModelType("word2vec");
        EmbeddingService service = new EmbeddingService(config);
        service.init();

        assertThat(service.isAvailable()).isFalse();
    }
}
