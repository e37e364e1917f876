package com.ai.jobmatch.model;

import java.util.List;

/**
 * 텍스트 임베딩 모델. 모든 호출은 블로킹 네트워크 호출일 수 있다.
 */
public interface Embedder {

    boolean isAvailable();

    /**
     * 검색 질의용 임베딩 (프로필, 검색어)
     */
    float[] embedQuery(String text);

    /**
     * 문서용 일괄 임베딩. 입력 순서와 같은 순서로 반환한다.
     */
    List<float[]> embedDocuments(List<String> texts);
}
