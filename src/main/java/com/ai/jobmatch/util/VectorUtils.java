package com.ai.jobmatch.util;

public class VectorUtils {

    private VectorUtils() {
    }

    /**
     * 코사인 유사도. 어느 한쪽의 노름이 0이면 0을 반환한다.
     */
    public static double cosineSimilarity(float[] vector1, float[] vector2) {
        if (vector1.length != vector2.length) {
            throw new IllegalArgumentException("임베딩 벡터의 차원이 다릅니다: " + vector1.length + " != " + vector2.length);
        }

        double dotProduct = 0.0, normA = 0.0, normB = 0.0;

        for (int i = 0; i < vector1.length; i++) {
            dotProduct += (double) vector1[i] * vector2[i];
            normA += (double) vector1[i] * vector1[i];
            normB += (double) vector2[i] * vector2[i];
        }

        double denominator = Math.sqrt(normA) * Math.sqrt(normB);
        if (denominator == 0.0) {
            return 0.0;
        }
        return dotProduct / denominator;
    }
}
