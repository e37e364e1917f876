package com.ai.jobmatch.util;

public class TextUtils {

    private TextUtils() {
    }

    public static String nullToEmpty(String text) {
        return text == null ? "" : text;
    }

    /**
     * 앞에서부터 maxLength자까지만 남긴다 (임베딩 모델 입력 제한 대응)
     */
    public static String truncate(String text, int maxLength) {
        if (text == null) {
            return "";
        }
        if (text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength);
    }

    public static boolean isBlank(String text) {
        return text == null || text.trim().isEmpty();
    }
}
