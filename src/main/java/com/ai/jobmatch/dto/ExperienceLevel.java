package com.ai.jobmatch.dto;

import java.util.Locale;

public enum ExperienceLevel {
    NONE("1"),
    JUNIOR("1"),
    MID("2"),
    SENIOR("3");

    // France Travail "experience" 코드
    private final String code;

    ExperienceLevel(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    /**
     * 알 수 없는 값은 null (필터 미적용)
     */
    public static ExperienceLevel parse(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "none" -> NONE;
            case "junior", "1" -> JUNIOR;
            case "mid", "intermediate", "2" -> MID;
            case "senior", "3" -> SENIOR;
            default -> null;
        };
    }
}
