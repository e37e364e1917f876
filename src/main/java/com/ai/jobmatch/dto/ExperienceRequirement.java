package com.ai.jobmatch.dto;

import java.util.Locale;

public enum ExperienceRequirement {
    BEGINNER_OK("D"),
    DESIRED("S"),
    REQUIRED("E");

    // France Travail "experienceExigence" 코드
    private final String code;

    ExperienceRequirement(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public static ExperienceRequirement parse(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "beginner_ok", "d" -> BEGINNER_OK;
            case "desired", "s" -> DESIRED;
            case "required", "e" -> REQUIRED;
            default -> null;
        };
    }
}
