package com.ai.jobmatch.dto;

import java.util.Locale;

/**
 * Planner가 추정한 위치 문자열의 종류 (해석 순서 힌트로만 사용)
 */
public enum LocationType {
    REGION,
    DEPARTMENT,
    COMMUNE,
    UNKNOWN;

    public static LocationType parse(String value) {
        if (value == null || value.isBlank()) {
            return UNKNOWN;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "region", "région" -> REGION;
            case "department", "departement", "département" -> DEPARTMENT;
            case "commune", "city", "ville" -> COMMUNE;
            default -> UNKNOWN;
        };
    }
}
