package com.ai.jobmatch.service.impl;

import com.ai.jobmatch.config.JobSearchConfig;
import com.ai.jobmatch.dto.ExperienceLevel;
import com.ai.jobmatch.dto.ExperienceRequirement;
import com.ai.jobmatch.dto.LocationType;
import com.ai.jobmatch.dto.SearchVariation;
import com.ai.jobmatch.exception.ReasoningException;
import com.ai.jobmatch.model.Planner;
import com.ai.jobmatch.service.QueryPlannerService;
import com.ai.jobmatch.util.PartialJsonParser;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;

@Service
@RequiredArgsConstructor
@Slf4j
public class QueryPlannerServiceImpl implements QueryPlannerService {

    private final Planner planner;
    private final JobSearchConfig config;

    @Override
    public List<SearchVariation> predict(String userQuery, String profileSummary) {
        log.info("검색 계획 생성 시작 - 질의: '{}'", userQuery);

        try {
            String response = planner.plan(userQuery, profileSummary);
            JsonNode root = PartialJsonParser.parse(response)
                    .orElseThrow(() -> new ReasoningException("Planner 응답을 JSON으로 해석할 수 없습니다."));

            if (root.hasNonNull("rationale")) {
                log.info("Planner 근거: {}", root.get("rationale").asText());
            }

            List<SearchVariation> variations = new ArrayList<>();
            for (JsonNode node : flattenVariations(root)) {
                SearchVariation variation = toVariation(node);
                if (variation != null) {
                    variations.add(variation);
                }
                if (variations.size() >= config.getMaxVariations()) {
                    break;
                }
            }

            if (variations.isEmpty()) {
                throw new ReasoningException("Planner 응답에 유효한 검색 변형이 없습니다.");
            }

            log.info("검색 변형 {}개 생성: {}", variations.size(),
                    variations.stream().map(SearchVariation::getKeywords).toList());
            return variations;

        } catch (Exception e) {
            log.error("검색 계획 생성 실패, 검색어 그대로 사용: {}", e.getMessage());
            return List.of(SearchVariation.fallback(userQuery));
        }
    }

    /**
     * 응답 구조를 변형 객체의 평탄한 목록으로 정규화한다.
     * 허용 형태: {"variations": [...]}, 최상위 배열, 단일 변형 객체. 배열 안의 중첩 배열은 순서를 유지하며 펼친다.
     */
    static List<JsonNode> flattenVariations(JsonNode root) {
        JsonNode container;
        if (root.isArray()) {
            container = root;
        } else if (root.has("variations")) {
            container = root.get("variations");
        } else {
            container = root;
        }

        List<JsonNode> flat = new ArrayList<>();
        Deque<JsonNode> stack = new ArrayDeque<>();
        stack.push(container);

        while (!stack.isEmpty()) {
            JsonNode node = stack.pop();
            if (node.isArray()) {
                // 역순으로 넣어야 원래 순서대로 꺼낸다
                for (int i = node.size() - 1; i >= 0; i--) {
                    stack.push(node.get(i));
                }
            } else if (node.isObject()) {
                flat.add(node);
            }
        }
        return flat;
    }

    private SearchVariation toVariation(JsonNode node) {
        String keywords = text(node, "keywords");
        if (keywords == null) {
            return null;
        }

        return SearchVariation.builder()
                .keywords(keywords)
                .locationRaw(text(node, "location_raw"))
                .locationType(LocationType.parse(text(node, "location_type")))
                .experienceLevel(ExperienceLevel.parse(text(node, "experience_level")))
                .experienceRequirement(ExperienceRequirement.parse(firstText(node, "experience_requirement", "experience_exigence")))
                .contractType(contractType(text(node, "contract_type")))
                .fullTime(bool(firstNode(node, "full_time", "is_full_time")))
                .build();
    }

    private static String contractType(String value) {
        return value == null ? null : value.toUpperCase(Locale.ROOT);
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        String text = value.asText().trim();
        return text.isEmpty() || "null".equalsIgnoreCase(text) ? null : text;
    }

    private static String firstText(JsonNode node, String... fields) {
        for (String field : fields) {
            String value = text(node, field);
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    private static JsonNode firstNode(JsonNode node, String... fields) {
        for (String field : fields) {
            JsonNode value = node.get(field);
            if (value != null && !value.isNull()) {
                return value;
            }
        }
        return null;
    }

    private static Boolean bool(JsonNode value) {
        if (value == null) {
            return null;
        }
        if (value.isBoolean()) {
            return value.booleanValue();
        }
        String text = value.asText().trim().toLowerCase(Locale.ROOT);
        if ("true".equals(text)) {
            return true;
        }
        if ("false".equals(text)) {
            return false;
        }
        return null;
    }
}
