package com.ai.jobmatch.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;

import java.util.Optional;

/**
 * LLM 응답에서 JSON을 꺼낸다. 마크다운 코드 블록과 앞뒤 설명문을 제거하고,
 * 응답이 잘린 경우에는 완전한 객체들만 모아 배열로 돌려준다.
 */
public class PartialJsonParser {

    private static final ObjectMapper mapper = new ObjectMapper();

    private PartialJsonParser() {
    }

    public static Optional<JsonNode> parse(String response) {
        if (response == null || response.isBlank()) {
            return Optional.empty();
        }

        String cleaned = cleanJsonString(response);

        // 1. 전체 JSON이 유효한지 먼저 확인
        Optional<JsonNode> whole = readTree(cleaned);
        if (whole.isPresent()) {
            return whole;
        }

        // 2. 앞뒤 설명문이 붙은 경우 JSON 부분만 잘라서 시도
        int start = firstJsonStart(cleaned);
        if (start < 0) {
            return Optional.empty();
        }
        char open = cleaned.charAt(start);
        int end = cleaned.lastIndexOf(open == '{' ? '}' : ']');
        if (end > start) {
            Optional<JsonNode> sliced = readTree(cleaned.substring(start, end + 1));
            if (sliced.isPresent()) {
                return sliced;
            }
        }

        // 3. 잘린 응답: 완전한 객체만 추출
        ArrayNode objects = extractCompleteObjects(cleaned.substring(start));
        return objects.isEmpty() ? Optional.empty() : Optional.of(objects);
    }

    /**
     * 중첩 깊이와 상관없이 닫힌 객체 중 가장 안쪽(다른 객체를 포함하지 않는) 객체들을 순서대로 모은다.
     */
    static ArrayNode extractCompleteObjects(String json) {
        ArrayNode result = mapper.createArrayNode();
        int startIndex = -1;
        boolean inString = false;
        boolean escaped = false;

        for (int i = 0; i < json.length(); i++) {
            char c = json.charAt(i);

            if (escaped) {
                escaped = false;
                continue;
            }
            if (c == '\\') {
                escaped = true;
                continue;
            }
            if (c == '"') {
                inString = !inString;
                continue;
            }
            if (inString) {
                continue;
            }

            if (c == '{') {
                startIndex = i;
            } else if (c == '}') {
                if (startIndex != -1) {
                    readTree(json.substring(startIndex, i + 1)).ifPresent(result::add);
                    startIndex = -1;
                }
            }
        }

        return result;
    }

    private static int firstJsonStart(String text) {
        int brace = text.indexOf('{');
        int bracket = text.indexOf('[');
        if (brace < 0) {
            return bracket;
        }
        if (bracket < 0) {
            return brace;
        }
        return Math.min(brace, bracket);
    }

    /**
     * JSON 문자열 정리
     */
    private static String cleanJsonString(String json) {
        return json.trim()
                .replaceFirst("^```(?:json)?\\s*", "")
                .replaceFirst("\\s*```$", "")
                .trim();
    }

    private static Optional<JsonNode> readTree(String json) {
        try {
            JsonNode node = mapper.readTree(json);
            if (node == null || node.isMissingNode() || !node.isContainerNode()) {
                return Optional.empty();
            }
            return Optional.of(node);
        } catch (Exception e) {
            return Optional.empty();
        }
    }
}
