package com.cartographer.cognitive.classify;

import com.cartographer.cognitive.oracle.OracleResponses;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * 屏幕分类响应的解析与校验
 *
 * 期望结构:
 * <pre>
 * {
 *   "screenName": "SettingsScreen",
 *   "elements": [ {"id": 0, "classification": "STATIC_NAVIGATION"} ]
 * }
 * </pre>
 *
 * 结构性错误 (缺 screenName、elements 不是数组、id 不是整数、分类不在封闭集合里) 整体判为无效；
 * 越界 id 逐条拒绝，不会拿去索引；重复 id 只保留第一条。
 */
@Slf4j
public final class ClassificationSchema {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ClassificationSchema() {
    }

    /**
     * @param response       模型原始响应 (可带 markdown 代码块)
     * @param submittedCount 提交的元素个数，合法 id 为 [0, submittedCount)
     * @throws IllegalArgumentException 响应为空
     * @throws JsonProcessingException  不是合法 JSON
     * @throws ClassificationException  JSON 合法但结构不符
     */
    public static ParsedAnalysis parse(String response, int submittedCount) throws JsonProcessingException {
        if (response == null || response.isBlank()) {
            throw new IllegalArgumentException("Classification response is empty");
        }

        JsonNode root = MAPPER.readTree(OracleResponses.stripCodeFence(response));
        if (root == null || !root.isObject()) {
            throw new ClassificationException("Response is not a JSON object");
        }

        JsonNode nameNode = root.get("screenName");
        if (nameNode == null || !nameNode.isTextual() || nameNode.asText().isBlank()) {
            throw new ClassificationException("Missing or blank screenName");
        }
        String screenName = nameNode.asText().trim();

        JsonNode elementsNode = root.get("elements");
        if (elementsNode == null || !elementsNode.isArray()) {
            throw new ClassificationException("'elements' must be an array");
        }

        List<Entry> entries = new ArrayList<>();
        Set<Integer> seen = new HashSet<>();
        for (JsonNode item : elementsNode) {
            if (!item.isObject()) {
                throw new ClassificationException("Element entry is not an object: " + item);
            }
            JsonNode idNode = item.get("id");
            if (idNode == null || !idNode.isIntegralNumber() || !idNode.canConvertToInt()) {
                throw new ClassificationException("Element id is not an integer: " + item);
            }
            JsonNode classNode = item.get("classification");
            Optional<ElementClassification> classification = classNode != null && classNode.isTextual()
                    ? ElementClassification.fromWire(classNode.asText())
                    : Optional.empty();
            if (classification.isEmpty()) {
                throw new ClassificationException("Unknown classification: " + item);
            }

            int id = idNode.asInt();
            if (id < 0 || id >= submittedCount) {
                log.warn("分类响应中的元素 id 越界: {} (合法范围 0..{})，已拒绝", id, submittedCount - 1);
                continue;
            }
            if (!seen.add(id)) {
                log.debug("重复的元素 id {}，保留第一条", id);
                continue;
            }
            entries.add(new Entry(id, classification.get()));
        }

        return new ParsedAnalysis(screenName, entries);
    }

    public record ParsedAnalysis(String screenName, List<Entry> entries) {
    }

    public record Entry(int id, ElementClassification classification) {
    }
}
