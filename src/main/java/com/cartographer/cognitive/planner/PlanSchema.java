package com.cartographer.cognitive.planner;

import com.cartographer.cognitive.oracle.OracleResponses;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 计划响应的解析与校验
 *
 * 期望结构:
 * <pre>
 * [
 *   {"action": "open_app", "app_name": "WhatsApp"},
 *   {"action": "tap", "element_text": "Ayush Chaudhary", "element_class_name": "android.widget.TextView"},
 *   {"action": "type", "text": "hi"}
 * ]
 * </pre>
 *
 * 任何一步结构不符都使整个计划无效，不返回部分计划。
 * 缺少目标字段是允许的，由执行器按软失败处理。
 */
public final class PlanSchema {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private PlanSchema() {
    }

    /**
     * @throws PlanSynthesisException 空响应、非 JSON、结构不符、未知动作、空计划
     */
    public static List<ActionStep> parse(String response) {
        if (response == null || response.isBlank()) {
            throw new PlanSynthesisException("Plan response is empty");
        }

        JsonNode root;
        try {
            root = MAPPER.readTree(OracleResponses.stripCodeFence(response));
        } catch (JsonProcessingException e) {
            throw new PlanSynthesisException("Plan response is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isArray()) {
            throw new PlanSynthesisException("Plan must be a JSON array");
        }
        if (root.isEmpty()) {
            throw new PlanSynthesisException("Plan is empty");
        }

        List<ActionStep> steps = new ArrayList<>();
        int index = 0;
        for (JsonNode item : root) {
            steps.add(parseStep(item, index++));
        }
        return List.copyOf(steps);
    }

    private static ActionStep parseStep(JsonNode item, int index) {
        if (!item.isObject()) {
            throw new PlanSynthesisException("Step " + index + " is not an object: " + item);
        }
        JsonNode actionNode = item.get("action");
        if (actionNode == null || !actionNode.isTextual()) {
            throw new PlanSynthesisException("Step " + index + " has no action: " + item);
        }
        ActionKind kind = ActionKind.fromWire(actionNode.asText())
                .orElseThrow(() -> new PlanSynthesisException(
                        "Step " + index + " uses unsupported action '" + actionNode.asText() + "'"));

        String appName = optionalString(item, "app_name", index).orElse(null);
        String elementText = optionalString(item, "element_text", index).orElse(null);
        String text = optionalString(item, "text", index).orElse(null);
        String roleFilter = optionalString(item, "element_class_name", index)
                .or(() -> optionalString(item, "role_filter", index))
                .orElse(null);

        return ActionStep.builder()
                .kind(kind)
                .target(kind == ActionKind.OPEN_APP ? appName : elementText)
                .payload(text)
                .roleFilter(roleFilter)
                .build();
    }

    private static Optional<String> optionalString(JsonNode item, String field, int index) {
        JsonNode node = item.get(field);
        if (node == null || node.isNull()) {
            return Optional.empty();
        }
        if (!node.isTextual()) {
            throw new PlanSynthesisException("Step " + index + " field '" + field + "' must be a string: " + item);
        }
        return Optional.of(node.asText());
    }
}
