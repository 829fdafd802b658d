package com.cartographer.cognitive.classify;

import com.cartographer.cognitive.oracle.JudgmentOracle;
import com.cartographer.cognitive.oracle.OracleException;
import com.cartographer.perception.UiElement;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 屏幕分类客户端
 *
 * 一次判定调用同时完成屏幕识别和元素分类:
 * - 只提交可点击元素，每个元素分配从 0 开始的连续位置 id，仅用于关联响应
 * - 没有可点击元素时直接失败，不调用判定服务
 * - 屏幕命名交给判定服务: 语义相同的屏幕复用已知名字，否则新建
 *
 * 任何失败 (不可达、非 JSON、结构不符) 都以 empty 返回，调用方把该屏幕当作死路。
 */
@Slf4j
@Service
public class ScreenClassifier {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final JudgmentOracle oracle;

    public ScreenClassifier(@Qualifier("classificationOracle") JudgmentOracle oracle) {
        this.oracle = oracle;
    }

    public Optional<ScreenAnalysis> classify(List<UiElement> elements, List<String> knownScreenNames) {
        List<UiElement> submitted = elements.stream()
                .filter(UiElement::isClickable)
                .toList();

        if (submitted.isEmpty()) {
            log.info("屏幕上没有可点击元素，跳过分类");
            return Optional.empty();
        }

        String prompt;
        try {
            prompt = buildPrompt(submitted, knownScreenNames);
        } catch (JsonProcessingException e) {
            log.error("构建分类提示词失败", e);
            return Optional.empty();
        }

        String response;
        try {
            response = oracle.complete(prompt);
        } catch (OracleException e) {
            log.error("❌ 屏幕分类调用失败: {}", e.getMessage());
            return Optional.empty();
        }

        try {
            ClassificationSchema.ParsedAnalysis parsed = ClassificationSchema.parse(response, submitted.size());
            List<ScreenAnalysis.ClassifiedElement> classified = new ArrayList<>();
            for (ClassificationSchema.Entry entry : parsed.entries()) {
                classified.add(new ScreenAnalysis.ClassifiedElement(submitted.get(entry.id()), entry.classification()));
            }
            log.debug("分类完成: screen={}, {} / {} 个元素有分类",
                    parsed.screenName(), classified.size(), submitted.size());
            return Optional.of(new ScreenAnalysis(parsed.screenName(), classified));
        } catch (JsonProcessingException | IllegalArgumentException | ClassificationException e) {
            log.error("❌ 分类响应无效: {} | 响应: {}", e.getMessage(), abbreviate(response));
            return Optional.empty();
        }
    }

    private String buildPrompt(List<UiElement> submitted, List<String> knownScreenNames) throws JsonProcessingException {
        ArrayNode elementsJson = MAPPER.createArrayNode();
        for (int i = 0; i < submitted.size(); i++) {
            UiElement element = submitted.get(i);
            ObjectNode node = elementsJson.addObject();
            node.put("id", i);
            node.put("resource_id", element.getResourceId());
            node.put("text", element.getText());
            node.put("content_description", element.getLabel());
            node.put("class_name", element.getRole());
        }

        String knownJson = MAPPER.writeValueAsString(knownScreenNames);
        String elementsText = MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(elementsJson);
        return ClassificationPrompts.ANALYSIS_TEMPLATE.formatted(knownJson, elementsText);
    }

    private static String abbreviate(String str) {
        if (str == null) {
            return "null";
        }
        return str.length() > 300 ? str.substring(0, 300) + "..." : str;
    }
}
