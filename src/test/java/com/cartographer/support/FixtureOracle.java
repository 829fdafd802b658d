package com.cartographer.support;

import com.cartographer.cognitive.oracle.JudgmentOracle;
import com.cartographer.cognitive.oracle.OracleException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 固定响应的判定服务: 提示词包含某个标记文本时返回对应响应
 *
 * 按注册顺序匹配，没有命中时抛 {@link OracleException}。
 */
public class FixtureOracle implements JudgmentOracle {

    private final Map<String, String> responses = new LinkedHashMap<>();
    private final List<String> prompts = new ArrayList<>();

    public FixtureOracle when(String marker, String response) {
        responses.put(marker, response);
        return this;
    }

    public List<String> prompts() {
        return prompts;
    }

    @Override
    public String complete(String prompt) {
        prompts.add(prompt);
        return responses.entrySet().stream()
                .filter(e -> prompt.contains(e.getKey()))
                .map(Map.Entry::getValue)
                .findFirst()
                .orElseThrow(() -> new OracleException("No fixture for prompt"));
    }
}
