package com.cartographer.config.llm;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * LLM 配置属性类
 *
 * 读取 app.llm.models 配置
 *
 * 配置示例:
 * <pre>
 * app.llm.default-model=fast-model
 * app.llm.models.fast-model.provider=OPENAI
 * app.llm.models.fast-model.base-url=https://dashscope.aliyuncs.com/compatible-mode/v1
 * app.llm.models.fast-model.api-key=${ALIYUN_KEY}
 * app.llm.models.fast-model.model-name=qwen-max
 * </pre>
 */
@Data
@Component
@ConfigurationProperties(prefix = "app.llm")
public class LlmProperties {

    /**
     * 模型配置映射
     * Key: 模型别名 (如 fast-model)
     * Value: 模型配置
     */
    private Map<String, ModelConfig> models = new HashMap<>();

    /**
     * 默认模型别名
     * 当调用方未指定模型时使用
     */
    private String defaultModel = "default";

    /**
     * 获取指定别名的模型配置
     *
     * @param alias 模型别名
     * @return 模型配置，如果不存在则返回 null
     */
    public ModelConfig getModelConfig(String alias) {
        return models.get(alias);
    }
}
