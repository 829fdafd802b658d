package com.cartographer.service.llm;

import com.cartographer.config.llm.LlmProperties;
import com.cartographer.config.llm.ModelConfig;
import dev.langchain4j.model.chat.ChatLanguageModel;
import dev.langchain4j.model.googleai.GoogleAiGeminiChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * LLM 模型工厂服务
 * 根据配置动态创建和缓存 ChatLanguageModel 实例
 */
@Slf4j
@Service
public class LlmFactory {

    private final LlmProperties llmProperties;

    /**
     * 模型实例缓存
     */
    private final Map<String, ChatLanguageModel> chatModelCache = new ConcurrentHashMap<>();

    public LlmFactory(LlmProperties llmProperties) {
        this.llmProperties = llmProperties;
    }

    /**
     * 获取默认 Chat 模型
     */
    public ChatLanguageModel getModel() {
        return getModel(llmProperties.getDefaultModel());
    }

    /**
     * 获取指定别名的 Chat 模型，别名为空时回退到默认模型
     */
    public ChatLanguageModel getModel(String alias) {
        String effectiveAlias = alias == null || alias.isBlank() ? llmProperties.getDefaultModel() : alias;
        return chatModelCache.computeIfAbsent(effectiveAlias, this::createChatModel);
    }

    private ChatLanguageModel createChatModel(String alias) {
        ModelConfig config = getAndValidateConfig(alias);

        log.info("🔧 创建 Chat 模型实例: alias={}, provider={}, model={}",
                alias, config.getProvider(), config.getModelName());

        return switch (config.getProvider()) {
            case OPENAI -> createOpenAiModel(config);
            case GEMINI -> {
                // GoogleAiGeminiChatModel 不支持自定义 baseUrl，中转站走 OpenAI 兼容接口
                if (config.getBaseUrl() != null && !config.getBaseUrl().isBlank()) {
                    log.info("🔄 Gemini 模型配置了自定义 baseUrl，使用 OpenAI 兼容接口");
                    yield createOpenAiModel(config);
                }
                yield createGeminiModel(config);
            }
        };
    }

    private ModelConfig getAndValidateConfig(String alias) {
        ModelConfig config = llmProperties.getModelConfig(alias);

        if (config == null) {
            throw new IllegalArgumentException(
                    String.format("模型配置 '%s' 不存在。可用的模型: %s",
                            alias, llmProperties.getModels().keySet()));
        }

        if (config.getApiKey() == null || config.getApiKey().isBlank()) {
            throw new IllegalArgumentException(
                    String.format("模型 '%s' 的 api-key 未配置", alias));
        }

        if (config.getModelName() == null || config.getModelName().isBlank()) {
            throw new IllegalArgumentException(
                    String.format("模型 '%s' 的 model-name 未配置", alias));
        }
        return config;
    }

    private ChatLanguageModel createOpenAiModel(ModelConfig config) {
        var builder = OpenAiChatModel.builder()
                .apiKey(config.getApiKey())
                .modelName(config.getModelName())
                .temperature(config.getTemperature())
                .timeout(Duration.ofSeconds(config.getTimeoutSeconds()))
                .maxRetries(config.getMaxRetries());

        if (config.getBaseUrl() != null && !config.getBaseUrl().isBlank()) {
            builder.baseUrl(config.getBaseUrl());
        }

        return builder.build();
    }

    private ChatLanguageModel createGeminiModel(ModelConfig config) {
        return GoogleAiGeminiChatModel.builder()
                .apiKey(config.getApiKey())
                .modelName(config.getModelName())
                .temperature(config.getTemperature())
                .timeout(Duration.ofSeconds(config.getTimeoutSeconds()))
                .maxRetries(config.getMaxRetries())
                .build();
    }

    public boolean isModelAvailable(String alias) {
        ModelConfig config = llmProperties.getModelConfig(alias);
        return config != null
                && config.getApiKey() != null && !config.getApiKey().isBlank()
                && config.getModelName() != null && !config.getModelName().isBlank();
    }

    public Set<String> getAvailableModels() {
        return llmProperties.getModels().keySet();
    }
}
