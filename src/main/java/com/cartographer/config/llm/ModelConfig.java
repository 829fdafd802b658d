package com.cartographer.config.llm;

import lombok.Data;

/**
 * 单个 LLM 模型的配置 POJO
 * 支持的 provider:
 * - OPENAI: OpenAI 兼容接口（包括阿里云 DashScope、Azure OpenAI、各类中转站）
 * - GEMINI: Google Gemini 原生接口
 */
@Data
public class ModelConfig {

    /**
     * 模型提供商类型
     */
    public enum Provider {
        OPENAI,     // OpenAI 兼容接口
        GEMINI      // Google Gemini 原生接口
    }

    private Provider provider = Provider.OPENAI;

    /**
     * API 基础 URL
     */
    private String baseUrl;

    private String apiKey;

    /**
     * 模型名称，例如: qwen-max, gemini-1.5-flash
     */
    private String modelName;

    /**
     * 温度参数 (0.0 - 2.0)
     */
    private Double temperature = 0.2;

    /**
     * 请求超时时间（秒）
     */
    private Integer timeoutSeconds = 60;

    /**
     * 最大重试次数
     */
    private Integer maxRetries = 3;
}
