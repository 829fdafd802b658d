package com.cartographer;

import com.cartographer.config.CrawlProperties;
import com.cartographer.config.llm.LlmProperties;
import com.cartographer.service.llm.LlmFactory;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Cartographer - Android 应用导航图爬虫 + 目标执行器
 *
 * 核心能力：
 * - Cartographer: 通过模拟点击探索应用，构建屏幕导航图
 * - Conductor: 根据导航图把自然语言目标转为动作序列并执行
 */
@Slf4j
@SpringBootApplication
@RequiredArgsConstructor
public class CartographerApplication {

    private final CrawlProperties crawlProperties;
    private final LlmProperties llmProperties;
    private final LlmFactory llmFactory;

    public static void main(String[] args) {
        SpringApplication.run(CartographerApplication.class, args);
    }

    @PostConstruct
    public void init() {
        log.info("===========================================");
        log.info("   Cartographer 正在启动...");
        log.info("===========================================");
        log.info("📁 会话目录: {}", crawlProperties.getSessionDir());
        String defaultModel = llmProperties.getDefaultModel();
        log.info("🤖 默认模型: {} (可用模型: {})", defaultModel, llmFactory.getAvailableModels());
        if (!llmFactory.isModelAvailable(defaultModel)) {
            log.warn("⚠️ 默认模型 '{}' 未配置 api-key 或 model-name，分类和规划调用将失败", defaultModel);
        }
        log.info("🔁 返回策略: {}, 最大交互次数: {}", crawlProperties.getReturnPolicy(), crawlProperties.getMaxInteractions());
        log.info("API: POST /api/cartographer/crawl | POST /api/cartographer/goal | GET /api/cartographer/status");
    }
}
