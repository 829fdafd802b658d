package com.cartographer.cognitive.oracle;

import com.cartographer.service.llm.LlmFactory;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatLanguageModel;
import dev.langchain4j.model.output.Response;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * 基于 LangChain4j ChatLanguageModel 的判定服务
 *
 * 模型实例延迟到第一次调用时才从 {@link LlmFactory} 获取，未配置 api-key 时应用仍可启动。
 */
@Slf4j
public class LlmJudgmentOracle implements JudgmentOracle {

    private final LlmFactory llmFactory;
    private final String modelAlias;
    private final String purpose;

    public LlmJudgmentOracle(LlmFactory llmFactory, String modelAlias, String purpose) {
        this.llmFactory = llmFactory;
        this.modelAlias = modelAlias;
        this.purpose = purpose;
    }

    @Override
    public String complete(String prompt) {
        ChatLanguageModel model;
        try {
            model = llmFactory.getModel(modelAlias);
        } catch (IllegalArgumentException e) {
            throw new OracleException("[" + purpose + "] 模型不可用: " + e.getMessage(), e);
        }

        long start = System.currentTimeMillis();
        try {
            Response<AiMessage> response = model.generate(List.of(UserMessage.from(prompt)));
            String text = response == null || response.content() == null ? null : response.content().text();
            if (text == null || text.isBlank()) {
                throw new OracleException("[" + purpose + "] 模型返回空响应");
            }
            log.debug("🤖 [{}] 响应 {} 字符, 耗时 {}ms", purpose, text.length(), System.currentTimeMillis() - start);
            return text;
        } catch (OracleException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new OracleException("[" + purpose + "] 模型调用失败: " + e.getMessage(), e);
        }
    }
}
