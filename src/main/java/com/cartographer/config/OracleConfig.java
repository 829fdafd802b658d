package com.cartographer.config;

import com.cartographer.cognitive.oracle.JudgmentOracle;
import com.cartographer.cognitive.oracle.LlmJudgmentOracle;
import com.cartographer.service.llm.LlmFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 分类与规划各自使用一个判定服务实例，模型别名可分别配置
 */
@Configuration
public class OracleConfig {

    @Bean
    public JudgmentOracle classificationOracle(LlmFactory llmFactory, OracleProperties oracleProperties) {
        return new LlmJudgmentOracle(llmFactory, oracleProperties.getClassifierModel(), "classify");
    }

    @Bean
    public JudgmentOracle planningOracle(LlmFactory llmFactory, OracleProperties oracleProperties) {
        return new LlmJudgmentOracle(llmFactory, oracleProperties.getPlannerModel(), "plan");
    }
}
