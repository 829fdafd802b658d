package com.cartographer.cognitive.planner;

import com.cartographer.cognitive.oracle.JudgmentOracle;
import com.cartographer.cognitive.oracle.OracleException;
import com.cartographer.crawler.NavigationGraph;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * 计划生成服务 (Conductor 规划阶段)
 *
 * 目标文本 + 导航图摘要 -> 规划模型 -> 动作序列。
 * 只做一次生成，不根据执行结果重新规划。
 */
@Slf4j
@Service
public class PlanSynthesizer {

    private final JudgmentOracle oracle;
    private final GraphSummarizer summarizer;

    public PlanSynthesizer(@Qualifier("planningOracle") JudgmentOracle oracle, GraphSummarizer summarizer) {
        this.oracle = oracle;
        this.summarizer = summarizer;
    }

    /**
     * @param goal  自然语言目标
     * @param graph 已探索的导航图 (可为空图)
     * @return 非空动作序列
     * @throws PlanSynthesisException 任何失败，不返回部分计划
     */
    public List<ActionStep> synthesize(String goal, NavigationGraph graph) {
        if (goal == null || goal.isBlank()) {
            throw new PlanSynthesisException("Goal is empty");
        }
        log.info("📋 开始规划目标: {}", goal);

        String prompt = PlanPrompts.PLAN_TEMPLATE.formatted(summarizer.summarize(graph), goal.trim());

        String response;
        try {
            response = oracle.complete(prompt);
        } catch (OracleException e) {
            log.error("❌ 规划调用失败: {}", e.getMessage());
            throw new PlanSynthesisException("Planning oracle failed: " + e.getMessage(), e);
        }

        List<ActionStep> plan;
        try {
            plan = PlanSchema.parse(response);
        } catch (PlanSynthesisException e) {
            log.error("❌ 计划响应无效: {}", e.getMessage());
            throw e;
        }

        log.info("✅ 生成 {} 步计划:", plan.size());
        for (int i = 0; i < plan.size(); i++) {
            log.info("  {}. {}", i + 1, plan.get(i).describe());
        }
        return plan;
    }
}
