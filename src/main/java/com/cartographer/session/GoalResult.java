package com.cartographer.session;

import com.cartographer.cognitive.executor.ExecutionReport;
import com.cartographer.cognitive.planner.ActionStep;

import java.util.List;

/**
 * 一次目标请求的结果: 生成的计划 + 执行报告
 */
public record GoalResult(String goal, List<ActionStep> plan, ExecutionReport report) {

    public GoalResult {
        plan = List.copyOf(plan);
    }

    public boolean success() {
        return report.success();
    }
}
