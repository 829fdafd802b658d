package com.cartographer.cognitive.executor;

import java.util.List;

/**
 * 一次计划执行的报告
 *
 * @param outcomes       每一步的结果，顺序与计划一致
 * @param success        没有硬失败且没有被中断
 * @param failureMessage 失败原因，成功时为 null
 */
public record ExecutionReport(List<StepOutcome> outcomes, boolean success, String failureMessage) {

    public ExecutionReport {
        outcomes = List.copyOf(outcomes);
    }

    public long countByStatus(StepStatus status) {
        return outcomes.stream().filter(o -> o.status() == status).count();
    }

    public String summary() {
        return String.format("%s: %d done, %d skipped, %d failed, %d not run%s",
                success ? "SUCCESS" : "FAILED",
                countByStatus(StepStatus.DONE),
                countByStatus(StepStatus.SKIPPED),
                countByStatus(StepStatus.FAILED),
                countByStatus(StepStatus.NOT_RUN),
                failureMessage != null ? " (" + failureMessage + ")" : "");
    }
}
