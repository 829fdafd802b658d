package com.cartographer.cognitive.executor;

import com.cartographer.cognitive.planner.ActionStep;

/**
 * 一步的执行结果
 *
 * @param index 步骤下标 (从 0 开始)
 */
public record StepOutcome(int index, ActionStep step, StepStatus status, String detail) {
}
