package com.cartographer.cognitive.planner;

/**
 * 无法为目标生成可执行计划
 */
public class PlanSynthesisException extends RuntimeException {

    public PlanSynthesisException(String message) {
        super(message);
    }

    public PlanSynthesisException(String message, Throwable cause) {
        super(message, cause);
    }
}
