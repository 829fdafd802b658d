package com.cartographer.cognitive.executor;

/**
 * 单步执行状态
 */
public enum StepStatus {
    /** 已执行 */
    DONE,
    /** 参数缺失，软失败，继续后续步骤 */
    SKIPPED,
    /** 硬失败，运行终止 */
    FAILED,
    /** 因前面的硬失败未执行 */
    NOT_RUN
}
