package com.cartographer.cognitive.executor;

/**
 * 硬失败: 终止本次运行
 */
class StepFailedException extends Exception {

    StepFailedException(String message) {
        super(message);
    }
}
