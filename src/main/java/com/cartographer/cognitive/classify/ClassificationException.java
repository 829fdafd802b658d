package com.cartographer.cognitive.classify;

/**
 * 分类响应不符合约定的结构
 */
public class ClassificationException extends RuntimeException {

    public ClassificationException(String message) {
        super(message);
    }

    public ClassificationException(String message, Throwable cause) {
        super(message, cause);
    }
}
