package com.cartographer.cognitive.oracle;

/**
 * 判定服务调用失败
 */
public class OracleException extends RuntimeException {

    public OracleException(String message) {
        super(message);
    }

    public OracleException(String message, Throwable cause) {
        super(message, cause);
    }
}
