package com.cartographer.perception;

/**
 * bounds 字符串无法解析时抛出
 */
public class BoundsParseException extends Exception {

    private final String raw;

    public BoundsParseException(String raw, String message) {
        super(message + ": '" + raw + "'");
        this.raw = raw;
    }

    public BoundsParseException(String raw, String message, Throwable cause) {
        super(message + ": '" + raw + "'", cause);
        this.raw = raw;
    }

    public String getRaw() {
        return raw;
    }
}
