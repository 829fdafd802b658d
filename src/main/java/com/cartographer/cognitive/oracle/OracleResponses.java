package com.cartographer.cognitive.oracle;

/**
 * 模型响应文本的清洗工具
 */
public final class OracleResponses {

    private static final String FENCE = "```";

    private OracleResponses() {
    }

    /**
     * 去掉 markdown 代码块包裹 (```json ... ``` 或 ``` ... ```)，返回内部文本
     * 没有代码块时原样返回 (trim 后)
     */
    public static String stripCodeFence(String response) {
        if (response == null) {
            return null;
        }
        String text = response.trim();
        int open = text.indexOf(FENCE);
        if (open < 0) {
            return text;
        }
        int bodyStart = skipLanguageTag(text, open + FENCE.length());
        int close = text.indexOf(FENCE, bodyStart);
        String body = close >= 0 ? text.substring(bodyStart, close) : text.substring(bodyStart);
        return body.trim();
    }

    /**
     * 跳过开头围栏后的语言标记 (```json)，单行与多行写法都适用
     */
    private static int skipLanguageTag(String text, int from) {
        int i = from;
        while (i < text.length() && Character.isLetter(text.charAt(i))) {
            i++;
        }
        if (i == from || i >= text.length()) {
            return from;
        }
        char next = text.charAt(i);
        return Character.isWhitespace(next) || next == '{' || next == '[' ? i : from;
    }
}
