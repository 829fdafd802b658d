package com.cartographer.session;

/**
 * 已有会话在运行，拒绝新的爬取或目标请求
 */
public class SessionBusyException extends RuntimeException {

    public SessionBusyException(String message) {
        super(message);
    }
}
