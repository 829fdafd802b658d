package com.cartographer.session;

/**
 * 执行目标前没有找到已保存的导航图
 */
public class NavigationGraphMissingException extends RuntimeException {

    public NavigationGraphMissingException(String message) {
        super(message);
    }
}
