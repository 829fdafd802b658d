package com.cartographer.crawler;

/**
 * 点击后何时执行一次返回导航
 */
public enum ReturnNavigationPolicy {

    /**
     * 前台应用 (Activity) 在点击前后发生变化才返回；
     * 未变化视为同一应用内的状态变化，不返回，否则可能直接退出应用
     */
    FOREGROUND_APP,

    /**
     * 目标屏幕标识与源屏幕不同就返回
     */
    SCREEN_IDENTITY
}
