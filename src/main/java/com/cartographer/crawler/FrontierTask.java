package com.cartographer.crawler;

import com.cartographer.perception.UiElement;

/**
 * 待执行的一次点击: 从 sourceScreenId 上点击 target
 *
 * @param sourceDepth 源屏幕的发现深度
 */
public record FrontierTask(String sourceScreenId, UiElement target, int sourceDepth) {

    public String describe() {
        return target.describe() + " @ " + sourceScreenId;
    }
}
