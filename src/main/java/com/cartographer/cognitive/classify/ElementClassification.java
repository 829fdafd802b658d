package com.cartographer.cognitive.classify;

import java.util.Locale;
import java.util.Optional;

/**
 * 可点击元素的用途分类 (封闭集合)
 */
public enum ElementClassification {

    /**
     * 通往应用固定区域的导航 (设置、个人页、Tab)，总是爬取
     */
    STATIC_NAVIGATION,

    /**
     * 列表项模板 (某个聊天、某篇文章)，每个 resource-id 只爬一个代表
     */
    DYNAMIC_CONTENT_LINK,

    /**
     * 在当前页执行动作 (发送、点赞、删除)，不爬取
     */
    ACTION_BUTTON,

    /**
     * 装饰性或无意义的可点击元素，不爬取
     */
    IGNORE;

    public static Optional<ElementClassification> fromWire(String value) {
        if (value == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(value.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
