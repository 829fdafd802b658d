package com.cartographer.cognitive.planner;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * 计划动作词汇表 (封闭集合)
 */
public enum ActionKind {

    OPEN_APP("open_app"),
    TAP("tap"),
    TYPE("type"),
    BACK("back"),
    HOME("home");

    private final String wireName;

    ActionKind(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * 按 JSON 中的动作名查找，忽略大小写
     */
    public static Optional<ActionKind> fromWire(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(k -> k.wireName.equals(normalized))
                .findFirst();
    }
}
