package com.cartographer.cognitive.planner;

import lombok.Builder;
import lombok.Value;

/**
 * 计划中的一步
 *
 * 字段含义随 kind 变化:
 * - OPEN_APP: target = 应用名 (显示名)
 * - TAP: target = 元素文本，roleFilter = 可选的类名过滤
 * - TYPE: payload = 要输入的文本
 * - BACK / HOME: 无参数
 */
@Value
@Builder
public class ActionStep {

    ActionKind kind;

    String target;

    String payload;

    String roleFilter;

    public static ActionStep openApp(String appName) {
        return ActionStep.builder().kind(ActionKind.OPEN_APP).target(appName).build();
    }

    public static ActionStep tap(String elementText) {
        return tap(elementText, null);
    }

    public static ActionStep tap(String elementText, String roleFilter) {
        return ActionStep.builder().kind(ActionKind.TAP).target(elementText).roleFilter(roleFilter).build();
    }

    public static ActionStep type(String text) {
        return ActionStep.builder().kind(ActionKind.TYPE).payload(text).build();
    }

    public static ActionStep back() {
        return ActionStep.builder().kind(ActionKind.BACK).build();
    }

    public static ActionStep home() {
        return ActionStep.builder().kind(ActionKind.HOME).build();
    }

    public String describe() {
        String args = switch (kind) {
            case OPEN_APP -> quote(target);
            case TAP -> roleFilter == null ? quote(target) : quote(target) + ", " + quote(roleFilter);
            case TYPE -> quote(payload);
            case BACK, HOME -> "";
        };
        return kind.wireName() + "(" + args + ")";
    }

    private static String quote(String value) {
        return value == null ? "null" : "\"" + value + "\"";
    }
}
