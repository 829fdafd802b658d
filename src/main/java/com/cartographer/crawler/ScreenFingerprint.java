package com.cartographer.crawler;

import com.cartographer.perception.UiElement;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 屏幕的结构指纹: 可点击元素的 (类名, resource-id) 排序后拼接
 *
 * 不看文本，列表内容变化不影响指纹。只用来发现判定服务给同一结构起了不同名字的情况。
 */
final class ScreenFingerprint {

    private ScreenFingerprint() {
    }

    static String of(List<UiElement> elements) {
        return elements.stream()
                .filter(UiElement::isClickable)
                .map(e -> e.getRole() + "#" + (e.getResourceId() == null ? "" : e.getResourceId()))
                .distinct()
                .sorted()
                .collect(Collectors.joining("|"));
    }
}
