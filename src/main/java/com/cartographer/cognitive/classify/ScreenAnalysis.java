package com.cartographer.cognitive.classify;

import com.cartographer.perception.UiElement;

import java.util.List;

/**
 * 一次屏幕分类的结果: 屏幕名 + 每个提交元素的分类
 *
 * @param screenName 屏幕标识，爬虫以此作为去重键
 * @param elements   按响应顺序排列，element 为解析得到的原始元素
 */
public record ScreenAnalysis(String screenName, List<ClassifiedElement> elements) {

    public ScreenAnalysis {
        elements = List.copyOf(elements);
    }

    public record ClassifiedElement(UiElement element, ElementClassification classification) {
    }
}
