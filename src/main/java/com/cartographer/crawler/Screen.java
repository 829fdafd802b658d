package com.cartographer.crawler;

import com.cartographer.perception.UiElement;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * 导航图中的一个屏幕
 *
 * 按标识只创建一次，重访不会替换。elements 是发现时采集的全部元素 (文档顺序)，
 * leadsTo 以元素在 elements 中的下标为键，值为目标屏幕标识。
 * 记录不可变，加边通过 {@link #withEdge} 得到新记录，由图整体替换。
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class Screen {

    String screenId;

    /**
     * 发现深度，起始屏幕为 0
     */
    int depth;

    @Builder.Default
    List<UiElement> elements = List.of();

    @Builder.Default
    Map<Integer, String> leadsTo = Map.of();

    public static Screen discovered(String screenId, List<UiElement> elements, int depth) {
        return Screen.builder()
                .screenId(screenId)
                .depth(depth)
                .elements(List.copyOf(elements))
                .leadsTo(Collections.emptyMap())
                .build();
    }

    /**
     * 按结构相等查找元素下标，找不到返回 -1
     */
    public int indexOf(UiElement element) {
        return elements.indexOf(element);
    }

    public Optional<String> destinationOf(UiElement element) {
        int index = indexOf(element);
        return index < 0 ? Optional.empty() : Optional.ofNullable(leadsTo.get(index));
    }

    /**
     * 返回一条新记录，其中已存储的 element 指向 destination
     *
     * @return element 不在本屏幕上时返回 empty
     */
    public Optional<Screen> withEdge(UiElement element, String destination) {
        int index = indexOf(element);
        if (index < 0) {
            return Optional.empty();
        }
        Map<Integer, String> edges = new TreeMap<>(leadsTo);
        edges.put(index, destination);
        return Optional.of(toBuilder().leadsTo(Collections.unmodifiableMap(edges)).build());
    }

    public int edgeCount() {
        return leadsTo.size();
    }
}
