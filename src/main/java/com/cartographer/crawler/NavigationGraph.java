package com.cartographer.crawler;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 导航图: 屏幕标识 -> Screen (保持发现顺序)
 *
 * 非线程安全，一次爬取会话内只由一个 {@link Cartographer} 持有和修改。
 * JSON 形式就是这个映射本身。
 */
public class NavigationGraph {

    private final Map<String, Screen> screens = new LinkedHashMap<>();

    public NavigationGraph() {
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static NavigationGraph fromMap(Map<String, Screen> screens) {
        NavigationGraph graph = new NavigationGraph();
        if (screens != null) {
            graph.screens.putAll(screens);
        }
        return graph;
    }

    @JsonValue
    public Map<String, Screen> asMap() {
        return Collections.unmodifiableMap(screens);
    }

    public boolean contains(String screenId) {
        return screens.containsKey(screenId);
    }

    public Optional<Screen> get(String screenId) {
        return Optional.ofNullable(screens.get(screenId));
    }

    /**
     * 新增屏幕；标识已存在时不做任何修改
     *
     * @return 是否新增
     */
    public boolean add(Screen screen) {
        return screens.putIfAbsent(screen.getScreenId(), screen) == null;
    }

    /**
     * 用新记录替换同标识的已有屏幕
     */
    public void replace(Screen screen) {
        if (!screens.containsKey(screen.getScreenId())) {
            throw new IllegalArgumentException("Unknown screen: " + screen.getScreenId());
        }
        screens.put(screen.getScreenId(), screen);
    }

    public Collection<Screen> screens() {
        return Collections.unmodifiableCollection(screens.values());
    }

    public List<String> screenNames() {
        return List.copyOf(screens.keySet());
    }

    public int size() {
        return screens.size();
    }

    public boolean isEmpty() {
        return screens.isEmpty();
    }

    public int edgeCount() {
        return screens.values().stream().mapToInt(Screen::edgeCount).sum();
    }

    /**
     * 深拷贝映射结构 (Screen 本身不可变)
     */
    public NavigationGraph copy() {
        return fromMap(screens);
    }
}
