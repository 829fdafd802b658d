package com.cartographer.support;

import com.cartographer.action.AppCatalog;
import com.cartographer.action.InteractionDriver;
import com.cartographer.perception.UiCapture;

import java.awt.Dimension;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 内存中的假设备: 屏幕由名字 + XML 组成，点击区域决定跳转目标
 *
 * back() 回到上一个屏幕，所有交互按顺序记录在 {@link #log()} 中。
 */
public class FakeDevice implements UiCapture, InteractionDriver, AppCatalog {

    private final Map<String, String> trees = new HashMap<>();
    private final Map<String, String> apps = new HashMap<>();
    private final Map<String, List<Transition>> transitions = new HashMap<>();
    private final Deque<String> backStack = new ArrayDeque<>();
    private final List<String> log = new ArrayList<>();
    private final List<InstalledApp> installed = new ArrayList<>();

    private String current;

    public FakeDevice screen(String name, String app, String tree) {
        trees.put(name, tree);
        apps.put(name, app);
        if (current == null) {
            current = name;
        }
        return this;
    }

    /**
     * 在 from 屏幕上点击 (x1,y1)-(x2,y2) 区域内任意点时跳到 to
     */
    public FakeDevice link(String from, int x1, int y1, int x2, int y2, String to) {
        transitions.computeIfAbsent(from, k -> new ArrayList<>()).add(new Transition(x1, y1, x2, y2, to));
        return this;
    }

    public FakeDevice installed(String label, String packageId) {
        installed.add(new InstalledApp(label, packageId));
        return this;
    }

    public String current() {
        return current;
    }

    public List<String> log() {
        return log;
    }

    public long count(String prefix) {
        return log.stream().filter(entry -> entry.startsWith(prefix)).count();
    }

    @Override
    public String captureTree() {
        return current == null ? "" : trees.getOrDefault(current, "");
    }

    @Override
    public Optional<String> currentForegroundApp() {
        return Optional.ofNullable(apps.get(current));
    }

    @Override
    public Dimension viewportSize() {
        return new Dimension(1080, 2400);
    }

    @Override
    public void tap(int x, int y) {
        log.add("tap " + x + "," + y);
        for (Transition t : transitions.getOrDefault(current, List.of())) {
            if (x >= t.x1 && x <= t.x2 && y >= t.y1 && y <= t.y2) {
                backStack.push(current);
                current = t.to;
                return;
            }
        }
    }

    @Override
    public void typeText(String text) {
        log.add("type " + text);
    }

    @Override
    public void back() {
        log.add("back");
        if (!backStack.isEmpty()) {
            current = backStack.pop();
        }
    }

    @Override
    public void home() {
        log.add("home");
    }

    @Override
    public boolean launchApp(String packageId) {
        log.add("launch " + packageId);
        return true;
    }

    @Override
    public List<InstalledApp> installedApps() {
        return List.copyOf(installed);
    }

    private record Transition(int x1, int y1, int x2, int y2, String to) {
    }
}
