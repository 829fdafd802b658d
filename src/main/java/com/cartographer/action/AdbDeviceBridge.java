package com.cartographer.action;

import com.cartographer.action.AdbCommandRunner.ExecutionResult;
import com.cartographer.config.AdbProperties;
import com.cartographer.perception.UiCapture;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.awt.Dimension;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 基于 adb 的 Android 设备桥接
 *
 * 同时实现采集 (uiautomator dump)、交互 (input) 与应用目录 (pm list packages)。
 * 核心逻辑只依赖这三个接口，不依赖本类。
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "cartographer.adb", name = "enabled", havingValue = "true", matchIfMissing = true)
public class AdbDeviceBridge implements UiCapture, InteractionDriver, AppCatalog {

    private static final String DUMP_PATH = "/sdcard/cartographer_window_dump.xml";
    private static final Pattern FOCUS_PATTERN = Pattern.compile("mCurrentFocus=Window\\{\\S+ \\S+ ([^}\\s]+)}");
    private static final Pattern SIZE_PATTERN = Pattern.compile("size:\\s*(\\d+)x(\\d+)");
    private static final String INPUT_SPECIAL_CHARS = "()<>|;&*\\~\"'`$!?#[]{}";

    private static final int KEYCODE_HOME = 3;
    private static final int KEYCODE_BACK = 4;

    private final AdbCommandRunner runner;
    private final AdbProperties adbProperties;

    private volatile Dimension cachedViewport;

    public AdbDeviceBridge(AdbCommandRunner runner, AdbProperties adbProperties) {
        this.runner = runner;
        this.adbProperties = adbProperties;
        log.info("AdbDeviceBridge 初始化完成 (adb={}, serial={})",
                adbProperties.getAdbPath(), adbProperties.getSerial());
    }

    // ==================== UiCapture ====================

    @Override
    public String captureTree() {
        ExecutionResult dump = runner.shell("uiautomator", "dump", DUMP_PATH);
        if (!dump.success()) {
            log.warn("uiautomator dump 失败: {}", dump.output());
            return "";
        }
        ExecutionResult cat = runner.shell("cat", DUMP_PATH);
        if (!cat.success()) {
            log.warn("读取 dump 文件失败: {}", cat.output());
            return "";
        }
        String xml = cat.output();
        int start = xml.indexOf('<');
        return start >= 0 ? xml.substring(start) : "";
    }

    @Override
    public Optional<String> currentForegroundApp() {
        ExecutionResult result = runner.shell("dumpsys", "window");
        if (!result.success()) {
            return Optional.empty();
        }
        Matcher matcher = FOCUS_PATTERN.matcher(result.output());
        String focus = null;
        while (matcher.find()) {
            focus = matcher.group(1);
        }
        return Optional.ofNullable(focus);
    }

    @Override
    public Dimension viewportSize() {
        Dimension viewport = cachedViewport;
        if (viewport != null) {
            return viewport;
        }
        ExecutionResult result = runner.shell("wm", "size");
        if (!result.success()) {
            log.warn("无法获取屏幕尺寸: {}", result.output());
            return new Dimension(0, 0);
        }
        // 有 Override size 时以最后一行为准
        Matcher matcher = SIZE_PATTERN.matcher(result.output());
        while (matcher.find()) {
            viewport = new Dimension(Integer.parseInt(matcher.group(1)), Integer.parseInt(matcher.group(2)));
        }
        if (viewport == null) {
            return new Dimension(0, 0);
        }
        cachedViewport = viewport;
        return viewport;
    }

    // ==================== InteractionDriver ====================

    @Override
    public void tap(int x, int y) {
        log.debug("👆 tap ({}, {})", x, y);
        runner.shell("input", "tap", String.valueOf(x), String.valueOf(y));
    }

    @Override
    public void typeText(String text) {
        log.debug("⌨️ type '{}'", text);
        runner.shell("input", "text", escapeInputText(text));
    }

    @Override
    public void back() {
        runner.shell("input", "keyevent", String.valueOf(KEYCODE_BACK));
    }

    @Override
    public void home() {
        runner.shell("input", "keyevent", String.valueOf(KEYCODE_HOME));
    }

    @Override
    public boolean launchApp(String packageId) {
        ExecutionResult result = runner.shell("monkey", "-p", packageId,
                "-c", "android.intent.category.LAUNCHER", "1");
        boolean launched = result.success() && !result.output().contains("No activities found");
        if (!launched) {
            log.warn("启动应用失败: {} -> {}", packageId, result.output());
        }
        return launched;
    }

    // ==================== AppCatalog ====================

    /**
     * 配置的 label 覆盖在前；其余包以包名最后一段作为 label (com.android.settings -> settings)
     */
    @Override
    public List<InstalledApp> installedApps() {
        List<InstalledApp> apps = new ArrayList<>();
        for (Map.Entry<String, String> entry : adbProperties.getAppLabels().entrySet()) {
            apps.add(new InstalledApp(entry.getKey(), entry.getValue()));
        }

        ExecutionResult result = runner.shell("pm", "list", "packages");
        if (!result.success()) {
            log.warn("无法列出已安装应用: {}", result.output());
            return apps;
        }
        for (String line : result.output().split("\\R")) {
            String trimmed = line.trim();
            if (!trimmed.startsWith("package:")) {
                continue;
            }
            String packageId = trimmed.substring("package:".length());
            String lastSegment = packageId.substring(packageId.lastIndexOf('.') + 1);
            apps.add(new InstalledApp(lastSegment.toLowerCase(Locale.ROOT), packageId));
        }
        return apps;
    }

    /**
     * input text 不接受空格，且设备端 shell 会解释特殊字符
     */
    static String escapeInputText(String text) {
        StringBuilder sb = new StringBuilder();
        for (char c : text.toCharArray()) {
            if (c == ' ') {
                sb.append("%s");
            } else if (INPUT_SPECIAL_CHARS.indexOf(c) >= 0) {
                sb.append('\\').append(c);
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }
}
