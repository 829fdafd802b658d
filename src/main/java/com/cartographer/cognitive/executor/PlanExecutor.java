package com.cartographer.cognitive.executor;

import com.cartographer.action.AppCatalog;
import com.cartographer.action.InteractionDriver;
import com.cartographer.cognitive.planner.ActionStep;
import com.cartographer.config.ExecutorProperties;
import com.cartographer.perception.Bounds;
import com.cartographer.perception.ElementMatcher;
import com.cartographer.perception.UiCapture;
import com.cartographer.perception.UiElement;
import com.cartographer.perception.UiTreeParser;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.awt.Dimension;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 计划执行器 (Conductor 执行阶段)
 *
 * 按顺序执行动作，每步前等待界面稳定，点击前重新采集当前屏幕。
 * - 软失败 (缺少目标参数): 记录 SKIPPED，继续
 * - 硬失败 (找不到元素、无法解析应用、异常): 停止，剩余步骤记为 NOT_RUN
 *
 * 不做重规划、不做重试，执行中也不主动返回上一屏。
 */
@Slf4j
@Service
public class PlanExecutor {

    private final UiCapture uiCapture;
    private final InteractionDriver driver;
    private final AppCatalog appCatalog;
    private final UiTreeParser parser;
    private final ElementMatcher matcher;
    private final ExecutorProperties settings;

    public PlanExecutor(UiCapture uiCapture,
                        InteractionDriver driver,
                        AppCatalog appCatalog,
                        UiTreeParser parser,
                        ElementMatcher matcher,
                        ExecutorProperties settings) {
        this.uiCapture = uiCapture;
        this.driver = driver;
        this.appCatalog = appCatalog;
        this.parser = parser;
        this.matcher = matcher;
        this.settings = settings;
    }

    public ExecutionReport execute(List<ActionStep> steps) {
        log.info("🚀 开始执行计划: {} 步", steps.size());

        List<StepOutcome> outcomes = new ArrayList<>();
        String failure = null;

        try {
            for (int i = 0; i < steps.size(); i++) {
                ActionStep step = steps.get(i);
                if (failure != null) {
                    outcomes.add(new StepOutcome(i, step, StepStatus.NOT_RUN, null));
                    continue;
                }

                log.info("▶️ 步骤 {}/{}: {}", i + 1, steps.size(), step.describe());
                try {
                    settle(settings.getStepSettleMs());
                    StepOutcome outcome = executeStep(i, step);
                    outcomes.add(outcome);
                    if (outcome.status() == StepStatus.SKIPPED) {
                        log.warn("⏭️ 步骤 {} 已跳过: {}", i + 1, outcome.detail());
                    }
                } catch (StepFailedException e) {
                    failure = "Step " + (i + 1) + " " + step.describe() + ": " + e.getMessage();
                    log.error("❌ 步骤 {} 失败，停止执行: {}", i + 1, e.getMessage());
                    outcomes.add(new StepOutcome(i, step, StepStatus.FAILED, e.getMessage()));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    failure = "Interrupted at step " + (i + 1);
                    log.warn("🛑 执行在步骤 {} 被中断", i + 1);
                    outcomes.add(new StepOutcome(i, step, StepStatus.FAILED, "interrupted"));
                } catch (RuntimeException e) {
                    failure = "Step " + (i + 1) + " " + step.describe() + ": " + e.getMessage();
                    log.error("❌ 步骤 {} 执行异常，停止执行", i + 1, e);
                    outcomes.add(new StepOutcome(i, step, StepStatus.FAILED, e.getMessage()));
                }
            }
        } finally {
            graceDelay();
        }

        ExecutionReport report = new ExecutionReport(outcomes, failure == null, failure);
        log.info("🏁 计划执行结束 - {}", report.summary());
        return report;
    }

    private StepOutcome executeStep(int index, ActionStep step) throws StepFailedException, InterruptedException {
        switch (step.getKind()) {
            case OPEN_APP -> {
                if (isBlank(step.getTarget())) {
                    return skipped(index, step, "open_app without app_name");
                }
                String packageId = resolvePackage(step.getTarget());
                if (!driver.launchApp(packageId)) {
                    throw new StepFailedException("Failed to launch " + packageId);
                }
                settle(settings.getLaunchSettleMs());
                return done(index, step, "launched " + packageId);
            }
            case TAP -> {
                if (isBlank(step.getTarget())) {
                    return skipped(index, step, "tap without element_text");
                }
                Bounds bounds = locate(step.getTarget(), step.getRoleFilter());
                driver.tap(bounds.centerX(), bounds.centerY());
                return done(index, step, "tapped " + bounds);
            }
            case TYPE -> {
                if (isBlank(step.getPayload())) {
                    return skipped(index, step, "type without text");
                }
                driver.typeText(step.getPayload());
                return done(index, step, "typed " + step.getPayload().length() + " chars");
            }
            case BACK -> {
                driver.back();
                return done(index, step, null);
            }
            case HOME -> {
                driver.home();
                return done(index, step, null);
            }
            default -> throw new StepFailedException("Unsupported action " + step.getKind());
        }
    }

    /**
     * 按显示名精确匹配 (忽略大小写) 已安装应用
     */
    private String resolvePackage(String appName) throws StepFailedException {
        String wanted = appName.trim();
        return appCatalog.installedApps().stream()
                .filter(app -> app.label() != null && app.label().equalsIgnoreCase(wanted))
                .map(AppCatalog.InstalledApp::packageId)
                .findFirst()
                .orElseThrow(() -> new StepFailedException("App '" + appName + "' is not installed"));
    }

    private Bounds locate(String text, String roleFilter) throws StepFailedException {
        String tree = uiCapture.captureTree();
        Dimension viewport = uiCapture.viewportSize();
        List<UiElement> elements = parser.parse(tree, viewport.width, viewport.height);

        Optional<UiElement> element = matcher.findElement(elements, text, roleFilter);
        if (element.isEmpty()) {
            throw new StepFailedException("Element '" + text + "'"
                    + (roleFilter != null ? " (class " + roleFilter + ")" : "") + " not found on screen");
        }
        Bounds bounds = element.get().getBounds();
        if (bounds == null) {
            throw new StepFailedException("Element " + element.get().describe() + " has no usable bounds");
        }
        log.debug("定位到 {} @ {}", element.get().describe(), bounds);
        return bounds;
    }

    private void graceDelay() {
        long grace = settings.getGraceDelayMs();
        if (grace <= 0 || Thread.currentThread().isInterrupted()) {
            return;
        }
        try {
            Thread.sleep(grace);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void settle(long millis) throws InterruptedException {
        if (millis > 0) {
            Thread.sleep(millis);
        }
    }

    private static StepOutcome done(int index, ActionStep step, String detail) {
        return new StepOutcome(index, step, StepStatus.DONE, detail);
    }

    private static StepOutcome skipped(int index, ActionStep step, String detail) {
        return new StepOutcome(index, step, StepStatus.SKIPPED, detail);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
