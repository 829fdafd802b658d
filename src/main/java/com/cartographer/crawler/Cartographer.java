package com.cartographer.crawler;

import com.cartographer.action.InteractionDriver;
import com.cartographer.cognitive.classify.ElementClassification;
import com.cartographer.cognitive.classify.ScreenAnalysis;
import com.cartographer.cognitive.classify.ScreenClassifier;
import com.cartographer.config.CrawlProperties;
import com.cartographer.perception.Bounds;
import com.cartographer.perception.UiCapture;
import com.cartographer.perception.UiElement;
import com.cartographer.perception.UiTreeParser;
import lombok.extern.slf4j.Slf4j;

import java.awt.Dimension;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 爬取调度器 (Cartographer)
 *
 * 通过模拟点击探索一个未知、有状态、不可重置的界面，构建屏幕导航图。
 *
 * 状态机流程：
 * INIT -> PROCESS_SCREEN <-> EXECUTE_TASK -> DONE
 *
 * - INIT: 与 PROCESS_SCREEN 完全相同地处理起始屏幕
 * - PROCESS_SCREEN: 采集 -> 解析 -> 分类。新标识存入图并按策略入队；已知标识不做修改
 * - EXECUTE_TASK: 取队首 (FIFO，广度优先)，点击，等待稳定，处理目标屏幕，
 *   在源屏幕已存储的原始元素上记录边，按策略决定是否返回，写检查点
 *
 * 一个实例对应一次会话，独占导航图、队列、已知屏幕名和模板去重集合，不可跨线程共享。
 */
@Slf4j
public class Cartographer {

    /**
     * 没有 resource-id 的动态链接共用一个模板键
     */
    static final String ANONYMOUS_TEMPLATE = "dynamic_link";

    private final UiCapture uiCapture;
    private final InteractionDriver driver;
    private final UiTreeParser parser;
    private final ScreenClassifier classifier;
    private final GraphStore graphStore;
    private final CrawlProperties settings;

    private final NavigationGraph graph = new NavigationGraph();
    private final Deque<FrontierTask> frontier = new ArrayDeque<>();
    private final List<String> knownScreenNames = new ArrayList<>();
    private final Set<String> exploredTemplates = new HashSet<>();
    private final Map<String, String> fingerprints = new HashMap<>();

    private volatile CrawlState state = CrawlState.IDLE;
    private volatile boolean stopRequested = false;
    private volatile int interactions = 0;
    private volatile int screensDiscovered = 0;

    public Cartographer(UiCapture uiCapture,
                        InteractionDriver driver,
                        UiTreeParser parser,
                        ScreenClassifier classifier,
                        GraphStore graphStore,
                        CrawlProperties settings) {
        this.uiCapture = uiCapture;
        this.driver = driver;
        this.parser = parser;
        this.classifier = classifier;
        this.graphStore = graphStore;
        this.settings = settings;
    }

    /**
     * 执行一次完整爬取
     *
     * @param maxInteractions 最大点击次数
     * @return 爬取结果 (含最终导航图 JSON)
     */
    public CrawlResult crawl(int maxInteractions) {
        if (state != CrawlState.IDLE) {
            throw new IllegalStateException("Cartographer 实例只能使用一次，当前状态: " + state);
        }
        log.info("🗺️ 开始爬取，最大交互次数: {}", maxInteractions);

        CrawlResult.TerminationReason reason;
        try {
            state = CrawlState.INIT;
            commit(processScreen(0), null);
            checkpoint();

            while (!frontier.isEmpty() && interactions < maxInteractions) {
                if (isCancelled()) {
                    break;
                }
                executeTask(frontier.pollFirst());
            }

            if (isCancelled()) {
                reason = CrawlResult.TerminationReason.CANCELLED;
            } else if (frontier.isEmpty()) {
                reason = CrawlResult.TerminationReason.QUEUE_EMPTY;
            } else {
                reason = CrawlResult.TerminationReason.MAX_INTERACTIONS;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            stopRequested = true;
            reason = CrawlResult.TerminationReason.CANCELLED;
            log.warn("🛑 爬取在等待中被中断");
        } catch (RuntimeException e) {
            state = CrawlState.FAILED;
            log.error("❌ 爬取异常终止: 已点击 {} 次, 已发现 {} 个屏幕, 队列剩余 {}",
                    interactions, graph.size(), frontier.size(), e);
            throw e;
        }

        state = reason == CrawlResult.TerminationReason.CANCELLED ? CrawlState.CANCELLED : CrawlState.DONE;
        CrawlResult result = new CrawlResult(graph.copy(), interactions, reason, frontier.size(),
                graphStore.toJson(graph));
        log.info("🏁 爬取结束 - {}", result.summary());
        return result;
    }

    /**
     * 协作式停止: 当前步骤结束后退出，此后不再写检查点
     */
    public void requestStop() {
        stopRequested = true;
        log.warn("🛑 Cartographer 收到停止信号");
    }

    // ==================== EXECUTE_TASK ====================

    private void executeTask(FrontierTask task) throws InterruptedException {
        state = CrawlState.EXECUTE_TASK;
        log.info("--- [TASK START | 点击: {} | 队列: {}] {} ---", interactions, frontier.size(), task.describe());

        Bounds bounds = task.target().getBounds();
        if (bounds == null) {
            log.warn("元素没有可用的 bounds，无法点击，跳过任务: {}", task.describe());
            checkpoint();
            return;
        }

        String appBefore = uiCapture.currentForegroundApp().orElse(null);

        log.debug("点击 ({}, {})", bounds.centerX(), bounds.centerY());
        driver.tap(bounds.centerX(), bounds.centerY());
        interactions++;
        settle(settings.getSettleDelayMs());

        Optional<ScreenObservation> destination = processScreen(task.sourceDepth() + 1);
        if (isCancelled()) {
            log.warn("任务进行中收到停止信号，丢弃本次结果: {}", task.describe());
            return;
        }

        String appAfter = uiCapture.currentForegroundApp().orElse(null);
        log.debug("点击后前台: {}", appAfter);

        commit(destination, task);
        navigateBackIfNeeded(task, destination.map(ScreenObservation::screenId).orElse(null), appBefore, appAfter);
        checkpoint();

        log.info("--- [TASK END] ---");
    }

    private void navigateBackIfNeeded(FrontierTask task, String destinationId,
                                      String appBefore, String appAfter) throws InterruptedException {
        boolean goBack;
        if (settings.getReturnPolicy() == ReturnNavigationPolicy.SCREEN_IDENTITY) {
            goBack = destinationId != null && !destinationId.equals(task.sourceScreenId());
            if (!goBack) {
                log.debug("目标屏幕与源屏幕相同或未知，不返回");
            }
        } else {
            goBack = appAfter != null && !appAfter.equals(appBefore);
            if (!goBack) {
                log.debug("前台未变化 ({})，不执行返回以免退出应用", appAfter);
            }
        }

        if (goBack) {
            log.debug("返回导航: {} -> {}", destinationId, task.sourceScreenId());
            driver.back();
            settle(settings.getBackSettleDelayMs());
        }
    }

    // ==================== PROCESS_SCREEN ====================

    /**
     * 采集并分析当前屏幕，只计算，不修改任何状态
     *
     * @param depth 若为新屏幕时的发现深度
     * @return 无法识别 (空采集、分类失败) 时返回 empty
     */
    private Optional<ScreenObservation> processScreen(int depth) {
        state = CrawlState.PROCESS_SCREEN;

        String tree = uiCapture.captureTree();
        if (tree == null || tree.isBlank()) {
            log.warn("采集到空的 UI 树，当前屏幕视为死路");
            return Optional.empty();
        }

        Dimension viewport = uiCapture.viewportSize();
        List<UiElement> elements = parser.parse(tree, viewport.width, viewport.height);
        log.debug("解析得到 {} 个元素", elements.size());

        Optional<ScreenAnalysis> analysis = classifier.classify(elements, List.copyOf(knownScreenNames));
        if (analysis.isEmpty()) {
            log.warn("屏幕分类失败，当前屏幕视为死路 (不记录、不入队)");
            return Optional.empty();
        }

        String screenId = analysis.get().screenName();
        log.info("屏幕识别为: '{}'", screenId);

        if (graph.contains(screenId)) {
            log.debug("屏幕 '{}' 已访问过，不新增任务", screenId);
            return Optional.of(ScreenObservation.revisit(screenId));
        }

        String fingerprint = ScreenFingerprint.of(elements);
        String sameStructure = fingerprints.get(fingerprint);
        if (!fingerprint.isEmpty() && sameStructure != null) {
            log.warn("⚠️ 新屏幕 '{}' 与已知屏幕 '{}' 结构指纹相同，可能是同一屏幕被重新命名", screenId, sameStructure);
        }

        Screen screen = Screen.discovered(screenId, elements, depth);
        List<FrontierTask> tasks = new ArrayList<>();
        Set<String> claimedTemplates = new LinkedHashSet<>();

        for (ScreenAnalysis.ClassifiedElement classified : analysis.get().elements()) {
            UiElement element = classified.element();
            ElementClassification classification = classified.classification();
            switch (classification) {
                case STATIC_NAVIGATION -> {
                    tasks.add(new FrontierTask(screenId, element, depth));
                    log.debug("入队 STATIC_NAVIGATION: {}", element.describe());
                }
                case DYNAMIC_CONTENT_LINK -> {
                    String template = templateKey(element);
                    if (exploredTemplates.contains(template) || !claimedTemplates.add(template)) {
                        log.debug("跳过重复模板 DYNAMIC_CONTENT_LINK [{}]: {}", template, element.describe());
                    } else {
                        tasks.add(new FrontierTask(screenId, element, depth));
                        log.debug("入队 DYNAMIC_CONTENT_LINK 代表 [{}]: {}", template, element.describe());
                    }
                }
                default -> log.debug("忽略 {}: {}", classification, element.describe());
            }
        }

        log.info("🆕 发现新屏幕 '{}' (深度 {}): {} 个元素, {} 个新任务", screenId, depth, elements.size(), tasks.size());
        return Optional.of(new ScreenObservation(screenId, screen, fingerprint, tasks, claimedTemplates));
    }

    /**
     * 一次性提交: 新屏幕、新任务、模板键、源屏幕上的边
     */
    private void commit(Optional<ScreenObservation> observation, FrontierTask task) {
        if (observation.isEmpty()) {
            if (task != null) {
                log.warn("无法识别目标屏幕，不添加边: {}", task.describe());
            }
            return;
        }
        ScreenObservation obs = observation.get();

        Screen updatedSource = null;
        if (task != null) {
            updatedSource = graph.get(task.sourceScreenId())
                    .flatMap(source -> source.withEdge(task.target(), obs.screenId()))
                    .orElse(null);
            if (updatedSource == null) {
                log.warn("源屏幕 '{}' 上找不到原始元素，无法记录边: {}", task.sourceScreenId(), task.target().describe());
            }
        }

        if (obs.newScreen() != null && graph.add(obs.newScreen())) {
            if (!knownScreenNames.contains(obs.screenId())) {
                knownScreenNames.add(obs.screenId());
            }
            if (!obs.fingerprint().isEmpty()) {
                fingerprints.putIfAbsent(obs.fingerprint(), obs.screenId());
            }
            exploredTemplates.addAll(obs.claimedTemplates());
            frontier.addAll(obs.tasks());
            screensDiscovered = graph.size();
        }

        if (updatedSource != null) {
            graph.replace(updatedSource);
            log.info("➕ 新增边: '{}' --{}--> '{}'", task.sourceScreenId(), task.target().describe(), obs.screenId());
        }
    }

    private static String templateKey(UiElement element) {
        return element.getResourceId() != null ? element.getResourceId() : ANONYMOUS_TEMPLATE;
    }

    // ==================== 辅助 ====================

    private void checkpoint() {
        if (isCancelled()) {
            log.debug("已停止，跳过检查点写入");
            return;
        }
        graphStore.save(graph);
    }

    private void settle(long millis) throws InterruptedException {
        if (millis > 0) {
            Thread.sleep(millis);
        }
    }

    private boolean isCancelled() {
        return stopRequested || Thread.currentThread().isInterrupted();
    }

    public CrawlState getState() {
        return state;
    }

    public int getInteractions() {
        return interactions;
    }

    public int getScreensDiscovered() {
        return screensDiscovered;
    }

    /**
     * PROCESS_SCREEN 的计算结果，newScreen 为 null 表示已知屏幕
     */
    private record ScreenObservation(String screenId,
                                     Screen newScreen,
                                     String fingerprint,
                                     List<FrontierTask> tasks,
                                     Set<String> claimedTemplates) {

        static ScreenObservation revisit(String screenId) {
            return new ScreenObservation(screenId, null, "", List.of(), Set.of());
        }
    }
}
