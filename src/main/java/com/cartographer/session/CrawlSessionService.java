package com.cartographer.session;

import com.cartographer.action.InteractionDriver;
import com.cartographer.cognitive.classify.ScreenClassifier;
import com.cartographer.cognitive.executor.ExecutionReport;
import com.cartographer.cognitive.executor.PlanExecutor;
import com.cartographer.cognitive.planner.ActionStep;
import com.cartographer.cognitive.planner.PlanSynthesizer;
import com.cartographer.config.CrawlProperties;
import com.cartographer.crawler.Cartographer;
import com.cartographer.crawler.CrawlResult;
import com.cartographer.crawler.CrawlState;
import com.cartographer.crawler.GraphStore;
import com.cartographer.crawler.NavigationGraph;
import com.cartographer.perception.UiCapture;
import com.cartographer.perception.UiTreeParser;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 会话服务
 *
 * 爬取和目标执行共用一个单线程 worker，同一时刻最多一个会话在运行，
 * 界面交互不会并发，判定服务同一时刻最多一个调用。
 *
 * 每次爬取新建一个 {@link Cartographer}，由它独占本次会话的图和队列。
 */
@Slf4j
@Service
public class CrawlSessionService {

    private final UiCapture uiCapture;
    private final InteractionDriver driver;
    private final UiTreeParser parser;
    private final ScreenClassifier classifier;
    private final GraphStore graphStore;
    private final CrawlProperties crawlProperties;
    private final PlanSynthesizer planSynthesizer;
    private final PlanExecutor planExecutor;

    private final ExecutorService worker = Executors.newSingleThreadExecutor(r -> {
        Thread thread = new Thread(r, "cartographer-worker");
        thread.setDaemon(true);
        return thread;
    });

    private Future<?> current;
    /**
     * 任务体在 worker 上执行期间为 true；取消后 Future 立即 done，但任务体可能仍在运行
     */
    private final AtomicBoolean running = new AtomicBoolean();
    private volatile SessionKind currentKind;
    private volatile Cartographer activeCrawler;
    private volatile String lastCrawlSummary;
    private volatile String lastGoalSummary;
    private volatile String lastError;

    public CrawlSessionService(UiCapture uiCapture,
                               InteractionDriver driver,
                               UiTreeParser parser,
                               ScreenClassifier classifier,
                               GraphStore graphStore,
                               CrawlProperties crawlProperties,
                               PlanSynthesizer planSynthesizer,
                               PlanExecutor planExecutor) {
        this.uiCapture = uiCapture;
        this.driver = driver;
        this.parser = parser;
        this.classifier = classifier;
        this.graphStore = graphStore;
        this.crawlProperties = crawlProperties;
        this.planSynthesizer = planSynthesizer;
        this.planExecutor = planExecutor;
    }

    /**
     * 在后台开始一次爬取
     *
     * @param maxInteractions 最大点击次数，null 或非正数时使用配置值
     * @throws SessionBusyException 已有会话在运行
     */
    public synchronized Future<CrawlResult> startCrawl(Integer maxInteractions) {
        ensureIdle();
        int budget = maxInteractions != null && maxInteractions > 0
                ? maxInteractions
                : crawlProperties.getMaxInteractions();

        Cartographer cartographer = newCartographer();
        activeCrawler = cartographer;
        currentKind = SessionKind.CRAWL;
        lastError = null;

        Future<CrawlResult> future = worker.submit(() -> tracked(() -> runCrawl(cartographer, budget)));
        current = future;
        log.info("🗺️ 爬取会话已提交，最大交互次数: {}", budget);
        return future;
    }

    /**
     * 在后台执行一个目标: 读取导航图 -> 生成计划 -> 执行
     *
     * @throws SessionBusyException 已有会话在运行
     */
    public synchronized Future<GoalResult> runGoal(String goal) {
        ensureIdle();
        currentKind = SessionKind.GOAL;
        activeCrawler = null;
        lastError = null;

        Future<GoalResult> future = worker.submit(() -> tracked(() -> executeGoal(goal)));
        current = future;
        log.info("🎯 目标已提交: {}", goal);
        return future;
    }

    /**
     * 停止当前会话: 通知爬虫协作式退出，并中断 worker 上的等待
     *
     * @return 是否有会话被停止
     */
    public synchronized boolean stop() {
        if (!isBusy()) {
            log.info("没有正在运行的会话");
            return false;
        }
        Cartographer crawler = activeCrawler;
        if (crawler != null) {
            crawler.requestStop();
        }
        current.cancel(true);
        log.warn("🛑 已发送停止信号 ({})", currentKind);
        return true;
    }

    public synchronized boolean isBusy() {
        return running.get() || (current != null && !current.isDone());
    }

    public SessionStatus status() {
        Cartographer crawler = activeCrawler;
        return SessionStatus.builder()
                .busy(isBusy())
                .kind(currentKind)
                .crawlState(crawler != null ? crawler.getState() : CrawlState.IDLE)
                .interactions(crawler != null ? crawler.getInteractions() : 0)
                .screensDiscovered(crawler != null ? crawler.getScreensDiscovered() : 0)
                .lastCrawlSummary(lastCrawlSummary)
                .lastGoalSummary(lastGoalSummary)
                .lastError(lastError)
                .build();
    }

    @PreDestroy
    public void shutdown() {
        log.info("关闭会话 worker");
        Cartographer crawler = activeCrawler;
        if (crawler != null) {
            crawler.requestStop();
        }
        worker.shutdownNow();
        try {
            if (!worker.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("会话 worker 未能在 5 秒内退出");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    Cartographer newCartographer() {
        return new Cartographer(uiCapture, driver, parser, classifier, graphStore, crawlProperties);
    }

    private <T> T tracked(Callable<T> body) throws Exception {
        running.set(true);
        try {
            return body.call();
        } finally {
            running.set(false);
        }
    }

    private CrawlResult runCrawl(Cartographer cartographer, int budget) throws InterruptedException {
        long startDelay = crawlProperties.getStartDelayMs();
        if (startDelay > 0) {
            log.info("⏳ {} 毫秒后开始爬取，请切换到目标应用", startDelay);
            Thread.sleep(startDelay);
        }
        try {
            CrawlResult result = cartographer.crawl(budget);
            lastCrawlSummary = result.summary();
            return result;
        } catch (RuntimeException e) {
            lastError = "Crawl failed: " + e.getMessage();
            throw e;
        }
    }

    private GoalResult executeGoal(String goal) {
        try {
            NavigationGraph graph = graphStore.load().orElseThrow(() -> {
                log.warn("⚠️ 没有可用的导航图 ({})，放弃目标", graphStore.getMapFile());
                return new NavigationGraphMissingException(
                        "No navigation graph saved at " + graphStore.getMapFile() + "; run a crawl first");
            });
            List<ActionStep> plan = planSynthesizer.synthesize(goal, graph);
            ExecutionReport report = planExecutor.execute(plan);
            GoalResult result = new GoalResult(goal, plan, report);
            lastGoalSummary = goal + " -> " + report.summary();
            if (!report.success()) {
                lastError = report.failureMessage();
            }
            return result;
        } catch (RuntimeException e) {
            log.error("❌ 目标执行失败: {}", goal, e);
            lastError = "Goal failed: " + e.getMessage();
            throw e;
        }
    }

    private void ensureIdle() {
        if (isBusy()) {
            throw new SessionBusyException("A " + currentKind + " session is already running");
        }
    }
}
