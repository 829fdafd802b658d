package com.cartographer.controller;

import com.cartographer.crawler.GraphStore;
import com.cartographer.crawler.NavigationGraph;
import com.cartographer.session.CrawlSessionService;
import com.cartographer.session.SessionBusyException;
import com.cartographer.session.SessionStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Cartographer REST API
 *
 * - POST /crawl: 后台开始爬取 (可选 max_interactions)
 * - POST /goal: 后台执行目标 (goal 必填)
 * - POST /stop: 停止当前会话
 * - GET /status: 会话状态
 * - GET /graph: 最近一次保存的导航图
 */
@Slf4j
@RestController
@RequestMapping("/api/cartographer")
@RequiredArgsConstructor
public class CartographerController {

    private final CrawlSessionService sessionService;
    private final GraphStore graphStore;

    @PostMapping("/crawl")
    public ResponseEntity<Map<String, Object>> crawl(@RequestBody(required = false) Map<String, Object> request) {
        Integer maxInteractions = request != null ? parseInteger(request.get("max_interactions")) : null;
        log.info("[Crawl] max_interactions: {}", maxInteractions);

        sessionService.startCrawl(maxInteractions);
        return ResponseEntity.accepted().body(Map.of("status", "Crawl started"));
    }

    @PostMapping("/goal")
    public ResponseEntity<Map<String, Object>> goal(@RequestBody Map<String, Object> request) {
        Object goal = request.get("goal");
        if (!(goal instanceof String text) || text.isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "Goal cannot be empty"));
        }
        log.info("[Goal] {}", text);

        sessionService.runGoal(text);
        return ResponseEntity.accepted().body(Map.of("status", "Goal accepted", "goal", text));
    }

    @PostMapping("/stop")
    public ResponseEntity<Map<String, Object>> stop() {
        boolean stopped = sessionService.stop();
        log.info("[Stop] stopped: {}", stopped);
        return ResponseEntity.ok(Map.of(
                "status", stopped ? "Stop command sent" : "No active session",
                "stopped", stopped));
    }

    @GetMapping("/status")
    public ResponseEntity<Map<String, Object>> status() {
        SessionStatus s = sessionService.status();
        Map<String, Object> status = new HashMap<>();
        status.put("busy", s.isBusy());
        status.put("kind", s.getKind());
        status.put("crawl_state", s.getCrawlState());
        status.put("interactions", s.getInteractions());
        status.put("screens_discovered", s.getScreensDiscovered());
        status.put("last_crawl", s.getLastCrawlSummary());
        status.put("last_goal", s.getLastGoalSummary());
        status.put("last_error", s.getLastError());
        return ResponseEntity.ok(status);
    }

    @GetMapping("/graph")
    public ResponseEntity<?> graph() {
        Optional<NavigationGraph> graph = graphStore.load();
        if (graph.isEmpty()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(Map.of("error", "No navigation graph saved yet"));
        }
        return ResponseEntity.ok(graph.get());
    }

    @ExceptionHandler(SessionBusyException.class)
    public ResponseEntity<Map<String, Object>> handleBusy(SessionBusyException e) {
        log.warn("[Busy] {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", e.getMessage()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleException(Exception e) {
        log.error("请求处理失败", e);
        return ResponseEntity.internalServerError().body(Map.of("error", String.valueOf(e.getMessage())));
    }

    private static Integer parseInteger(Object value) {
        if (value instanceof Number number) {
            return number.intValue();
        }
        if (value instanceof String str && !str.isBlank()) {
            try {
                return Integer.parseInt(str.trim());
            } catch (NumberFormatException e) {
                log.warn("无效的 max_interactions: {}", str);
            }
        }
        return null;
    }
}
