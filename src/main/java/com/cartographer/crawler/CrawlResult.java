package com.cartographer.crawler;

/**
 * 一次爬取会话的结果
 *
 * @param graph             最终导航图
 * @param interactions      实际执行的点击次数
 * @param reason            结束原因
 * @param frontierRemaining 结束时队列中剩余任务数
 * @param graphJson         导航图 JSON
 */
public record CrawlResult(NavigationGraph graph,
                          int interactions,
                          TerminationReason reason,
                          int frontierRemaining,
                          String graphJson) {

    public enum TerminationReason {
        QUEUE_EMPTY,
        MAX_INTERACTIONS,
        CANCELLED
    }

    public String summary() {
        return String.format("%s: %d screens, %d edges, %d interactions, %d tasks left",
                reason, graph.size(), graph.edgeCount(), interactions, frontierRemaining);
    }
}
