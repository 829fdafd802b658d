package com.cartographer.session;

import com.cartographer.crawler.CrawlState;
import lombok.Builder;
import lombok.Value;

/**
 * 会话状态快照
 */
@Value
@Builder
public class SessionStatus {

    boolean busy;

    /**
     * 当前 (或最近一次) 会话类型，从未运行过时为 null
     */
    SessionKind kind;

    CrawlState crawlState;

    int interactions;

    int screensDiscovered;

    String lastCrawlSummary;

    String lastGoalSummary;

    String lastError;
}
