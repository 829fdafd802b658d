package com.cartographer.config;

import com.cartographer.crawler.ReturnNavigationPolicy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * 爬取配置 (cartographer.crawl.*)
 */
@Data
@Component
@ConfigurationProperties(prefix = "cartographer.crawl")
public class CrawlProperties {

    /**
     * 单次会话最大交互次数
     */
    private int maxInteractions = 20;

    /**
     * 点击后的稳定等待 (毫秒)
     */
    private long settleDelayMs = 2000;

    /**
     * 返回导航后的稳定等待 (毫秒)
     */
    private long backSettleDelayMs = 2000;

    /**
     * 会话开始前的等待，留时间切换到目标应用
     */
    private long startDelayMs = 0;

    private ReturnNavigationPolicy returnPolicy = ReturnNavigationPolicy.FOREGROUND_APP;

    /**
     * 会话存储目录
     */
    private String sessionDir = System.getProperty("user.home") + "/.cartographer";

    /**
     * 导航图检查点文件名 (固定)
     */
    private String mapFileName = "app_map_progress_v3.json";
}
