package com.cartographer.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * 计划执行配置 (cartographer.executor.*)
 */
@Data
@Component
@ConfigurationProperties(prefix = "cartographer.executor")
public class ExecutorProperties {

    /**
     * 每一步执行前的稳定等待 (毫秒)
     */
    private long stepSettleMs = 500;

    /**
     * open_app 之后额外等待应用加载 (毫秒)
     */
    private long launchSettleMs = 2000;

    /**
     * 运行结束前的等待，让状态有机会被看到 (毫秒)
     */
    private long graceDelayMs = 5000;
}
