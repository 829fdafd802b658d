package com.cartographer.perception;

import java.awt.Dimension;
import java.util.Optional;

/**
 * UI 树采集边界
 *
 * 采集是廉价、可重复的。空文档是合法结果 (比如界面切换中)，不是错误。
 */
public interface UiCapture {

    /**
     * 抓取当前界面的原始树文档，失败或无内容时返回空字符串
     */
    String captureTree();

    /**
     * 当前前台应用 / Activity 标识
     */
    Optional<String> currentForegroundApp();

    /**
     * 视口尺寸 (像素)，未知时宽高为 0
     */
    Dimension viewportSize();
}
