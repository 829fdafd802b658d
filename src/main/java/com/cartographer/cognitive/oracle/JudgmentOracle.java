package com.cartographer.cognitive.oracle;

/**
 * 判定 / 生成服务的通用边界: prompt 进，文本出
 *
 * 只有分类客户端和规划客户端知道响应里嵌的 JSON 结构；
 * 规则实现、模型实现、测试用的固定响应实现可以互换。
 */
@FunctionalInterface
public interface JudgmentOracle {

    /**
     * @param prompt 完整提示词
     * @return 模型返回的文本
     * @throws OracleException 不可达、空响应等一切失败
     */
    String complete(String prompt);
}
