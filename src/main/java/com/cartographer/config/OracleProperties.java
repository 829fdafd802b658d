package com.cartographer.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * 判定模型配置 (cartographer.oracle.*)
 */
@Data
@Component
@ConfigurationProperties(prefix = "cartographer.oracle")
public class OracleProperties {

    /**
     * 屏幕分类使用的模型别名，为空时使用 app.llm.default-model
     */
    private String classifierModel;

    /**
     * 计划生成使用的模型别名，为空时使用 app.llm.default-model
     */
    private String plannerModel;

    /**
     * 导航图摘要中每个屏幕最多列出的元素数
     */
    private int summaryMaxElementsPerScreen = 40;

    /**
     * 导航图摘要总长度上限 (字符)
     */
    private int summaryMaxChars = 12000;
}
