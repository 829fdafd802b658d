package com.cartographer.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * adb 设备桥接配置
 *
 * <pre>
 * cartographer.adb.adb-path=adb
 * cartographer.adb.serial=emulator-5554
 * cartographer.adb.app-labels.WhatsApp=com.whatsapp
 * </pre>
 */
@Data
@Component
@ConfigurationProperties(prefix = "cartographer.adb")
public class AdbProperties {

    private boolean enabled = true;

    /**
     * adb 可执行文件路径
     */
    private String adbPath = "adb";

    /**
     * 设备序列号，为空时使用唯一连接的设备
     */
    private String serial;

    /**
     * 单条命令超时 (秒)
     */
    private int timeoutSeconds = 30;

    /**
     * 应用显示名 -> 包名，adb 无法直接读取应用 label
     */
    private Map<String, String> appLabels = new LinkedHashMap<>();
}
