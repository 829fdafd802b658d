package com.cartographer.action;

import java.util.List;

/**
 * 已安装应用目录，用于把显示名解析为可启动的包名
 */
public interface AppCatalog {

    List<InstalledApp> installedApps();

    record InstalledApp(String label, String packageId) {
    }
}
