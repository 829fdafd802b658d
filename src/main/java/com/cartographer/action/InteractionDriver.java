package com.cartographer.action;

/**
 * 交互执行边界
 *
 * 对核心来说都是 fire-and-forget: 没有完成回调，调用方用固定的稳定等待推断完成。
 * 同一目标界面上的调用不会并发发起。
 */
public interface InteractionDriver {

    void tap(int x, int y);

    void typeText(String text);

    void back();

    void home();

    /**
     * 启动应用
     *
     * @param packageId 包名
     * @return 是否成功发出启动指令
     */
    boolean launchApp(String packageId);
}
