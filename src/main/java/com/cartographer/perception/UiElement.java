package com.cartographer.perception;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * 屏幕上的一个 UI 元素
 *
 * 由 {@link UiTreeParser} 从无障碍树中提取。不可变，equals/hashCode 覆盖全部字段，
 * 爬虫依赖这一点在已存储的 Screen 上找回"同一个"元素。
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class UiElement {

    /**
     * resource-id，如 "com.whatsapp:id/row_item"，可为空
     */
    String resourceId;

    /**
     * 可见文本
     */
    String text;

    /**
     * 无障碍标签 (content-desc)
     */
    String label;

    /**
     * 类名，如 android.widget.TextView
     */
    String role;

    /**
     * 边界矩形，原始 bounds 无法解析时为 null
     */
    Bounds bounds;

    boolean clickable;

    boolean longClickable;

    /**
     * 安全输入框 (password)
     */
    boolean password;

    /**
     * 类名的简单名称，如 "TextView"
     */
    public String simpleRole() {
        if (role == null || role.isBlank()) {
            return "Unknown";
        }
        int dot = role.lastIndexOf('.');
        return dot >= 0 ? role.substring(dot + 1) : role;
    }

    /**
     * 优先可见文本，其次标签
     */
    public String displayText() {
        if (text != null && !text.isBlank()) {
            return text;
        }
        if (label != null && !label.isBlank()) {
            return label;
        }
        return null;
    }

    /**
     * 日志用的简短描述
     */
    public String describe() {
        String shown = displayText();
        if (shown == null) {
            shown = resourceId != null ? resourceId : "?";
        }
        return "'" + truncate(shown, 40) + "' (" + simpleRole() + ")";
    }

    private static String truncate(String str, int maxLen) {
        return str.length() > maxLen ? str.substring(0, maxLen) + "..." : str;
    }
}
