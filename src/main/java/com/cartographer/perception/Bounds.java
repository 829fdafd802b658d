package com.cartographer.perception;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 元素边界矩形 (屏幕像素坐标)
 *
 * 始终是归一化的: left <= right, top <= bottom。
 * 原始格式为 uiautomator 的 "[x1,y1][x2,y2]"，两个角的顺序不做假设。
 */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class Bounds {

    private static final Pattern BOUNDS_PATTERN = Pattern.compile(
            "\\[\\s*(-?\\d+)\\s*,\\s*(-?\\d+)\\s*]\\s*\\[\\s*(-?\\d+)\\s*,\\s*(-?\\d+)\\s*]");

    int left;
    int top;
    int right;
    int bottom;

    /**
     * 由任意两个对角点构造，自动归一化
     */
    public static Bounds of(int x1, int y1, int x2, int y2) {
        return new Bounds(Math.min(x1, x2), Math.min(y1, y2), Math.max(x1, x2), Math.max(y1, y2));
    }

    /**
     * 解析 "[x1,y1][x2,y2]"
     *
     * @throws BoundsParseException 格式不合法或数字越界
     */
    public static Bounds parse(String raw) throws BoundsParseException {
        if (raw == null || raw.isBlank()) {
            throw new BoundsParseException(String.valueOf(raw), "Empty bounds");
        }
        Matcher matcher = BOUNDS_PATTERN.matcher(raw.trim());
        if (!matcher.matches()) {
            throw new BoundsParseException(raw, "Malformed bounds");
        }
        try {
            return of(
                    Integer.parseInt(matcher.group(1)),
                    Integer.parseInt(matcher.group(2)),
                    Integer.parseInt(matcher.group(3)),
                    Integer.parseInt(matcher.group(4)));
        } catch (NumberFormatException e) {
            throw new BoundsParseException(raw, "Bounds coordinate out of range", e);
        }
    }

    /**
     * 解析失败时返回 empty，不抛异常
     */
    public static Optional<Bounds> tryParse(String raw) {
        try {
            return Optional.of(parse(raw));
        } catch (BoundsParseException e) {
            return Optional.empty();
        }
    }

    public int centerX() {
        return left + (right - left) / 2;
    }

    public int centerY() {
        return top + (bottom - top) / 2;
    }

    public int width() {
        return right - left;
    }

    public int height() {
        return bottom - top;
    }

    /**
     * 是否与 [0,0][width,height] 视口有交集
     */
    public boolean intersectsViewport(int viewportWidth, int viewportHeight) {
        return right > 0 && bottom > 0 && left < viewportWidth && top < viewportHeight;
    }

    @Override
    public String toString() {
        return "[" + left + "," + top + "][" + right + "," + bottom + "]";
    }
}
