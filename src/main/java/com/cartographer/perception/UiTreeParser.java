package com.cartographer.perception;

import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 感知模块 - UI 树解析器
 *
 * 把 uiautomator / 无障碍服务导出的 XML 转成 {@link UiElement} 列表。
 * 使用 jsoup 的 XML 解析器: 截断或不合法的文档也能拿到所有可解析的节点。
 *
 * 保留规则:
 * - 有文本、有标签，或者可点击 / 可长按的节点
 * - bounds 完全落在视口外的节点丢弃
 * - bounds 无法解析的节点保留，bounds 置为 null
 *
 * 该方法不向外抛异常。
 */
@Slf4j
@Component
public class UiTreeParser {

    private static final String NODE_TAG = "node";

    public List<UiElement> parse(String treeDocument, int viewportWidth, int viewportHeight) {
        if (treeDocument == null || treeDocument.isBlank()) {
            log.debug("UI 树为空，跳过解析");
            return Collections.emptyList();
        }

        List<UiElement> elements = new ArrayList<>();
        try {
            Document document = Jsoup.parse(treeDocument, "", Parser.xmlParser());
            for (Element node : document.getElementsByTag(NODE_TAG)) {
                try {
                    UiElement element = toElement(node);
                    if (isWorthKeeping(element) && isInViewport(element, viewportWidth, viewportHeight)) {
                        elements.add(element);
                    }
                } catch (RuntimeException e) {
                    log.warn("跳过无法解析的节点: {} ({})", abbreviate(node.outerHtml()), e.getMessage());
                }
            }
        } catch (RuntimeException e) {
            log.error("UI 树解析失败，返回已解析的 {} 个元素", elements.size(), e);
        }

        log.debug("解析得到 {} 个元素 (viewport {}x{})", elements.size(), viewportWidth, viewportHeight);
        return elements;
    }

    private UiElement toElement(Element node) {
        String rawBounds = node.attr("bounds");
        Bounds bounds = null;
        if (!rawBounds.isBlank()) {
            try {
                bounds = Bounds.parse(rawBounds);
            } catch (BoundsParseException e) {
                log.debug("节点 bounds 无法解析: {}", e.getMessage());
            }
        }

        return UiElement.builder()
                .resourceId(blankToNull(node.attr("resource-id")))
                .text(blankToNull(node.attr("text")))
                .label(blankToNull(node.attr("content-desc")))
                .role(blankToNull(node.attr("class")))
                .bounds(bounds)
                .clickable(Boolean.parseBoolean(node.attr("clickable")))
                .longClickable(Boolean.parseBoolean(node.attr("long-clickable")))
                .password(Boolean.parseBoolean(node.attr("password")))
                .build();
    }

    private boolean isWorthKeeping(UiElement element) {
        return element.getText() != null
                || element.getLabel() != null
                || element.isClickable()
                || element.isLongClickable();
    }

    private boolean isInViewport(UiElement element, int viewportWidth, int viewportHeight) {
        if (element.getBounds() == null || viewportWidth <= 0 || viewportHeight <= 0) {
            return true;
        }
        return element.getBounds().intersectsViewport(viewportWidth, viewportHeight);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }

    private static String abbreviate(String str) {
        return str.length() > 120 ? str.substring(0, 120) + "..." : str;
    }
}
