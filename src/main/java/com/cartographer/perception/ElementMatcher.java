package com.cartographer.perception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * 元素模糊查找
 *
 * 优先级 (忽略大小写，命中即返回，同级取文档顺序第一个):
 * 1. 文本完全相等
 * 2. 标签完全相等
 * 3. 文本包含
 * 4. 标签包含
 *
 * 指定 roleFilter 时先按类名过滤候选集；过滤后为空直接返回 empty，
 * 不回退到全集，否则 type 之后同名的输入框会被误点。
 */
@Slf4j
@Component
public class ElementMatcher {

    public Optional<UiElement> findElement(List<UiElement> elements, String textQuery) {
        return findElement(elements, textQuery, null);
    }

    public Optional<UiElement> findElement(List<UiElement> elements, String textQuery, String roleFilter) {
        if (elements == null || elements.isEmpty() || textQuery == null || textQuery.isBlank()) {
            return Optional.empty();
        }

        boolean filtered = roleFilter != null && !roleFilter.isBlank();
        List<UiElement> candidates = filtered
                ? elements.stream().filter(e -> roleMatches(e, roleFilter)).toList()
                : elements;
        if (filtered) {
            if (candidates.isEmpty()) {
                log.warn("没有类名为 '{}' 的元素，放弃查找 '{}'", roleFilter, textQuery);
                return Optional.empty();
            }
        }

        String query = textQuery.trim().toLowerCase(Locale.ROOT);

        Optional<UiElement> match = firstMatch(candidates, UiElement::getText, query::equals)
                .or(() -> firstMatch(candidates, UiElement::getLabel, query::equals))
                .or(() -> firstMatch(candidates, UiElement::getText, v -> v.contains(query)))
                .or(() -> firstMatch(candidates, UiElement::getLabel, v -> v.contains(query)));

        if (match.isEmpty()) {
            log.warn("未找到匹配 '{}' 的元素{}", textQuery,
                    roleFilter != null && !roleFilter.isBlank() ? " (class=" + roleFilter + ")" : "");
        }
        return match;
    }

    private Optional<UiElement> firstMatch(List<UiElement> candidates,
                                           Function<UiElement, String> field,
                                           Predicate<String> test) {
        return candidates.stream()
                .filter(e -> {
                    String value = field.apply(e);
                    return value != null && test.test(value.toLowerCase(Locale.ROOT));
                })
                .findFirst();
    }

    /**
     * 完整类名或简单类名均可，忽略大小写
     */
    static boolean roleMatches(UiElement element, String roleFilter) {
        String role = element.getRole();
        if (role == null) {
            return false;
        }
        String filter = roleFilter.trim();
        return role.equalsIgnoreCase(filter) || element.simpleRole().equalsIgnoreCase(filter);
    }
}
