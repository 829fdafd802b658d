package com.cartographer.perception;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ElementMatcher Tests")
class ElementMatcherTest {

    private final ElementMatcher matcher = new ElementMatcher();

    private static UiElement element(String text, String label, String role) {
        return UiElement.builder()
                .text(text)
                .label(label)
                .role(role)
                .bounds(Bounds.of(0, 0, 100, 100))
                .clickable(true)
                .build();
    }

    @Nested
    @DisplayName("Priority tests")
    class PriorityTests {

        @Test
        @DisplayName("Exact text should beat a label match")
        void exactTextShouldBeatLabel() {
            UiElement byLabel = element(null, "search", "android.widget.ImageButton");
            UiElement byText = element("Search", null, "android.widget.TextView");

            Optional<UiElement> found = matcher.findElement(List.of(byLabel, byText), "Search");

            assertTrue(found.isPresent());
            assertSame(byText, found.get());
        }

        @Test
        @DisplayName("Exact label should beat contains text")
        void exactLabelShouldBeatContainsText() {
            UiElement containsText = element("Search history", null, "android.widget.TextView");
            UiElement exactLabel = element(null, "Search", "android.widget.ImageButton");

            Optional<UiElement> found = matcher.findElement(List.of(containsText, exactLabel), "search");

            assertSame(exactLabel, found.orElseThrow());
        }

        @Test
        @DisplayName("Should fall back to contains matching")
        void shouldFallBackToContains() {
            UiElement longText = element("Network & internet", null, "android.widget.TextView");
            UiElement longLabel = element(null, "Open navigation drawer", "android.widget.ImageButton");

            assertSame(longText, matcher.findElement(List.of(longLabel, longText), "network").orElseThrow());
            assertSame(longLabel, matcher.findElement(List.of(longLabel, longText), "drawer").orElseThrow());
        }

        @Test
        @DisplayName("Should return the first element in document order within a tier")
        void shouldReturnFirstWithinTier() {
            UiElement first = element("OK", null, "android.widget.Button");
            UiElement second = element("ok", null, "android.widget.Button");

            assertSame(first, matcher.findElement(List.of(first, second), "ok").orElseThrow());
        }

        @Test
        @DisplayName("Should return empty when nothing matches")
        void shouldReturnEmptyWhenNothingMatches() {
            assertTrue(matcher.findElement(List.of(element("A", null, "X")), "B").isEmpty());
            assertTrue(matcher.findElement(List.of(), "A").isEmpty());
            assertTrue(matcher.findElement(List.of(element("A", null, "X")), " ").isEmpty());
        }
    }

    @Nested
    @DisplayName("Role filter tests")
    class RoleFilterTests {

        private final UiElement inputField = element("Ayush Chaudhary", null, "android.widget.EditText");
        private final UiElement contactRow = element("Ayush Chaudhary", null, "android.widget.TextView");

        @Test
        @DisplayName("Simple class name filter should skip the input field")
        void simpleRoleFilterShouldSkipInput() {
            Optional<UiElement> found = matcher.findElement(
                    List.of(inputField, contactRow), "Ayush Chaudhary", "TextView");

            assertSame(contactRow, found.orElseThrow());
        }

        @Test
        @DisplayName("Full class name filter should match case-insensitively")
        void fullRoleFilterShouldMatch() {
            Optional<UiElement> found = matcher.findElement(
                    List.of(inputField, contactRow), "Ayush Chaudhary", "ANDROID.WIDGET.TEXTVIEW");

            assertSame(contactRow, found.orElseThrow());
        }

        @Test
        @DisplayName("Filter with no survivors should not fall back to other roles")
        void filterWithNoSurvivorsShouldReturnEmpty() {
            Optional<UiElement> found = matcher.findElement(
                    List.of(inputField), "Ayush Chaudhary", "TextView");

            assertTrue(found.isEmpty());
        }

        @Test
        @DisplayName("Contains fallback should only search elements that pass the filter")
        void containsFallbackShouldRespectFilter() {
            UiElement searchBox = element(null, "Search contacts", "android.widget.EditText");
            UiElement searchButton = element(null, "Search", "android.widget.ImageButton");

            Optional<UiElement> found = matcher.findElement(
                    List.of(searchBox, searchButton), "contacts", "ImageButton");

            assertTrue(found.isEmpty());
            assertSame(searchBox, matcher.findElement(
                    List.of(searchButton, searchBox), "contacts", "EditText").orElseThrow());
        }

        @Test
        @DisplayName("Without a filter the first element in document order wins")
        void withoutFilterFirstWins() {
            assertSame(inputField,
                    matcher.findElement(List.of(inputField, contactRow), "Ayush Chaudhary").orElseThrow());
        }
    }
}
