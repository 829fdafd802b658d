package com.cartographer.cognitive.classify;

import com.cartographer.cognitive.oracle.JudgmentOracle;
import com.cartographer.cognitive.oracle.OracleException;
import com.cartographer.perception.Bounds;
import com.cartographer.perception.UiElement;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("ScreenClassifier Tests")
class ScreenClassifierTest {

    @Mock
    private JudgmentOracle oracle;

    private ScreenClassifier classifier;

    private final UiElement title = UiElement.builder()
            .text("Settings").role("android.widget.TextView").bounds(Bounds.of(0, 0, 1080, 100)).build();
    private final UiElement network = UiElement.builder()
            .text("Network & internet").resourceId("android:id/title").role("android.widget.LinearLayout")
            .bounds(Bounds.of(0, 200, 1080, 300)).clickable(true).build();
    private final UiElement search = UiElement.builder()
            .label("Search settings").role("android.widget.ImageButton")
            .bounds(Bounds.of(900, 0, 1080, 100)).clickable(true).build();

    @BeforeEach
    void setUp() {
        classifier = new ScreenClassifier(oracle);
    }

    @Nested
    @DisplayName("classify() method tests")
    class ClassifyTests {

        @Test
        @DisplayName("Should submit only clickable elements with dense ids")
        void shouldSubmitOnlyClickableElements() {
            when(oracle.complete(anyString())).thenReturn("""
                    {"screenName": "SettingsScreen", "elements": [
                      {"id": 0, "classification": "STATIC_NAVIGATION"},
                      {"id": 1, "classification": "ACTION_BUTTON"}
                    ]}
                    """);

            Optional<ScreenAnalysis> analysis = classifier.classify(List.of(title, network, search), List.of("HomeScreen"));

            assertTrue(analysis.isPresent());
            assertEquals("SettingsScreen", analysis.get().screenName());
            assertEquals(2, analysis.get().elements().size());
            assertSame(network, analysis.get().elements().get(0).element());
            assertEquals(ElementClassification.STATIC_NAVIGATION, analysis.get().elements().get(0).classification());
            assertSame(search, analysis.get().elements().get(1).element());

            ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
            verify(oracle).complete(prompt.capture());
            assertTrue(prompt.getValue().contains("[\"HomeScreen\"]"));
            assertTrue(prompt.getValue().contains("Network & internet"));
            assertFalse(prompt.getValue().contains("\"text\" : \"Settings\""));
        }

        @Test
        @DisplayName("Should not call the oracle when nothing is clickable")
        void shouldNotCallOracleWithoutClickables() {
            Optional<ScreenAnalysis> analysis = classifier.classify(List.of(title), List.of());

            assertTrue(analysis.isEmpty());
            verifyNoInteractions(oracle);
        }

        @Test
        @DisplayName("Should return empty when the oracle fails")
        void shouldReturnEmptyWhenOracleFails() {
            when(oracle.complete(anyString())).thenThrow(new OracleException("unreachable"));

            assertTrue(classifier.classify(List.of(network), List.of()).isEmpty());
        }

        @Test
        @DisplayName("Should return empty for non-JSON or schema-invalid responses")
        void shouldReturnEmptyForInvalidResponses() {
            when(oracle.complete(anyString())).thenReturn("Sorry, I cannot help with that.");
            assertTrue(classifier.classify(List.of(network), List.of()).isEmpty());

            when(oracle.complete(anyString())).thenReturn("{\"elements\": []}");
            assertTrue(classifier.classify(List.of(network), List.of()).isEmpty());
        }

        @Test
        @DisplayName("Should drop out-of-range ids without failing the screen")
        void shouldDropOutOfRangeIds() {
            when(oracle.complete(anyString())).thenReturn("""
                    {"screenName": "SettingsScreen", "elements": [
                      {"id": 7, "classification": "STATIC_NAVIGATION"},
                      {"id": 0, "classification": "STATIC_NAVIGATION"}
                    ]}
                    """);

            Optional<ScreenAnalysis> analysis = classifier.classify(List.of(network), List.of());

            assertTrue(analysis.isPresent());
            assertEquals(1, analysis.get().elements().size());
            assertSame(network, analysis.get().elements().get(0).element());
        }
    }
}
