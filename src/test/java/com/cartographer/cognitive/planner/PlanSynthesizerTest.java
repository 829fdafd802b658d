package com.cartographer.cognitive.planner;

import com.cartographer.cognitive.oracle.JudgmentOracle;
import com.cartographer.cognitive.oracle.OracleException;
import com.cartographer.crawler.NavigationGraph;
import com.cartographer.crawler.Screen;
import com.cartographer.perception.UiElement;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("PlanSynthesizer Tests")
class PlanSynthesizerTest {

    @Mock
    private JudgmentOracle oracle;

    private PlanSynthesizer synthesizer;
    private NavigationGraph graph;

    @BeforeEach
    void setUp() {
        synthesizer = new PlanSynthesizer(oracle, new GraphSummarizer(40, 12000));

        UiElement settings = UiElement.builder().text("Settings").role("android.widget.TextView").clickable(true).build();
        graph = new NavigationGraph();
        graph.add(Screen.discovered("HomeScreen", List.of(settings), 0)
                .withEdge(settings, "SettingsScreen").orElseThrow());
        graph.add(Screen.discovered("SettingsScreen", List.of(), 1));
    }

    @Test
    @DisplayName("Goal 'open Settings' should produce a single tap")
    void openSettingsShouldProduceSingleTap() {
        when(oracle.complete(anyString())).thenReturn("```json\n[{\"action\": \"tap\", \"element_text\": \"Settings\"}]\n```");

        List<ActionStep> plan = synthesizer.synthesize("open Settings", graph);

        assertEquals(List.of(ActionStep.tap("Settings")), plan);
    }

    @Test
    @DisplayName("Prompt should carry the goal and the map summary")
    void promptShouldCarryGoalAndSummary() {
        when(oracle.complete(anyString())).thenReturn("[{\"action\": \"home\"}]");

        synthesizer.synthesize("go home", graph);

        ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
        verify(oracle).complete(prompt.capture());
        assertTrue(prompt.getValue().contains("go home"));
        assertTrue(prompt.getValue().contains("Leads to: SettingsScreen"));
        assertTrue(prompt.getValue().contains("open_app"));
    }

    @Test
    @DisplayName("Oracle failure should abort synthesis")
    void oracleFailureShouldAbort() {
        when(oracle.complete(anyString())).thenThrow(new OracleException("unreachable"));

        PlanSynthesisException e = assertThrows(PlanSynthesisException.class,
                () -> synthesizer.synthesize("open Settings", graph));
        assertInstanceOf(OracleException.class, e.getCause());
    }

    @Test
    @DisplayName("Invalid plan should abort without a partial plan")
    void invalidPlanShouldAbort() {
        when(oracle.complete(anyString())).thenReturn(
                "[{\"action\": \"tap\", \"element_text\": \"Settings\"}, {\"action\": \"long_press\"}]");

        assertThrows(PlanSynthesisException.class, () -> synthesizer.synthesize("open Settings", graph));
    }

    @Test
    @DisplayName("Blank goal should be rejected without calling the oracle")
    void blankGoalShouldBeRejected() {
        assertThrows(PlanSynthesisException.class, () -> synthesizer.synthesize(" ", graph));
        verifyNoInteractions(oracle);
    }
}
