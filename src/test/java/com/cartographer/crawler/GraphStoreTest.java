package com.cartographer.crawler;

import com.cartographer.config.CrawlProperties;
import com.cartographer.perception.Bounds;
import com.cartographer.perception.UiElement;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("GraphStore Tests")
class GraphStoreTest {

    @TempDir
    Path tempDir;

    private static NavigationGraph sampleGraph() {
        UiElement settings = UiElement.builder()
                .text("Settings")
                .resourceId("com.example:id/settings")
                .role("android.widget.TextView")
                .bounds(Bounds.of(0, 200, 1080, 300))
                .clickable(true)
                .build();
        UiElement title = UiElement.builder()
                .text("Home")
                .role("android.widget.TextView")
                .build();

        NavigationGraph graph = new NavigationGraph();
        graph.add(Screen.discovered("HomeScreen", List.of(title, settings), 0));
        graph.add(Screen.discovered("SettingsScreen", List.of(), 1));
        graph.replace(graph.get("HomeScreen").orElseThrow().withEdge(settings, "SettingsScreen").orElseThrow());
        return graph;
    }

    @Nested
    @DisplayName("save() and load() tests")
    class SaveLoadTests {

        @Test
        @DisplayName("Should restore screens, elements and edges")
        void shouldRestoreGraph() {
            GraphStore store = new GraphStore(tempDir.resolve("map.json"));

            assertTrue(store.save(sampleGraph()));
            NavigationGraph loaded = store.load().orElseThrow();

            assertEquals(List.of("HomeScreen", "SettingsScreen"), loaded.screenNames());
            Screen home = loaded.get("HomeScreen").orElseThrow();
            assertEquals(2, home.getElements().size());
            assertEquals(Bounds.of(0, 200, 1080, 300), home.getElements().get(1).getBounds());
            assertNull(home.getElements().get(0).getBounds());
            assertEquals("SettingsScreen", home.destinationOf(home.getElements().get(1)).orElseThrow());
            assertEquals(1, loaded.get("SettingsScreen").orElseThrow().getDepth());
        }

        @Test
        @DisplayName("Should write a JSON object keyed by screen name")
        void shouldWriteObjectKeyedByScreenName() throws Exception {
            GraphStore store = new GraphStore(tempDir.resolve("map.json"));
            store.save(sampleGraph());

            JsonNode root = new ObjectMapper().readTree(Files.readString(store.getMapFile()));

            assertTrue(root.isObject());
            assertTrue(root.has("HomeScreen"));
            assertEquals("SettingsScreen", root.get("HomeScreen").get("leadsTo").get("1").asText());
        }

        @Test
        @DisplayName("Should overwrite the previous checkpoint and leave no temp file")
        void shouldOverwritePreviousCheckpoint() throws Exception {
            GraphStore store = new GraphStore(tempDir.resolve("map.json"));
            NavigationGraph graph = new NavigationGraph();
            graph.add(Screen.discovered("HomeScreen", List.of(), 0));
            store.save(graph);

            store.save(sampleGraph());

            assertEquals(2, store.load().orElseThrow().size());
            try (var files = Files.list(tempDir)) {
                assertEquals(1, files.count());
            }
        }

        @Test
        @DisplayName("Should create the session directory")
        void shouldCreateSessionDirectory() {
            CrawlProperties properties = new CrawlProperties();
            properties.setSessionDir(tempDir.resolve("session").toString());
            GraphStore store = new GraphStore(properties);

            assertTrue(store.save(sampleGraph()));
            assertEquals(tempDir.resolve("session").resolve("app_map_progress_v3.json"), store.getMapFile());
            assertTrue(Files.exists(store.getMapFile()));
        }

        @Test
        @DisplayName("Should report failure instead of throwing")
        void shouldReportFailure() throws Exception {
            Path blocker = tempDir.resolve("blocker");
            Files.writeString(blocker, "not a directory");
            GraphStore store = new GraphStore(blocker.resolve("map.json"));

            assertFalse(store.save(sampleGraph()));
        }

        @Test
        @DisplayName("Should return empty for missing or corrupt file")
        void shouldReturnEmptyForMissingOrCorruptFile() throws Exception {
            GraphStore store = new GraphStore(tempDir.resolve("map.json"));
            assertTrue(store.load().isEmpty());

            Files.writeString(store.getMapFile(), "{ not json");
            assertTrue(store.load().isEmpty());
        }
    }
}
