package com.cartographer.action;

import com.cartographer.action.AdbCommandRunner.ExecutionResult;
import com.cartographer.config.AdbProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.awt.Dimension;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("AdbDeviceBridge Tests")
class AdbDeviceBridgeTest {

    @Mock
    private AdbCommandRunner runner;

    private AdbProperties properties;
    private AdbDeviceBridge bridge;

    @BeforeEach
    void setUp() {
        properties = new AdbProperties();
        bridge = new AdbDeviceBridge(runner, properties);
    }

    private static ExecutionResult ok(String output) {
        return new ExecutionResult(true, output, 0);
    }

    @Nested
    @DisplayName("UiCapture tests")
    class CaptureTests {

        @Test
        @DisplayName("Should dump and read the hierarchy")
        void shouldDumpAndRead() {
            when(runner.shell("uiautomator", "dump", "/sdcard/cartographer_window_dump.xml"))
                    .thenReturn(ok("UI hierchary dumped to: /sdcard/cartographer_window_dump.xml"));
            when(runner.shell("cat", "/sdcard/cartographer_window_dump.xml"))
                    .thenReturn(ok("<?xml version='1.0' ?><hierarchy rotation=\"0\"></hierarchy>"));

            assertTrue(bridge.captureTree().startsWith("<?xml"));
        }

        @Test
        @DisplayName("Should return empty document when dump fails")
        void shouldReturnEmptyWhenDumpFails() {
            when(runner.shell("uiautomator", "dump", "/sdcard/cartographer_window_dump.xml"))
                    .thenReturn(new ExecutionResult(false, "ERROR: null root node", 1));

            assertEquals("", bridge.captureTree());
            verify(runner, never()).shell("cat", "/sdcard/cartographer_window_dump.xml");
        }

        @Test
        @DisplayName("Should read the focused window")
        void shouldReadFocusedWindow() {
            when(runner.shell("dumpsys", "window")).thenReturn(ok("""
                      mCurrentFocus=Window{4b1c2a0 u0 com.whatsapp/com.whatsapp.HomeActivity}
                      mFocusedApp=ActivityRecord{5c7 u0 com.whatsapp/.HomeActivity t12}
                    """));

            assertEquals("com.whatsapp/com.whatsapp.HomeActivity", bridge.currentForegroundApp().orElseThrow());
        }

        @Test
        @DisplayName("Should prefer override size and cache it")
        void shouldPreferOverrideSize() {
            when(runner.shell("wm", "size")).thenReturn(ok("Physical size: 1080x2400\nOverride size: 720x1600"));

            assertEquals(new Dimension(720, 1600), bridge.viewportSize());
            assertEquals(new Dimension(720, 1600), bridge.viewportSize());
            verify(runner, times(1)).shell("wm", "size");
        }
    }

    @Nested
    @DisplayName("InteractionDriver tests")
    class DriverTests {

        @Test
        @DisplayName("Should send tap and key events")
        void shouldSendTapAndKeys() {
            bridge.tap(540, 250);
            bridge.back();
            bridge.home();

            verify(runner).shell("input", "tap", "540", "250");
            verify(runner).shell("input", "keyevent", "4");
            verify(runner).shell("input", "keyevent", "3");
        }

        @Test
        @DisplayName("Should escape spaces and shell characters")
        void shouldEscapeInputText() {
            assertEquals("Ayush%sChaudhary", AdbDeviceBridge.escapeInputText("Ayush Chaudhary"));
            assertEquals("it\\'s%s\\(ok\\)", AdbDeviceBridge.escapeInputText("it's (ok)"));
        }

        @Test
        @DisplayName("Should detect monkey launch failure")
        void shouldDetectLaunchFailure() {
            when(runner.shell("monkey", "-p", "com.missing", "-c", "android.intent.category.LAUNCHER", "1"))
                    .thenReturn(ok("** No activities found to run, monkey aborted."));
            when(runner.shell("monkey", "-p", "com.whatsapp", "-c", "android.intent.category.LAUNCHER", "1"))
                    .thenReturn(ok("Events injected: 1"));

            assertFalse(bridge.launchApp("com.missing"));
            assertTrue(bridge.launchApp("com.whatsapp"));
        }
    }

    @Nested
    @DisplayName("AppCatalog tests")
    class CatalogTests {

        @Test
        @DisplayName("Configured labels should come before derived ones")
        void configuredLabelsFirst() {
            properties.getAppLabels().put("WhatsApp", "com.whatsapp");
            when(runner.shell("pm", "list", "packages"))
                    .thenReturn(ok("package:com.whatsapp\npackage:com.android.settings\n"));

            List<AppCatalog.InstalledApp> apps = bridge.installedApps();

            assertEquals(new AppCatalog.InstalledApp("WhatsApp", "com.whatsapp"), apps.get(0));
            assertTrue(apps.contains(new AppCatalog.InstalledApp("settings", "com.android.settings")));
        }
    }
}
