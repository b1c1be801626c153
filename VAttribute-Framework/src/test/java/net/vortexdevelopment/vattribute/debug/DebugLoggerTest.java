package net.vortexdevelopment.vattribute.debug;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

class DebugLoggerTest {

    private final ByteArrayOutputStream output = new ByteArrayOutputStream();
    private PrintStream originalOut;

    @BeforeEach
    void captureOutput() {
        originalOut = System.out;
        System.setOut(new PrintStream(output, true, StandardCharsets.UTF_8));
        DebugLogger.clearAll();
    }

    @AfterEach
    void restoreOutput() {
        System.setOut(originalOut);
        DebugLogger.clearAll();
    }

    @Test
    void silentUnlessEnabled() {
        DebugLogger.log(DebugLoggerTest.class, "hidden %d", 1);

        assertThat(output.toString(StandardCharsets.UTF_8)).isEmpty();
    }

    @Test
    void perClassOptIn() {
        DebugLogger.enableDebugFor(DebugLoggerTest.class);

        DebugLogger.log(DebugLoggerTest.class, "resolved %s", "app.Point");
        DebugLogger.log(String.class, "not for me");

        assertThat(output.toString(StandardCharsets.UTF_8).trim())
                .isEqualTo("[DEBUG:DebugLoggerTest] resolved app.Point");
    }

    @Test
    void globalSwitchCoversEveryClass() {
        System.setProperty("vattribute.debug.all", "true");
        try {
            DebugLogger.clearAll();
            assertThat(DebugLogger.isEnabled(String.class)).isTrue();
        } finally {
            System.clearProperty("vattribute.debug.all");
        }
        DebugLogger.clearAll();
        assertThat(DebugLogger.isEnabled(String.class)).isFalse();
    }
}
