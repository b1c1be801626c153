package net.vortexdevelopment.vattribute.config;

import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AnalyzerSettingsTest {

    private static Environment environment(String... keysAndValues) {
        Properties properties = new Properties();
        for (int i = 0; i < keysAndValues.length; i += 2) {
            properties.setProperty(keysAndValues[i], keysAndValues[i + 1]);
        }
        return new Environment(properties);
    }

    @Test
    void defaultsCacheWithoutDepthLimit() {
        AnalyzerSettings settings = AnalyzerSettings.fromEnvironment(environment());

        assertThat(settings.isCacheEnabled()).isTrue();
        assertThat(settings.getCustomMaxDepth()).isZero();
    }

    @Test
    void propertiesFileValuesAreRead() {
        AnalyzerSettings settings = AnalyzerSettings.fromEnvironment(environment(
                AnalyzerSettings.CACHE_ENABLED, "false",
                AnalyzerSettings.CUSTOM_MAX_DEPTH, " 8 "));

        assertThat(settings.isCacheEnabled()).isFalse();
        assertThat(settings.getCustomMaxDepth()).isEqualTo(8);
    }

    @Test
    void systemPropertiesWinOverFile() {
        String key = "vattribute.test.override";
        System.setProperty(key, "from-system");
        try {
            Environment environment = environment(key, "from-file");
            assertThat(environment.getProperty(key)).isEqualTo("from-system");
        } finally {
            System.clearProperty(key);
        }
        assertThat(environment(key, "from-file").getProperty(key)).isEqualTo("from-file");
    }

    @Test
    void malformedNumberFallsBackToDefault() {
        Environment environment = environment(AnalyzerSettings.CUSTOM_MAX_DEPTH, "deep");

        assertThat(AnalyzerSettings.fromEnvironment(environment).getCustomMaxDepth()).isZero();
    }

    @Test
    void negativeDepthIsRejected() {
        assertThatThrownBy(() -> AnalyzerSettings.fromEnvironment(environment(AnalyzerSettings.CUSTOM_MAX_DEPTH, "-1")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining(AnalyzerSettings.CUSTOM_MAX_DEPTH);
    }

    @Test
    void classpathFileIsLoaded() {
        assertThat(Environment.getInstance().getProperty("vattribute.test.marker")).isEqualTo("loaded");
    }
}
