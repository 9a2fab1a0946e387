package org.javai.replay;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.*;

class SettingsTest {

    private static final String PROP = "replay.test.setting";
    private static final String ENV = "REPLAY_TEST_SETTING_THAT_IS_NOT_SET";

    @AfterEach
    void tearDown() {
        System.clearProperty(PROP);
    }

    @Test
    void resolve_prefersSystemProperty() {
        System.setProperty(PROP, "  value ");

        assertThat(Settings.resolve(PROP, ENV, "fallback")).isEqualTo("value");
    }

    @Test
    void resolve_blankCountsAsMissing() {
        System.setProperty(PROP, "   ");

        assertThat(Settings.resolve(PROP, ENV, "fallback")).isEqualTo("fallback");
    }

    @Test
    void resolveDuration_acceptsMillisAndIso() {
        System.setProperty(PROP, "250");
        assertThat(Settings.resolveDuration(PROP, ENV, Duration.ZERO)).isEqualTo(Duration.ofMillis(250));

        System.setProperty(PROP, "PT2S");
        assertThat(Settings.resolveDuration(PROP, ENV, Duration.ZERO)).isEqualTo(Duration.ofSeconds(2));
    }

    @Test
    void resolveDuration_missing_usesDefault() {
        assertThat(Settings.resolveDuration(PROP, ENV, Duration.ofSeconds(3))).isEqualTo(Duration.ofSeconds(3));
    }

    @Test
    void resolveDuration_malformed_throws() {
        System.setProperty(PROP, "soon");

        assertThatThrownBy(() -> Settings.resolveDuration(PROP, ENV, Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("soon");
    }

    @Test
    void resolveDouble_parsesOrThrows() {
        System.setProperty(PROP, "1.5");
        assertThat(Settings.resolveDouble(PROP, ENV, 0)).isEqualTo(1.5);

        System.setProperty(PROP, "lots");
        assertThatThrownBy(() -> Settings.resolveDouble(PROP, ENV, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
