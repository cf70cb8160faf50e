package com.nevis.chunking.config;

import com.nevis.chunking.exception.ConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PipelineSettingsTest {

    @Test
    @DisplayName("Should accept the shipped defaults")
    void shouldAcceptDefaults() {
        PipelineSettings settings = TestSettings.settings();

        assertThat(settings.validate()).isSameAs(settings);
    }

    @Test
    @DisplayName("Should list every violated constraint at once")
    void shouldCollectViolations() {
        PipelineSettings settings = new PipelineSettings(
            new ChunkingProperties(400, 250, 200, 550, 800, 120),
            new RouterProperties(0.5, 0.3, 0.3, 0.6),
            TestSettings.features(),
            TestSettings.llm(),
            new RateLimitProperties(60, 10, 100, 0.3, 10.0, 0.000125, 0.000375, "Mars/Olympus"),
            new BatchProperties(10, 4, 100, 1.5, true, 2, 2, 100, Duration.ofHours(1)));

        assertThatThrownBy(settings::validate)
            .isInstanceOfSatisfying(ConfigurationException.class, e -> assertThat(e.getViolations())
                .hasSize(5)
                .anySatisfy(v -> assertThat(v).contains("overlap-words"))
                .anySatisfy(v -> assertThat(v).contains("target-words + min-words"))
                .anySatisfy(v -> assertThat(v).contains("router weights"))
                .anySatisfy(v -> assertThat(v).contains("backpressure-threshold"))
                .anySatisfy(v -> assertThat(v).contains("cost-zone")));
    }

    @Test
    @DisplayName("Should reject word limits out of order")
    void shouldRejectUnorderedWordLimits() {
        PipelineSettings settings = new PipelineSettings(new ChunkingProperties(150, 80, 200, 600, 800, 120),
            TestSettings.router(), TestSettings.features(), TestSettings.llm(), TestSettings.rateLimit(), TestSettings.batch());

        assertThatThrownBy(settings::validate).isInstanceOf(ConfigurationException.class).hasMessageContaining("min < target < max");
    }

    @Test
    @DisplayName("Should reject a retry ceiling below the base delay")
    void shouldRejectInvertedDelays() {
        LlmProperties llm = new LlmProperties("key", "model", Duration.ofSeconds(30), 3, Duration.ofSeconds(10),
            Duration.ofSeconds(1), 5, Duration.ofSeconds(60), 0.1, 256, false);
        PipelineSettings settings = new PipelineSettings(TestSettings.chunking(), TestSettings.router(),
            TestSettings.features(), llm, TestSettings.rateLimit(), TestSettings.batch());

        assertThatThrownBy(settings::validate).hasMessageContaining("max-delay");
    }

    @Test
    @DisplayName("Should bump the version on reload and keep the old snapshot when invalid")
    void shouldReloadSettings() {
        PipelineSettingsHolder holder = new PipelineSettingsHolder(TestSettings.settings());
        PipelineSettings stricter = new PipelineSettings(TestSettings.chunking(), new RouterProperties(0.4, 0.3, 0.3, 0.8),
            TestSettings.features(), TestSettings.llm(), TestSettings.rateLimit(), TestSettings.batch());
        PipelineSettings broken = new PipelineSettings(TestSettings.chunking(), new RouterProperties(0.9, 0.3, 0.3, 0.8),
            TestSettings.features(), TestSettings.llm(), TestSettings.rateLimit(), TestSettings.batch());

        assertThat(holder.version()).isEqualTo(1);
        assertThat(holder.reload(stricter)).isEqualTo(2);
        assertThat(holder.current().router().confidenceMin()).isEqualTo(0.8);

        assertThatThrownBy(() -> holder.reload(broken)).isInstanceOf(ConfigurationException.class);
        assertThat(holder.version()).isEqualTo(2);
        assertThat(holder.current()).isSameAs(stricter);
    }
}
