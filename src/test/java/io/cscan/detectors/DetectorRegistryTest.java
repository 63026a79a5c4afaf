package io.cscan.detectors;

import io.cscan.config.CheckerConfig;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DetectorRegistryTest {

    @Test
    void createDefault_registersAllDetectorsInOrder() {
        DetectorRegistry registry = DetectorRegistry.createDefault();

        assertThat(registry.allDetectors())
                .extracting(Detector::id)
                .containsExactly("memory-safety", "uninitialized-variable", "standard-library",
                        "numeric-control-flow");
    }

    @Test
    void getById_findsRegisteredDetector() {
        DetectorRegistry registry = DetectorRegistry.createDefault();

        assertThat(registry.getById("standard-library")).containsInstanceOf(StandardLibraryDetector.class);
        assertThat(registry.getById("nonexistent")).isEmpty();
    }

    @Test
    void enabledDetectors_skipsDetectorsDisabledInConfig() {
        CheckerConfig config = CheckerConfig.loadDefault().merge(CheckerConfig.load(new ByteArrayInputStream(
                "disabledDetectors: [standard-library]\n".getBytes(StandardCharsets.UTF_8))));

        List<Detector> enabled = DetectorRegistry.createDefault().enabledDetectors(config);

        assertThat(enabled)
                .extracting(Detector::id)
                .containsExactly("memory-safety", "uninitialized-variable", "numeric-control-flow");
    }

    @Test
    void select_keepsRegistryOrder() {
        DetectorRegistry selected = DetectorRegistry.createDefault()
                .select(List.of("numeric-control-flow", "memory-safety"));

        assertThat(selected.allDetectors())
                .extracting(Detector::id)
                .containsExactly("memory-safety", "numeric-control-flow");
    }

    @Test
    void select_rejectsUnknownId() {
        DetectorRegistry registry = DetectorRegistry.createDefault();

        assertThatThrownBy(() -> registry.select(List.of("memory-safety", "style")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Unknown detector: style");
    }

    @Test
    void of_usesGivenDetectors() {
        DetectorRegistry registry = DetectorRegistry.of(new MemorySafetyDetector());

        assertThat(registry.allDetectors()).hasSize(1);
        assertThat(registry.allDetectors().get(0).module().displayName()).isEqualTo("Memory-Safety");
    }
}
