package com.phasecontrol.generator.codegen.input;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.phasecontrol.generator.codegen.model.Activation;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for JsonActivationSource.
 */
class JsonActivationSourceTest {

    private static final String ROWS = """
            [
              {"phaseInstanceId": 1, "stepIndex": 3, "stepName": "Heat", "deviceClassCode": 8, "qualifierCode": 4, "tag": "TIC1"},
              {"phaseInstanceId": 1, "stepIndex": 1, "stepName": "Idle", "tag": null},
              {"phaseInstanceId": 2, "stepIndex": 2, "stepName": "Fill", "deviceClassCode": 0, "qualifierCode": 0, "tag": "XV1"},
              {"phaseInstanceId": 1, "stepIndex": 2, "stepName": "Fill", "deviceClassCode": 0, "qualifierCode": 0, "tag": "XV2"}
            ]
            """;

    @Test
    void testFetchAllSortedByStep(@TempDir Path tempDir) throws Exception {
        JsonActivationSource source = new JsonActivationSource(write(tempDir, ROWS));

        List<Activation> activations = source.fetchActivations(null);

        assertThat(activations).extracting(Activation::getStepIndex).containsExactly(1, 2, 2, 3);
        assertThat(activations).extracting(Activation::getTag).containsExactly(null, "XV1", "XV2", "TIC1");
        assertThat(activations.get(0).hasActivation()).isFalse();
        assertThat(activations.get(3).getDeviceClassCode()).isEqualTo(8);
        assertThat(activations.get(3).getQualifierCode()).isEqualTo(4);
    }

    @Test
    void testFetchFiltersByPhaseInstance(@TempDir Path tempDir) throws Exception {
        JsonActivationSource source = new JsonActivationSource(write(tempDir, ROWS));

        List<Activation> activations = source.fetchActivations(1);

        assertThat(activations).extracting(Activation::getTag).containsExactly(null, "XV2", "TIC1");
        assertThat(source.fetchActivations(9)).isEmpty();
    }

    @Test
    void testMissingCodesReadAsZero(@TempDir Path tempDir) throws Exception {
        JsonActivationSource source = new JsonActivationSource(
                write(tempDir, "[{\"stepIndex\": 5, \"stepName\": \"Drain\", \"tag\": \"DO5\"}]"));

        Activation activation = source.fetchActivations(null).get(0);

        assertThat(activation.getDeviceClassCode()).isZero();
        assertThat(activation.getQualifierCode()).isZero();
        assertThat(activation.getPhaseInstanceId()).isNull();
    }

    @Test
    void testStepIndexIsRequired(@TempDir Path tempDir) {
        JsonActivationSource source = new JsonActivationSource(
                write(tempDir, "[{\"stepIndex\": 1, \"stepName\": \"Idle\"}, {\"stepName\": \"Fill\"}]"));

        assertThatThrownBy(() -> source.fetchActivations(null))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("Row 2");
    }

    @Test
    void testObjectRootIsRejected(@TempDir Path tempDir) {
        JsonActivationSource source = new JsonActivationSource(write(tempDir, "{}"));

        assertThatThrownBy(() -> source.fetchActivations(null))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("JSON array");
    }

    private static Path write(Path dir, String content) {
        Path file = dir.resolve("activations.json");
        try {
            Files.writeString(file, content);
        } catch (IOException e) {
            throw new IllegalStateException(e);
        }
        return file;
    }
}
