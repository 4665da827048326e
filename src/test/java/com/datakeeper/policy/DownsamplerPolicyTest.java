package com.datakeeper.policy;

import com.datakeeper.config.ConfigLoader;
import com.datakeeper.config.DownsamplingMethod;
import com.datakeeper.config.PolicyDefinition;
import com.datakeeper.config.SelectorDefinition;
import com.datakeeper.exception.ConfigurationException;
import com.datakeeper.operation.OperationResult;
import com.datakeeper.plugin.PluginRegistry;
import com.datakeeper.testutil.Definitions;
import com.datakeeper.testutil.Hdf5Samples;
import com.datakeeper.testutil.RecordingOperation;
import io.jhdf.HdfFile;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DownsamplerPolicyTest {

    private static final SelectorDefinition SELECTOR = new SelectorDefinition(
            List.of("hdf5"), List.of("high-frequency"), List.of("/tmp/samplers"));

    private static final DownsamplingMethod TEMPORAL_MEAN =
            new DownsamplingMethod("temporal", "mean", 2, List.of("data"), "all");

    private PluginRegistry registry;
    private RecordingOperation recorder;

    @BeforeEach
    void setUp() {
        registry = PluginRegistry.withBuiltins();
        recorder = new RecordingOperation();
        registry.registerOperation(RecordingOperation.class, () -> recorder);
    }

    @Test
    @DisplayName("Should pass methods and preserve_original to its operations")
    void shouldApplyMethods() {
        PolicyDefinition definition = Definitions.downsampler("sampling-reduction", SELECTOR,
                List.of("recording"), List.of(TEMPORAL_MEAN), false);
        DownsamplerPolicy policy = new DownsamplerPolicy("sampling-reduction-1", definition, registry);

        assertTrue(policy.evaluate(PolicyContext.empty()).isAccepted());
        assertTrue(policy.apply(PolicyContext.empty()).isPresent());

        PolicyContext applied = recorder.lastContext();
        assertEquals(List.of(TEMPORAL_MEAN), applied.getMethods());
        assertFalse(applied.isPreserveOriginal());
        assertEquals(List.of("/tmp/samplers"), applied.getFilePaths());
        assertEquals("downsampler", policy.getKind());
    }

    @Test
    @DisplayName("Should reject contexts outside its selector")
    void shouldRejectOtherDataTypes() {
        PolicyDefinition definition = Definitions.downsampler("sampling-reduction", SELECTOR,
                List.of("recording"), List.of(TEMPORAL_MEAN), true);
        DownsamplerPolicy policy = new DownsamplerPolicy("sampling-reduction-1", definition, registry);

        assertFalse(policy.evaluate(PolicyContext.builder().dataTypes(List.of("csv")).build()).isAccepted());
    }

    @Test
    @DisplayName("Should keep the rest of the file when the shipped sampling-reduction policy runs")
    void shouldKeepOtherContentWithShippedPolicy(@TempDir Path dataDir) {
        PolicyDefinition definition = ConfigLoader.load("classpath:policy.yaml").policies().stream()
                .filter(p -> "sampling-reduction".equals(p.name()))
                .findFirst()
                .orElseThrow();
        assertFalse(definition.actions().get(0).spec().preserveOriginal());
        DownsamplerPolicy policy = new DownsamplerPolicy("sampling-reduction-1", definition,
                PluginRegistry.withBuiltins());
        Path file = Hdf5Samples.write(dataDir.resolve("run.hdf5"), 8, 4);

        OperationResult result = policy.apply(PolicyContext.builder()
                .filePaths(List.of(dataDir.toString()))
                .build()).orElseThrow();

        assertTrue(result.isSuccess(), result.message());
        try (HdfFile hdf = new HdfFile(file)) {
            assertEquals(4, ((double[][]) hdf.getDatasetByPath("data").getData()).length);
            assertArrayEquals(new int[]{0, 1, 2, 3}, (int[]) hdf.getDatasetByPath("meta/channels").getData());
            assertNotNull(hdf.getAttribute("instrument"));
        }
    }

    @ParameterizedTest
    @CsvSource({
            "diagonal, mean, 2, all",
            "temporal, median, 2, all",
            "spatial, mean, 0, all",
            "temporal, mean, 2, '0,1'"
    })
    @DisplayName("Should reject invalid downsampling methods")
    void shouldRejectInvalidMethods(String dimension, String algorithm, int factor, String channels) {
        DownsamplingMethod method = new DownsamplingMethod(dimension, algorithm, factor, List.of("data"), channels);
        PolicyDefinition definition = Definitions.downsampler("bad", SELECTOR, List.of("recording"),
                List.of(method), true);

        assertThrows(ConfigurationException.class, () -> new DownsamplerPolicy("bad-1", definition, registry));
    }

    @Test
    @DisplayName("Should require at least one method")
    void shouldRequireMethods() {
        PolicyDefinition definition = Definitions.downsampler("bad", SELECTOR, List.of("recording"), List.of(), true);

        assertThrows(ConfigurationException.class, () -> new DownsamplerPolicy("bad-1", definition, registry));
    }
}
