package com.gocam.analysis.api;

import com.gocam.analysis.core.model.GoCamModel;
import com.gocam.analysis.graph.GraphBuilder;
import com.gocam.analysis.metrics.MetricsService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static com.gocam.analysis.TestModels.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class BatchLoaderTest {

    @Mock
    private MetricsService metricsService;

    @Mock
    private ModelSource brokenSource;

    private GraphBuilder graphBuilder;

    @BeforeEach
    void setUp() {
        graphBuilder = new GraphBuilder();
    }

    private static GoCamModel model(String id) {
        return GoCamModel.builder()
                .id(id)
                .title("model " + id)
                .individual(activity("A1", "GO:0003824", "catalytic activity"))
                .build();
    }

    @Test
    @DisplayName("A malformed source is reported and the rest of the batch loads")
    void testParseFailureIsolated() {
        when(brokenSource.name()).thenReturn("models/broken.json");
        when(brokenSource.load()).thenThrow(new ModelParseException("unexpected end of input"));
        BatchLoader loader = new BatchLoader(graphBuilder::build, 1, metricsService);

        BatchResult result = loader.load(List.of(
                ModelSource.of(model("gomodel:1")), brokenSource, ModelSource.of(model("gomodel:2"))));

        assertTrue(result.hasErrors());
        assertFalse(result.isSuccess());
        assertEquals(List.of("gomodel:1", "gomodel:2"),
                result.models().stream().map(GoCamModel::getId).collect(Collectors.toList()));
        assertEquals(2, result.graphs().size());
        assertEquals(1, result.failures().size());
        assertEquals("models/broken.json", result.failures().get(0).sourceName());
        assertEquals("unexpected end of input", result.failures().get(0).message());
        verify(metricsService).recordBatchFailure();
    }

    @Test
    @DisplayName("An unreadable source is reported like a parse failure")
    void testReadFailureIsolated() {
        when(brokenSource.name()).thenReturn("models/missing.json");
        when(brokenSource.load()).thenThrow(new UncheckedIOException(new IOException("No such file")));
        BatchLoader loader = new BatchLoader(graphBuilder::build, 1, metricsService);

        BatchResult result = loader.load(List.of(brokenSource));

        assertTrue(result.loaded().isEmpty());
        assertEquals("models/missing.json", result.failures().get(0).sourceName());
    }

    private static ModelSource withoutModelId(String name) {
        return new ModelSource() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public GoCamModel load() {
                return GoCamModel.builder().title("no id").build();
            }
        };
    }

    @Test
    @DisplayName("A source failing while assembling its model does not abort the batch")
    void testModelAssemblyFailureIsolated() {
        BatchLoader loader = new BatchLoader(graphBuilder::build, 1, metricsService);

        BatchResult result = loader.load(List.of(
                ModelSource.of(model("gomodel:1")), withoutModelId("models/anonymous.json"),
                ModelSource.of(model("gomodel:2"))));

        assertEquals(2, result.loaded().size());
        assertEquals(1, result.failures().size());
        assertEquals("models/anonymous.json", result.failures().get(0).sourceName());
        assertEquals("id is required", result.failures().get(0).message());
        verify(metricsService).recordBatchFailure();
    }

    @Test
    @DisplayName("Parallel loading isolates model assembly failures")
    void testParallelModelAssemblyFailure() {
        BatchLoader loader = new BatchLoader(graphBuilder::build, 3, metricsService);

        BatchResult result = loader.load(List.of(
                ModelSource.of(model("gomodel:1")), withoutModelId("models/anonymous.json"),
                ModelSource.of(model("gomodel:2"))));

        assertEquals(List.of("gomodel:1", "gomodel:2"),
                result.models().stream().map(GoCamModel::getId).collect(Collectors.toList()));
        assertEquals("models/anonymous.json", result.failures().get(0).sourceName());
    }

    @Test
    @DisplayName("A graph build failure is recorded against its source")
    void testGraphBuildFailureIsolated() {
        BatchLoader loader = new BatchLoader(model -> {
            if (model.getId().equals("gomodel:2")) {
                throw new IllegalStateException();
            }
            return graphBuilder.build(model);
        }, 2, metricsService);

        BatchResult result = loader.load(List.of(
                ModelSource.of(model("gomodel:1")), ModelSource.of(model("gomodel:2"))));

        assertEquals(1, result.loaded().size());
        assertEquals("gomodel:2", result.failures().get(0).sourceName());
        assertEquals("IllegalStateException", result.failures().get(0).message());
        verify(metricsService).recordBatchFailure();
    }

    @Test
    @DisplayName("Parallel loading keeps source order")
    void testParallelOrder() {
        List<ModelSource> sources = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            sources.add(ModelSource.of(model("gomodel:" + i)));
        }
        BatchLoader loader = new BatchLoader(graphBuilder::build, 4, metricsService);

        BatchResult result = loader.load(sources);

        assertTrue(result.isSuccess());
        List<String> ids = result.loaded().stream()
                .map(BatchResult.Loaded::sourceName)
                .collect(Collectors.toList());
        List<String> expected = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            expected.add("gomodel:" + i);
        }
        assertEquals(expected, ids);
        assertEquals("gomodel:7", result.graphs().get(7).getId());
        verifyNoInteractions(metricsService);
    }

    @Test
    @DisplayName("Parallel loading isolates failures too")
    void testParallelFailure() {
        when(brokenSource.name()).thenReturn("models/broken.json");
        when(brokenSource.load()).thenThrow(new ModelParseException("bad"));
        BatchLoader loader = new BatchLoader(graphBuilder::build, 3, metricsService);

        BatchResult result = loader.load(List.of(
                ModelSource.of(model("gomodel:1")), brokenSource, ModelSource.of(model("gomodel:2"))));

        assertEquals(2, result.loaded().size());
        assertEquals(1, result.failures().size());
    }

    @Test
    @DisplayName("An empty batch succeeds with nothing loaded")
    void testEmptyBatch() {
        BatchResult result = new BatchLoader(graphBuilder::build, 2, metricsService).load(List.of());

        assertTrue(result.isSuccess());
        assertTrue(result.loaded().isEmpty());
    }

    @Test
    @DisplayName("Parallelism must be positive")
    void testInvalidParallelism() {
        assertThrows(IllegalArgumentException.class,
                () -> new BatchLoader(graphBuilder::build, 0, metricsService));
    }
}
