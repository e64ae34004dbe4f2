package com.gocam.analysis.export;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gocam.analysis.core.model.GoCamGraph;
import com.gocam.analysis.merge.ModelMerger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.List;

import static com.gocam.analysis.export.ExportFixtures.kinaseCascade;
import static org.junit.jupiter.api.Assertions.*;

class CytoscapeExporterTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private CytoscapeExporter exporter;

    @BeforeEach
    void setUp() {
        exporter = new CytoscapeExporter();
    }

    @Test
    @DisplayName("Nodes and edges are written as Cytoscape elements")
    void testElements() throws IOException {
        JsonNode root = mapper.readTree(exporter.exportToString(kinaseCascade("gomodel:1")));

        JsonNode nodes = root.get("nodes");
        assertEquals(2, nodes.size());
        assertEquals("a1", nodes.get(0).get("data").get("id").asText());
        assertEquals("protein kinase activity", nodes.get(0).get("data").get("label").asText());

        JsonNode edges = root.get("edges");
        assertEquals(1, edges.size());
        JsonNode edge = edges.get(0).get("data");
        assertEquals("f2", edge.get("id").asText());
        assertEquals("directly positively regulates", edge.get("label").asText());
        assertEquals("a1", edge.get("source").asText());
        assertEquals("a2", edge.get("target").asText());
    }

    @Test
    @DisplayName("Every edge endpoint names an exported node")
    void testEndpointsResolve() {
        GoCamGraph merged = new ModelMerger()
                .mergeModels("m", "merged", List.of(kinaseCascade("gomodel:1"), kinaseCascade("gomodel:2")))
                .getGraph().orElseThrow();

        JsonNode root = exporter.toElements(merged);

        List<String> nodeIds = root.get("nodes").findValuesAsText("id");
        assertEquals(4, nodeIds.size());
        assertEquals(4, nodeIds.stream().distinct().count());
        for (JsonNode edge : root.get("edges")) {
            assertTrue(nodeIds.contains(edge.get("data").get("source").asText()));
            assertTrue(nodeIds.contains(edge.get("data").get("target").asText()));
        }
        assertTrue(nodeIds.contains("gomodel:2/a1"));
    }

    @Test
    @DisplayName("Element ids stay unique when a graph is merged with itself")
    void testUniqueIdsAfterSelfMerge() {
        GoCamGraph cascade = kinaseCascade("gomodel:1");
        GoCamGraph merged = new ModelMerger()
                .mergeModels("m", "merged", List.of(cascade, cascade))
                .getGraph().orElseThrow();

        JsonNode root = exporter.toElements(merged);

        List<String> edgeIds = root.get("edges").findValuesAsText("id");
        assertEquals(List.of("gomodel:1/f2"), edgeIds);
        List<String> nodeIds = root.get("nodes").findValuesAsText("id");
        assertEquals(2, nodeIds.size());
        assertEquals(2, nodeIds.stream().distinct().count());
    }

    @Test
    @DisplayName("Export reports counts and leaves the writer open")
    void testResult() throws IOException {
        StringWriter writer = new StringWriter();

        ExportResult result = exporter.export(kinaseCascade("gomodel:1"), writer);

        assertEquals("cytoscape", result.format());
        assertEquals(2, result.nodesExported());
        assertEquals(1, result.edgesExported());
        writer.write("\n");
        assertTrue(writer.toString().endsWith("\n"));
    }

    @Test
    @DisplayName("Writer failures surface as UncheckedIOException")
    void testWriterFailure() {
        Writer failing = new Writer() {
            @Override
            public void write(char[] cbuf, int off, int len) throws IOException {
                throw new IOException("disk full");
            }

            @Override
            public void flush() throws IOException {
                throw new IOException("disk full");
            }

            @Override
            public void close() {
            }
        };

        assertThrows(UncheckedIOException.class, () -> exporter.export(kinaseCascade("gomodel:1"), failing));
    }
}
