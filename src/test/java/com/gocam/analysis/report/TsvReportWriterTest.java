package com.gocam.analysis.report;

import com.gocam.analysis.connectivity.ModelStats;
import com.gocam.analysis.core.model.GoCamGraph;
import com.gocam.analysis.core.model.GoCamModel;
import com.gocam.analysis.core.model.Individual;
import com.gocam.analysis.core.model.IndividualType;
import com.gocam.analysis.core.model.ModelRef;
import com.gocam.analysis.core.model.NodeKind;
import com.gocam.analysis.core.model.OverlapRecord;
import com.gocam.analysis.graph.GraphBuilder;
import com.gocam.analysis.holes.HoleDetector;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.StringWriter;
import java.util.List;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

import static com.gocam.analysis.TestModels.*;
import static org.junit.jupiter.api.Assertions.*;

class TsvReportWriterTest {

    private TsvReportWriter writer;
    private GoCamModel model;
    private GoCamGraph graph;

    @BeforeEach
    void setUp() {
        writer = new TsvReportWriter();
        model = GoCamModel.builder()
                .id("gomodel:1")
                .title("kinase model")
                .taxon("NCBITaxon:4896")
                .individual(activity("A1", "GO:0004672", "protein kinase activity"))
                .individual(gene("G1", "PomBase:SPAC1.01", "cdc2"))
                .individual(chemical("C1", "CHEBI:15422", "ATP"))
                .individual(chemical("C2", "CHEBI:16761", "ADP"))
                .individual(process("P1", "GO:0007049", "cell cycle"))
                .individual(component("L1", "GO:0005634", "nucleus"))
                .fact(fact("f1", "A1", "enabled by", "G1"))
                .fact(fact("f2", "A1", "has input", "C1"))
                .fact(fact("f3", "A1", "has output", "C2"))
                .fact(fact("f4", "A1", "part of", "P1"))
                .fact(fact("f5", "A1", "occurs in", "L1"))
                .fact(fact("f6", "A1", "has input", "MISSING"))
                .build();
        graph = new GraphBuilder().build(model);
    }

    private static String[] lines(StringWriter out) {
        return out.toString().split("\n", -1);
    }

    @Nested
    @DisplayName("Node report")
    class NodeReport {

        @Test
        @DisplayName("Header lists the node columns in order")
        void testHeader() {
            StringWriter out = new StringWriter();
            writer.writeNodes(graph, out);

            assertEquals(String.join("\t", ReportColumns.NODES), lines(out)[0]);
        }

        @Test
        @DisplayName("Activity row carries enabler and context columns")
        void testActivityRow() {
            List<String> row = writer.nodeRow(graph, graph.getNodes().get(0));

            assertEquals(ReportColumns.NODES.size(), row.size());
            assertEquals(List.of(
                    "gomodel:1", "kinase model", "NCBITaxon:4896", "gomodel:1", "A1",
                    "GO:0004672", "protein kinase activity", "activity", "gene", "PomBase:SPAC1.01",
                    "cdc2", "cell cycle", "ATP", "ADP", "nucleus",
                    "", "", ""), row);
        }

        @Test
        @DisplayName("One row per node, every row with the same column count")
        void testRowCount() {
            StringWriter out = new StringWriter();

            long rows = writer.writeNodes(graph, out);

            assertEquals(3, rows);
            String[] lines = lines(out);
            assertEquals(5, lines.length);
            assertEquals("", lines[4]);
            for (int i = 0; i < 4; i++) {
                assertEquals(ReportColumns.NODES.size(), lines[i].split("\t", -1).length);
            }
        }

        @Test
        @DisplayName("Header can be turned off")
        void testNoHeader() {
            StringWriter out = new StringWriter();

            new TsvReportWriter(false).writeNodes(graph, out);

            assertTrue(lines(out)[0].startsWith("gomodel:1\t"));
        }

        @Test
        @DisplayName("Hole report uses the node columns")
        void testHoles() {
            StringWriter out = new StringWriter();

            long rows = writer.writeHoles(graph, new HoleDetector().findHoles(graph), out);

            assertEquals(0, rows);
            assertEquals(String.join("\t", ReportColumns.NODES), lines(out)[0]);
        }
    }

    @Test
    @DisplayName("Tuples follow fact order and skip dangling facts")
    void testTuples() {
        StringWriter out = new StringWriter();

        long rows = writer.writeTuples(model, out);

        assertEquals(5, rows);
        String[] lines = lines(out);
        assertEquals(String.join("\t", ReportColumns.TUPLES), lines[0]);
        assertEquals("gomodel:1\tkinase model\tprotein kinase activity\tGO:0004672\tenabled by\tcdc2\tPomBase:SPAC1.01",
                lines[1]);
        assertEquals("gomodel:1\tkinase model\tprotein kinase activity\tGO:0004672\toccurs in\tnucleus\tGO:0005634",
                lines[5]);
    }

    @Test
    @DisplayName("Tuples fall back to the raw type string when a type has no id")
    void testTupleTypeString() {
        GoCamModel expressionModel = GoCamModel.builder()
                .id("gomodel:2")
                .individual(new Individual("A1",
                        List.of(IndividualType.of("GO:0003674", "molecular_function")), List.of()))
                .individual(new Individual("X1",
                        List.of(new IndividualType(null, null, "ObjectIntersectionOf(...)")), List.of()))
                .fact(fact("f1", "A1", "has input", "X1"))
                .build();
        StringWriter out = new StringWriter();

        new TsvReportWriter(false).writeTuples(expressionModel, out);

        assertEquals("gomodel:2\t\tmolecular_function\tGO:0003674\thas input\t\tObjectIntersectionOf(...)\n",
                out.toString());
    }

    @Test
    @DisplayName("Stats rows follow the stats columns")
    void testStats() {
        StringWriter out = new StringWriter();

        writer.writeStats(List.of(new ModelStats("gomodel:1", "kinase model", "NCBITaxon:4896", 3, 1, 2, 4, 5L)), out);

        assertEquals("gomodel:1\tkinase model\tNCBITaxon:4896\t3\t1\t2\t4\t5", lines(out)[1]);
    }

    @Test
    @DisplayName("Connected genes are written by bucket then gene id")
    void testConnectedGenes() {
        SortedMap<Integer, SortedSet<String>> buckets = new TreeMap<>();
        buckets.put(2, new TreeSet<>(List.of("PomBase:b", "PomBase:a")));
        buckets.put(0, new TreeSet<>(List.of("PomBase:c")));
        StringWriter out = new StringWriter();

        long rows = new TsvReportWriter(false).writeConnectedGenes(buckets, out);

        assertEquals(3, rows);
        assertEquals("0\tPomBase:c\n2\tPomBase:a\n2\tPomBase:b\n", out.toString());
    }

    @Test
    @DisplayName("Overlap rows join models and context with commas")
    void testOverlaps() {
        OverlapRecord water = new OverlapRecord("CHEBI:15377", "water", NodeKind.CHEMICAL,
                List.of(new ModelRef("gomodel:A", "hydrolysis", ""), new ModelRef("gomodel:B", "transport", "")),
                new TreeSet<>(List.of("cell cycle")), new TreeSet<>(), new TreeSet<>(List.of("plasma membrane")));
        StringWriter out = new StringWriter();

        new TsvReportWriter(false).writeOverlaps(List.of(water), out);

        assertEquals("CHEBI:15377\twater\tchemical\tcell cycle\t\tplasma membrane\tgomodel:A,gomodel:B\thydrolysis,transport\n",
                out.toString());
    }

    @Test
    @DisplayName("Tabs and line breaks inside values are replaced by spaces")
    void testClean() {
        assertEquals("a b c d", TsvReportWriter.clean("a\tb\nc\rd"));
        assertEquals("", TsvReportWriter.clean(null));
    }
}
