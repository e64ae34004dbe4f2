package com.gocam.analysis.report;

import com.gocam.analysis.connectivity.ModelStats;
import com.gocam.analysis.core.model.Enabler;
import com.gocam.analysis.core.model.Fact;
import com.gocam.analysis.core.model.GoCamGraph;
import com.gocam.analysis.core.model.GoCamModel;
import com.gocam.analysis.core.model.Individual;
import com.gocam.analysis.core.model.IndividualType;
import com.gocam.analysis.core.model.ModelRef;
import com.gocam.analysis.core.model.Node;
import com.gocam.analysis.core.model.OverlapRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Tab-separated report writer.
 *
 * <p>Cells are tab-joined; list cells are comma-joined; absent values are empty.
 * Tabs and line breaks inside values are replaced by spaces so every record
 * stays on one line. Each write method returns the number of data rows written.</p>
 */
public class TsvReportWriter {
    private static final Logger log = LoggerFactory.getLogger(TsvReportWriter.class);

    private final boolean includeHeader;

    public TsvReportWriter() {
        this(true);
    }

    public TsvReportWriter(boolean includeHeader) {
        this.includeHeader = includeHeader;
    }

    /**
     * Writes one row per node of the graph.
     */
    public long writeNodes(GoCamGraph graph, Writer writer) {
        return writeNodeRows(graph, graph.nodes().stream(), writer, "nodes");
    }

    /**
     * Writes one row per hole, using the node columns.
     */
    public long writeHoles(GoCamGraph graph, Stream<Node> holes, Writer writer) {
        return writeNodeRows(graph, holes, writer, "holes");
    }

    private long writeNodeRows(GoCamGraph graph, Stream<Node> nodes, Writer writer, String report) {
        PrintWriter pw = open(writer);
        header(pw, ReportColumns.NODES);
        long[] rows = {0};
        nodes.forEach(node -> {
            row(pw, nodeRow(graph, node));
            rows[0]++;
        });
        return finish(pw, report, rows[0]);
    }

    List<String> nodeRow(GoCamGraph graph, Node node) {
        Optional<Enabler> enabler = node.getEnabler();
        List<String> cells = new ArrayList<>(ReportColumns.NODES.size());
        cells.add(graph.getId());
        cells.add(graph.getTitle());
        cells.add(graph.getTaxon());
        cells.add(node.getOriginatingModelId());
        cells.add(node.getIndividualId());
        cells.add(node.getId());
        cells.add(node.getLabel());
        cells.add(node.getKind().getLabel());
        cells.add(enabler.map(e -> e.kind().getLabel()).orElse(""));
        cells.add(enabler.map(Enabler::id).orElse(""));
        cells.add(enabler.map(Enabler::label).orElse(""));
        cells.add(node.getPartOfProcess().map(IndividualType::labelOrId).orElse(""));
        cells.add(joinTypes(node.getInputs()));
        cells.add(joinTypes(node.getOutputs()));
        cells.add(joinTypes(node.getOccursIn()));
        cells.add(node.getLocatedIn().map(IndividualType::labelOrId).orElse(""));
        cells.add(node.getHappensDuring().map(IndividualType::labelOrId).orElse(""));
        cells.add(enabler.map(e -> String.join(",", e.constituents())).orElse(""));
        return cells;
    }

    /**
     * Writes every fact of a model as a subject/property/object tuple. Facts whose
     * subject or object is missing or untyped are skipped.
     */
    public long writeTuples(GoCamModel model, Writer writer) {
        PrintWriter pw = open(writer);
        header(pw, ReportColumns.TUPLES);
        long rows = 0;
        for (Fact fact : model.getFacts()) {
            Optional<IndividualType> subject = model.factSubject(fact).flatMap(Individual::primaryType);
            Optional<IndividualType> object = model.factObject(fact).flatMap(Individual::primaryType);
            if (subject.isEmpty() || object.isEmpty()) {
                continue;
            }
            row(pw, Arrays.asList(
                    model.getId(),
                    model.getTitle(),
                    nullToEmpty(subject.get().label()),
                    idOrTypeString(subject.get()),
                    fact.propertyLabel(),
                    nullToEmpty(object.get().label()),
                    idOrTypeString(object.get())));
            rows++;
        }
        return finish(pw, "tuples", rows);
    }

    public long writeStats(Collection<ModelStats> stats, Writer writer) {
        PrintWriter pw = open(writer);
        header(pw, ReportColumns.STATS);
        long rows = 0;
        for (ModelStats s : stats) {
            row(pw, Arrays.asList(
                    s.modelId(),
                    s.title(),
                    s.taxon(),
                    String.valueOf(s.totalGenes()),
                    String.valueOf(s.totalComplexes()),
                    String.valueOf(s.maxConnectedActivities()),
                    String.valueOf(s.totalConnectedActivities()),
                    String.valueOf(s.numberOfHoles())));
            rows++;
        }
        return finish(pw, "stats", rows);
    }

    /**
     * Writes one row per gene, ordered by activity count then gene id.
     */
    public long writeConnectedGenes(SortedMap<Integer, SortedSet<String>> buckets, Writer writer) {
        PrintWriter pw = open(writer);
        header(pw, ReportColumns.CONNECTED_GENES);
        long rows = 0;
        for (Map.Entry<Integer, SortedSet<String>> bucket : buckets.entrySet()) {
            for (String geneId : bucket.getValue()) {
                row(pw, Arrays.asList(String.valueOf(bucket.getKey()), geneId));
                rows++;
            }
        }
        return finish(pw, "connected-genes", rows);
    }

    public long writeOverlaps(List<OverlapRecord> overlaps, Writer writer) {
        PrintWriter pw = open(writer);
        header(pw, ReportColumns.OVERLAPS);
        long rows = 0;
        for (OverlapRecord overlap : overlaps) {
            row(pw, Arrays.asList(
                    overlap.nodeId(),
                    overlap.nodeLabel(),
                    overlap.nodeKind().getLabel(),
                    String.join(",", overlap.partOfProcesses()),
                    String.join(",", overlap.occursIn()),
                    String.join(",", overlap.locatedIn()),
                    overlap.models().stream().map(ModelRef::id).collect(Collectors.joining(",")),
                    overlap.models().stream().map(ModelRef::title).collect(Collectors.joining(","))));
            rows++;
        }
        return finish(pw, "overlaps", rows);
    }

    private PrintWriter open(Writer writer) {
        return writer instanceof PrintWriter p ? p : new PrintWriter(new BufferedWriter(writer));
    }

    private void header(PrintWriter pw, List<String> columns) {
        if (includeHeader) {
            pw.print(String.join("\t", columns));
            pw.print('\n');
        }
    }

    private void row(PrintWriter pw, List<String> cells) {
        pw.print(cells.stream().map(TsvReportWriter::clean).collect(Collectors.joining("\t")));
        pw.print('\n');
    }

    private long finish(PrintWriter pw, String report, long rows) {
        pw.flush();
        if (pw.checkError()) {
            throw new UncheckedIOException(new IOException("Failed to write " + report + " report"));
        }
        log.debug("report.written report={} rows={}", report, rows);
        return rows;
    }

    private static String joinTypes(List<IndividualType> types) {
        return types.stream().map(IndividualType::labelOrId).collect(Collectors.joining(","));
    }

    private static String idOrTypeString(IndividualType type) {
        return type.id() != null ? type.id() : type.typeString();
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }

    static String clean(String value) {
        if (value == null) {
            return "";
        }
        return value.replace('\t', ' ').replace('\r', ' ').replace('\n', ' ');
    }
}
