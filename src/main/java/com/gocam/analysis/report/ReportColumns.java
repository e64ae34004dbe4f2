package com.gocam.analysis.report;

import java.util.List;

/**
 * Column headers of the TSV reports. Order and names are read by downstream
 * spreadsheet and visualization tooling and must not change.
 */
public final class ReportColumns {

    public static final List<String> NODES = List.of(
            "model_id", "title", "taxon", "originating_model_id", "individual_id",
            "node_id", "label", "node_type", "enabled_by_type", "enabled_by_id",
            "enabled_by_label", "process", "input", "output", "occurs_in",
            "located_in", "happens_during", "constituent_parts");

    public static final List<String> TUPLES = List.of(
            "model_id", "title", "subject_label", "subject_id", "property_label",
            "object_label", "object_id");

    public static final List<String> STATS = List.of(
            "model_id", "title", "taxon", "total_genes", "total_complexes",
            "max_connected_activities", "total_connected_activities", "number_of_holes");

    public static final List<String> CONNECTED_GENES = List.of(
            "activity_count", "gene_id");

    public static final List<String> OVERLAPS = List.of(
            "node_id", "node_label", "node_type", "part_of_processes", "occurs_in",
            "located_in", "model_ids", "model_titles");

    private ReportColumns() {
        // Constants
    }
}
