package com.gocam.analysis.classify;

import com.gocam.analysis.core.model.EnablerKind;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Closed table mapping id namespace prefixes to enabler kinds.
 * Rows are matched in insertion order; the first matching prefix wins.
 */
public final class EnablerPrefixTable {

    /**
     * Institutional gene-id namespaces recognized out of the box.
     */
    public static final List<String> DEFAULT_GENE_PREFIXES = List.of(
            "PomBase:", "FB:", "UniProtKB:", "MGI:", "RGD:", "SGD:", "WB:",
            "ZFIN:", "TAIR:", "dictyBase:", "HGNC:", "NCBIGene:", "Xenbase:");

    private final Map<String, EnablerKind> rows;

    private EnablerPrefixTable(Map<String, EnablerKind> rows) {
        this.rows = Collections.unmodifiableMap(new LinkedHashMap<>(rows));
    }

    /**
     * Creates the default table.
     */
    public static EnablerPrefixTable defaults() {
        return builder().build();
    }

    /**
     * Resolves the enabler kind for a type id. Null ids and unmatched prefixes
     * give an unrecognized resolution.
     */
    public EnablerResolution resolve(String typeId) {
        if (typeId == null) {
            return EnablerResolution.unrecognized(null);
        }
        for (Map.Entry<String, EnablerKind> row : rows.entrySet()) {
            if (typeId.startsWith(row.getKey())) {
                return EnablerResolution.resolved(typeId, row.getValue());
            }
        }
        return EnablerResolution.unrecognized(typeId);
    }

    /**
     * True if the id is in one of the gene namespaces.
     */
    public boolean isGeneId(String typeId) {
        return resolve(typeId).getKind().filter(k -> k == EnablerKind.GENE).isPresent();
    }

    public Map<String, EnablerKind> getRows() {
        return rows;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final List<String> genePrefixes = new ArrayList<>(DEFAULT_GENE_PREFIXES);

        public Builder genePrefix(String prefix) {
            Objects.requireNonNull(prefix, "prefix is required");
            if (prefix.isBlank()) {
                throw new IllegalArgumentException("prefix must not be blank");
            }
            if (!genePrefixes.contains(prefix)) {
                genePrefixes.add(prefix);
            }
            return this;
        }

        public Builder genePrefixes(Collection<String> prefixes) {
            prefixes.forEach(this::genePrefix);
            return this;
        }

        public EnablerPrefixTable build() {
            Map<String, EnablerKind> rows = new LinkedHashMap<>();
            for (String prefix : genePrefixes) {
                rows.put(prefix, EnablerKind.GENE);
            }
            rows.put(OntologyIds.CHEBI_PREFIX, EnablerKind.CHEMICAL);
            rows.put("GO:", EnablerKind.COMPLEX);
            rows.put("ComplexPortal:", EnablerKind.COMPLEX);
            rows.put("PR:", EnablerKind.MODIFIED_PROTEIN);
            return new EnablerPrefixTable(rows);
        }
    }
}
