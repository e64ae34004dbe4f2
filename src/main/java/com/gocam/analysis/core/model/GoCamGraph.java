package com.gocam.analysis.core.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Typed directed multigraph built from one model, or from a merge of several.
 * Nodes keep insertion order and are unique by {@link NodeKey}; every edge
 * endpoint is guaranteed to be a node of the graph. Instances are read-only.
 */
public final class GoCamGraph {

    private final String id;
    private final String title;
    private final String taxon;
    private final boolean merged;
    private final Map<NodeKey, Node> nodes;
    private final List<Edge> edges;
    private final List<ModelRef> models;
    private final List<BuildWarning> warnings;

    private GoCamGraph(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.title = builder.title != null ? builder.title : "";
        this.taxon = builder.taxon != null ? builder.taxon : "";
        this.merged = builder.merged;
        this.nodes = Collections.unmodifiableMap(new LinkedHashMap<>(builder.nodes));
        for (Edge edge : builder.edges) {
            if (!nodes.containsKey(edge.source()) || !nodes.containsKey(edge.target())) {
                throw new IllegalArgumentException("Edge " + edge.factId() + " references a node outside the graph");
            }
        }
        this.edges = List.copyOf(builder.edges);
        this.models = List.copyOf(builder.models);
        this.warnings = List.copyOf(builder.warnings);
    }

    public String getId() {
        return id;
    }

    public String getTitle() {
        return title;
    }

    public String getTaxon() {
        return taxon;
    }

    /**
     * True if this graph is the union of several model graphs.
     */
    public boolean isMerged() {
        return merged;
    }

    public List<Node> getNodes() {
        return List.copyOf(nodes.values());
    }

    public Collection<Node> nodes() {
        return nodes.values();
    }

    public Optional<Node> getNode(NodeKey key) {
        return Optional.ofNullable(nodes.get(key));
    }

    public boolean containsNode(NodeKey key) {
        return nodes.containsKey(key);
    }

    public int nodeCount() {
        return nodes.size();
    }

    public List<Edge> getEdges() {
        return edges;
    }

    public int edgeCount() {
        return edges.size();
    }

    public List<ModelRef> getModels() {
        return models;
    }

    /**
     * Returns the title of a contributing model, or an empty string if unknown.
     */
    public String modelTitle(String modelId) {
        for (ModelRef model : models) {
            if (model.id().equals(modelId)) {
                return model.title();
            }
        }
        return "";
    }

    public List<BuildWarning> getWarnings() {
        return warnings;
    }

    @Override
    public String toString() {
        return "GoCamGraph{" +
                "id='" + id + '\'' +
                ", nodes=" + nodes.size() +
                ", edges=" + edges.size() +
                ", models=" + models.size() +
                ", merged=" + merged +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private String title;
        private String taxon;
        private boolean merged;
        private final Map<NodeKey, Node> nodes = new LinkedHashMap<>();
        private final List<Edge> edges = new ArrayList<>();
        private final List<ModelRef> models = new ArrayList<>();
        private final List<BuildWarning> warnings = new ArrayList<>();

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder taxon(String taxon) {
            this.taxon = taxon;
            return this;
        }

        public Builder merged(boolean merged) {
            this.merged = merged;
            return this;
        }

        /**
         * Adds a node unless one with the same key is already present.
         *
         * @return true if the node was added
         */
        public boolean addNode(Node node) {
            return nodes.putIfAbsent(node.getKey(), node) == null;
        }

        public boolean hasNode(NodeKey key) {
            return nodes.containsKey(key);
        }

        public Builder addEdge(Edge edge) {
            this.edges.add(edge);
            return this;
        }

        public Builder model(ModelRef model) {
            this.models.add(model);
            return this;
        }

        public Builder warning(BuildWarning warning) {
            this.warnings.add(warning);
            return this;
        }

        public Builder warnings(List<BuildWarning> warnings) {
            this.warnings.addAll(warnings);
            return this;
        }

        public GoCamGraph build() {
            return new GoCamGraph(this);
        }
    }
}
