package com.gocam.analysis.graph;

import com.gocam.analysis.classify.Classifier;
import com.gocam.analysis.classify.EnablerPrefixTable;
import com.gocam.analysis.classify.EnablerResolution;
import com.gocam.analysis.classify.OntologyIds;
import com.gocam.analysis.core.model.BuildWarning;
import com.gocam.analysis.core.model.Edge;
import com.gocam.analysis.core.model.Enabler;
import com.gocam.analysis.core.model.EnablerKind;
import com.gocam.analysis.core.model.Fact;
import com.gocam.analysis.core.model.GoCamGraph;
import com.gocam.analysis.core.model.GoCamModel;
import com.gocam.analysis.core.model.Individual;
import com.gocam.analysis.core.model.IndividualType;
import com.gocam.analysis.core.model.Node;
import com.gocam.analysis.core.model.NodeKey;
import com.gocam.analysis.core.model.NodeKind;
import com.gocam.analysis.core.model.NodeType;
import com.gocam.analysis.logging.LogContext;
import com.gocam.analysis.metrics.MetricsService;
import com.gocam.analysis.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Turns a parsed model into a {@link GoCamGraph}.
 *
 * Build process:
 * 1. Qualifying individual selection (activities, non-placeholder chemicals and,
 *    optionally, gene-product participants)
 * 2. Evidence pass over the facts in order, collecting node attributes
 * 3. One immutable node per qualifying individual
 * 4. Edge pass: facts between two nodes become edges, all other facts are dropped
 */
public class GraphBuilder {
    private static final Logger log = LoggerFactory.getLogger(GraphBuilder.class);

    private final Classifier classifier;
    private final EnablerPrefixTable prefixTable;
    private final ConflictPolicy conflictPolicy;
    private final boolean includeParticipants;
    private final MetricsService metricsService;

    /**
     * Creates a builder with the default prefix table and first-fact-wins policy.
     */
    public GraphBuilder() {
        this(new Classifier(), EnablerPrefixTable.defaults(), ConflictPolicy.FIRST_WINS, false,
                new NoOpMetricsService());
    }

    public GraphBuilder(Classifier classifier,
                        EnablerPrefixTable prefixTable,
                        ConflictPolicy conflictPolicy,
                        boolean includeParticipants,
                        MetricsService metricsService) {
        this.classifier = classifier;
        this.prefixTable = prefixTable;
        this.conflictPolicy = conflictPolicy;
        this.includeParticipants = includeParticipants;
        this.metricsService = metricsService;
    }

    /**
     * Builds the graph of one model. Never throws for malformed-but-parsed data:
     * facts pointing at missing individuals are dropped and unrecognized enablers
     * are reported as {@link BuildWarning}s.
     */
    public GoCamGraph build(GoCamModel model) {
        try (LogContext logCtx = LogContext.forModel(model.getId())) {
            long start = System.nanoTime();

            Map<String, Individual> qualifying = selectQualifying(model);
            Map<String, NodeKind> participants = includeParticipants
                    ? selectParticipants(model, qualifying)
                    : Map.of();

            Map<String, NodeEvidence> evidence = new HashMap<>();
            for (Individual individual : model.getIndividuals()) {
                if (qualifying.containsKey(individual.id()) || participants.containsKey(individual.id())) {
                    evidence.putIfAbsent(individual.id(), new NodeEvidence(conflictPolicy));
                }
            }

            List<BuildWarning> warnings = new ArrayList<>();
            collectEvidence(model, evidence, warnings);

            GoCamGraph.Builder graph = GoCamGraph.builder()
                    .id(model.getId())
                    .title(model.getTitle())
                    .taxon(model.getTaxon())
                    .model(model.toRef())
                    .warnings(warnings);

            for (Individual individual : model.getIndividuals()) {
                NodeEvidence nodeEvidence = evidence.get(individual.id());
                if (nodeEvidence == null) {
                    continue;
                }
                NodeType type = decideType(individual, nodeEvidence, participants.get(individual.id()));
                graph.addNode(toNode(model.getId(), individual, type, nodeEvidence));
            }

            int dropped = 0;
            for (Fact fact : model.getFacts()) {
                NodeKey source = new NodeKey(model.getId(), fact.subject());
                NodeKey target = new NodeKey(model.getId(), fact.object());
                if (graph.hasNode(source) && graph.hasNode(target)) {
                    graph.addEdge(new Edge(fact.id(), fact.propertyId(), fact.propertyLabel(), source, target));
                } else {
                    dropped++;
                }
            }

            GoCamGraph result = graph.build();
            Duration duration = Duration.ofNanos(System.nanoTime() - start);
            metricsService.recordGraphBuild(duration, result.nodeCount(), result.edgeCount());
            log.info("graph.built modelId={} nodes={} edges={} droppedFacts={} warnings={} durationMs={}",
                    model.getId(), result.nodeCount(), result.edgeCount(), dropped,
                    warnings.size(), duration.toMillis());
            return result;
        }
    }

    private Map<String, Individual> selectQualifying(GoCamModel model) {
        Map<String, Individual> qualifying = new LinkedHashMap<>();
        for (Individual individual : model.getIndividuals()) {
            if (classifier.qualifiesAsNode(individual)) {
                qualifying.putIfAbsent(individual.id(), individual);
            } else if (individual.types().isEmpty()) {
                log.debug("graph.individual.skipped individualId={} reason=no-types", individual.id());
            }
        }
        return qualifying;
    }

    /**
     * Gene products that are inputs or outputs of activities. They are never
     * enablers-only: an enabled-by object alone does not make a participant.
     */
    private Map<String, NodeKind> selectParticipants(GoCamModel model, Map<String, Individual> qualifying) {
        Map<String, NodeKind> participants = new HashMap<>();
        for (Fact fact : model.getFacts()) {
            String label = fact.propertyLabel();
            if (!Relations.HAS_INPUT.equals(label) && !Relations.HAS_OUTPUT.equals(label)) {
                continue;
            }
            Individual subject = qualifying.get(fact.subject());
            if (subject == null || !classifier.isActivity(subject) || qualifying.containsKey(fact.object())) {
                continue;
            }
            model.factObject(fact)
                    .flatMap(this::participantKind)
                    .ifPresent(kind -> participants.putIfAbsent(fact.object(), kind));
        }
        return participants;
    }

    private Optional<NodeKind> participantKind(Individual individual) {
        Optional<IndividualType> primary = individual.primaryType();
        if (primary.isEmpty() || primary.get().id() == null) {
            return Optional.empty();
        }
        IndividualType type = primary.get();
        if (prefixTable.isGeneId(type.id())) {
            boolean mrna = type.id().endsWith("mRNA")
                    || (type.label() != null && type.label().endsWith("mRNA"));
            return Optional.of(mrna ? NodeKind.MRNA : NodeKind.GENE);
        }
        if (type.hasIdPrefix("PR:")) {
            return Optional.of(NodeKind.MODIFIED_PROTEIN);
        }
        return Optional.empty();
    }

    private void collectEvidence(GoCamModel model, Map<String, NodeEvidence> evidence,
                                 List<BuildWarning> warnings) {
        Map<String, List<String>> complexParts = collectComplexParts(model);

        for (Fact fact : model.getFacts()) {
            NodeEvidence subject = evidence.get(fact.subject());
            if (subject == null) {
                continue;
            }

            Optional<Individual> object = model.factObject(fact);
            if (object.isEmpty()) {
                log.debug("graph.fact.dangling factId={} object={}", fact.id(), fact.object());
                continue;
            }
            Optional<IndividualType> objectType = object.get().primaryType();
            if (objectType.isEmpty()) {
                log.debug("graph.fact.untyped-object factId={} object={}", fact.id(), fact.object());
                continue;
            }
            IndividualType type = objectType.get();

            switch (fact.propertyLabel()) {
                case Relations.ENABLED_BY -> {
                    EnablerResolution resolution = prefixTable.resolve(type.id());
                    if (resolution.isRecognized()) {
                        EnablerKind kind = resolution.kind();
                        List<String> parts = kind == EnablerKind.COMPLEX
                                ? complexParts.getOrDefault(fact.object(), List.of())
                                : List.of();
                        subject.offerEnabler(new Enabler(kind, type, parts));
                    } else {
                        String message = "can't handle enabled by object: " + fact.object()
                                + " (type id " + type.id() + ")";
                        warnings.add(new BuildWarning(fact.subject(), fact.id(), message));
                        metricsService.incrementUnrecognizedEnabler();
                        log.warn("graph.enabler.unrecognized individualId={} object={} typeId={}",
                                fact.subject(), fact.object(), type.id());
                    }
                }
                case Relations.HAS_INPUT -> subject.addInput(type);
                case Relations.HAS_OUTPUT -> subject.addOutput(type);
                case Relations.LOCATED_IN -> subject.offerLocatedIn(type);
                case Relations.OCCURS_IN -> subject.addOccursIn(type);
                case Relations.PART_OF -> subject.offerPartOf(type);
                case Relations.HAPPENS_DURING -> subject.offerHappensDuring(type);
                default -> {
                    // structural only
                }
            }
        }
    }

    private Map<String, List<String>> collectComplexParts(GoCamModel model) {
        Map<String, List<String>> parts = new HashMap<>();
        for (Fact fact : model.getFacts()) {
            if (!Relations.HAS_PART.equals(fact.propertyLabel())) {
                continue;
            }
            model.factObject(fact)
                    .map(Individual::primaryTypeId)
                    .ifPresent(partId -> parts.computeIfAbsent(fact.subject(), k -> new ArrayList<>()).add(partId));
        }
        return parts;
    }

    private NodeType decideType(Individual individual, NodeEvidence evidence, NodeKind participantKind) {
        if (participantKind != null) {
            return NodeType.of(participantKind);
        }
        if (evidence.enabler() != null) {
            return NodeType.activity(evidence.enabler());
        }
        if (classifier.isActivity(individual)) {
            return NodeType.unknown();
        }
        if (OntologyIds.GENERIC_MRNA.equals(individual.primaryTypeId())) {
            return NodeType.unknownMrna();
        }
        return NodeType.chemical();
    }

    private Node toNode(String modelId, Individual individual, NodeType type, NodeEvidence evidence) {
        Optional<IndividualType> primary = individual.primaryType();
        return Node.builder()
                .key(new NodeKey(modelId, individual.id()))
                .id(primary.map(IndividualType::id).orElse(null))
                .label(primary.map(IndividualType::label).orElse(null))
                .type(type)
                .partOfProcess(evidence.partOfProcess())
                .occursIn(evidence.occursIn())
                .locatedIn(evidence.locatedIn())
                .happensDuring(evidence.happensDuring())
                .inputs(evidence.inputs())
                .outputs(evidence.outputs())
                .build();
    }
}
