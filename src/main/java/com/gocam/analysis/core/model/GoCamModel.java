package com.gocam.analysis.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A parsed GO-CAM model: metadata plus its ordered individuals and facts.
 * Produced by an external parser and never modified afterwards.
 */
public final class GoCamModel {

    private final String id;
    private final String title;
    private final String taxon;
    private final List<Individual> individuals;
    private final List<Fact> facts;
    private final Map<String, Individual> individualsById;

    private GoCamModel(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.title = builder.title != null ? builder.title : "";
        this.taxon = builder.taxon != null ? builder.taxon : "";
        this.individuals = List.copyOf(builder.individuals);
        this.facts = List.copyOf(builder.facts);
        Map<String, Individual> index = new LinkedHashMap<>();
        for (Individual individual : individuals) {
            index.putIfAbsent(individual.id(), individual);
        }
        this.individualsById = Collections.unmodifiableMap(index);
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

    public List<Individual> getIndividuals() {
        return individuals;
    }

    public List<Fact> getFacts() {
        return facts;
    }

    public Optional<Individual> findIndividual(String individualId) {
        return Optional.ofNullable(individualsById.get(individualId));
    }

    public Optional<Individual> factSubject(Fact fact) {
        return findIndividual(fact.subject());
    }

    public Optional<Individual> factObject(Fact fact) {
        return findIndividual(fact.object());
    }

    public ModelRef toRef() {
        return new ModelRef(id, title, taxon);
    }

    @Override
    public String toString() {
        return "GoCamModel{" +
                "id='" + id + '\'' +
                ", title='" + title + '\'' +
                ", individuals=" + individuals.size() +
                ", facts=" + facts.size() +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private String title;
        private String taxon;
        private final List<Individual> individuals = new ArrayList<>();
        private final List<Fact> facts = new ArrayList<>();

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

        public Builder individual(Individual individual) {
            this.individuals.add(individual);
            return this;
        }

        public Builder individuals(List<Individual> individuals) {
            this.individuals.addAll(individuals);
            return this;
        }

        public Builder fact(Fact fact) {
            this.facts.add(fact);
            return this;
        }

        public Builder facts(List<Fact> facts) {
            this.facts.addAll(facts);
            return this;
        }

        public GoCamModel build() {
            return new GoCamModel(this);
        }
    }
}
