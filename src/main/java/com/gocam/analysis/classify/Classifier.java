package com.gocam.analysis.classify;

import com.gocam.analysis.core.model.Individual;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Labels individuals with semantic categories from their pre-computed root types
 * and the namespace of their primary type id.
 */
public class Classifier {

    /**
     * Classifies an individual. Individuals without types, or matching no rule,
     * classify as {@link Category#OTHER}.
     */
    public Set<Category> classify(Individual individual) {
        if (individual.types().isEmpty()) {
            return Collections.unmodifiableSet(EnumSet.of(Category.OTHER));
        }

        EnumSet<Category> categories = EnumSet.noneOf(Category.class);
        if (isActivity(individual)) {
            categories.add(Category.ACTIVITY);
        }
        if (individual.hasRootType(OntologyIds.CELLULAR_COMPONENT)) {
            categories.add(Category.COMPONENT);
        }
        if (individual.hasRootType(OntologyIds.BIOLOGICAL_PROCESS)) {
            categories.add(Category.PROCESS);
        }
        if (individual.hasRootType(OntologyIds.PROTEIN_CONTAINING_COMPLEX)) {
            categories.add(Category.COMPLEX);
        }
        if (isChemical(individual)) {
            categories.add(Category.CHEMICAL);
        }
        if (isUnknownProtein(individual)) {
            categories.add(Category.UNKNOWN_PROTEIN);
        }
        if (categories.isEmpty()) {
            categories.add(Category.OTHER);
        }
        return Collections.unmodifiableSet(categories);
    }

    public boolean isActivity(Individual individual) {
        return individual.hasRootType(OntologyIds.MOLECULAR_FUNCTION);
    }

    /**
     * A chemical has the chemical entity root and a CHEBI-namespaced primary type.
     */
    public boolean isChemical(Individual individual) {
        if (!individual.hasRootType(OntologyIds.CHEMICAL_ENTITY)) {
            return false;
        }
        String typeId = individual.primaryTypeId();
        return typeId != null && typeId.startsWith(OntologyIds.CHEBI_PREFIX);
    }

    public boolean isUnknownProtein(Individual individual) {
        return OntologyIds.GENERIC_PROTEIN.equals(individual.primaryTypeId());
    }

    /**
     * True for individuals that become graph nodes on their own: activities, and
     * chemicals that are not placeholder proteins.
     */
    public boolean qualifiesAsNode(Individual individual) {
        if (individual.types().isEmpty()) {
            return false;
        }
        return isActivity(individual) || (isChemical(individual) && !isUnknownProtein(individual));
    }
}
