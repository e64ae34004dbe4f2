package com.gocam.analysis.classify;

import com.gocam.analysis.core.model.Individual;
import com.gocam.analysis.core.model.IndividualType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import static com.gocam.analysis.TestModels.*;
import static org.junit.jupiter.api.Assertions.*;

class ClassifierTest {

    private Classifier classifier;

    @BeforeEach
    void setUp() {
        classifier = new Classifier();
    }

    @Nested
    @DisplayName("Categories")
    class Categories {

        @Test
        @DisplayName("Molecular function root gives ACTIVITY")
        void testActivity() {
            assertEquals(Set.of(Category.ACTIVITY),
                    classifier.classify(activity("A1", "GO:0004672", "protein kinase activity")));
        }

        @Test
        @DisplayName("Biological process root gives PROCESS")
        void testProcess() {
            assertEquals(Set.of(Category.PROCESS), classifier.classify(process("P1", "GO:0007049", "cell cycle")));
        }

        @Test
        @DisplayName("Complexes are also components")
        void testComplex() {
            assertEquals(EnumSet.of(Category.COMPONENT, Category.COMPLEX),
                    classifier.classify(complex("X1", "GO:0005680", "anaphase-promoting complex")));
        }

        @Test
        @DisplayName("CHEBI typed chemical entities are chemicals")
        void testChemical() {
            assertEquals(Set.of(Category.CHEMICAL), classifier.classify(chemical("C1", "CHEBI:15422", "ATP")));
        }

        @Test
        @DisplayName("The generic protein is both a chemical and an unknown protein")
        void testUnknownProtein() {
            assertEquals(EnumSet.of(Category.CHEMICAL, Category.UNKNOWN_PROTEIN),
                    classifier.classify(chemical("U1", OntologyIds.GENERIC_PROTEIN, "protein")));
        }

        @Test
        @DisplayName("Gene products with the chemical root are not chemicals")
        void testGeneProduct() {
            assertEquals(Set.of(Category.OTHER), classifier.classify(gene("G1", "PomBase:SPAC1.01", "cdc2")));
        }

        @Test
        @DisplayName("Individuals without types are OTHER")
        void testUntyped() {
            assertEquals(Set.of(Category.OTHER), classifier.classify(untyped("U1")));
        }

        @Test
        @DisplayName("Categories are never empty")
        void testNeverEmpty() {
            Individual rootless = new Individual("R1", List.of(IndividualType.of("ECO:0000314", "direct assay")), List.of());

            assertEquals(Set.of(Category.OTHER), classifier.classify(rootless));
        }

        @Test
        @DisplayName("Returned set is unmodifiable")
        void testUnmodifiable() {
            Set<Category> categories = classifier.classify(chemical("C1", "CHEBI:15422", "ATP"));

            assertThrows(UnsupportedOperationException.class, () -> categories.add(Category.OTHER));
        }
    }

    @Test
    @DisplayName("Only activities and real chemicals qualify as nodes")
    void testQualifiesAsNode() {
        assertTrue(classifier.qualifiesAsNode(activity("A1", "GO:0003824", "catalytic activity")));
        assertTrue(classifier.qualifiesAsNode(chemical("C1", "CHEBI:15422", "ATP")));
        assertFalse(classifier.qualifiesAsNode(chemical("U1", OntologyIds.GENERIC_PROTEIN, "protein")));
        assertFalse(classifier.qualifiesAsNode(gene("G1", "PomBase:SPAC1.01", "cdc2")));
        assertFalse(classifier.qualifiesAsNode(process("P1", "GO:0008150", "biological_process")));
        assertFalse(classifier.qualifiesAsNode(untyped("U2")));
    }
}
