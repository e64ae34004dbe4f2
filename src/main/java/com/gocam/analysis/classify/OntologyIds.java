package com.gocam.analysis.classify;

/**
 * Root and placeholder term ids used to categorize individuals.
 */
public final class OntologyIds {

    public static final String MOLECULAR_FUNCTION = "GO:0003674";
    public static final String CELLULAR_COMPONENT = "GO:0005575";
    public static final String BIOLOGICAL_PROCESS = "GO:0008150";
    public static final String PROTEIN_CONTAINING_COMPLEX = "GO:0032991";
    public static final String CHEMICAL_ENTITY = "CHEBI:24431";
    public static final String GENERIC_PROTEIN = "CHEBI:36080";
    public static final String GENERIC_MRNA = "CHEBI:33699";

    public static final String CHEBI_PREFIX = "CHEBI:";

    private OntologyIds() {
        // Constants
    }
}
