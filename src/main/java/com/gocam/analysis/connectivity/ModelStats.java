package com.gocam.analysis.connectivity;

/**
 * Aggregate counts for one graph.
 *
 * @param modelId                  graph id
 * @param title                    graph title
 * @param taxon                    graph taxon
 * @param totalGenes               distinct gene ids enabling an activity
 * @param totalComplexes           distinct complex ids enabling an activity
 * @param maxConnectedActivities   highest number of connected activities enabled by one gene
 * @param totalConnectedActivities activity nodes linked to at least one other activity
 * @param numberOfHoles            activity nodes missing an expected annotation
 */
public record ModelStats(
        String modelId,
        String title,
        String taxon,
        int totalGenes,
        int totalComplexes,
        int maxConnectedActivities,
        int totalConnectedActivities,
        long numberOfHoles
) {
    @Override
    public String toString() {
        return "ModelStats{model=" + modelId +
                ", genes=" + totalGenes +
                ", complexes=" + totalComplexes +
                ", maxConnected=" + maxConnectedActivities +
                ", totalConnected=" + totalConnectedActivities +
                ", holes=" + numberOfHoles + '}';
    }
}
