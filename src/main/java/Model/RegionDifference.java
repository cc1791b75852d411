package Model;

/**
 * A grid cell whose combined difference score exceeded the region threshold.
 */
public record RegionDifference(int row, int col, double combinedScore) {}
