package Model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Tunable parameters of the duplicate detector.
 *
 * @param hashSize            side length of the perceptual hash grid
 * @param similarityThreshold max weighted hash distance still considered "possibly identical"
 * @param regionThreshold     per-cell combined difference above which a cell is flagged
 * @param gridSize            cells per side for region analysis
 * @param minDifferences      max number of flagged cells still tolerated as the same image
 * @param histogramBins       luminance histogram bins per cell
 * @param hashWeights         fusion weights of the three hash distances
 * @param regionWeights       fusion weights of the three per-cell scores
 */
public record DetectionConfig(
        @JsonProperty("hash_size") int hashSize,
        @JsonProperty("similarity_threshold") double similarityThreshold,
        @JsonProperty("region_threshold") double regionThreshold,
        @JsonProperty("grid_size") int gridSize,
        @JsonProperty("min_differences") int minDifferences,
        @JsonProperty("histogram_bins") int histogramBins,
        @JsonProperty("hash_weights") HashWeights hashWeights,
        @JsonProperty("region_weights") RegionWeights regionWeights) {

    public record HashWeights(
            @JsonProperty("perceptual") double perceptual,
            @JsonProperty("average") double average,
            @JsonProperty("gradient") double gradient) {

        public static final HashWeights DEFAULT = new HashWeights(0.5, 0.3, 0.2);

        public HashWeights {
            requireNonNegative("hash_weights.perceptual", perceptual);
            requireNonNegative("hash_weights.average", average);
            requireNonNegative("hash_weights.gradient", gradient);
        }
    }

    public record RegionWeights(
            @JsonProperty("pixel") double pixel,
            @JsonProperty("histogram") double histogram,
            @JsonProperty("edge") double edge) {

        public static final RegionWeights DEFAULT = new RegionWeights(0.4, 0.3, 0.3);

        public RegionWeights {
            requireNonNegative("region_weights.pixel", pixel);
            requireNonNegative("region_weights.histogram", histogram);
            requireNonNegative("region_weights.edge", edge);
        }
    }

    public DetectionConfig {
        if (hashSize < 2) {
            throw new IllegalArgumentException("hash_size must be at least 2, got " + hashSize);
        }
        if (gridSize < 1) {
            throw new IllegalArgumentException("grid_size must be at least 1, got " + gridSize);
        }
        if (histogramBins < 1 || histogramBins > 256) {
            throw new IllegalArgumentException("histogram_bins must be within 1..256, got " + histogramBins);
        }
        if (minDifferences < 0) {
            throw new IllegalArgumentException("min_differences must not be negative, got " + minDifferences);
        }
        requireNonNegative("similarity_threshold", similarityThreshold);
        requireNonNegative("region_threshold", regionThreshold);
        if (hashWeights == null) hashWeights = HashWeights.DEFAULT;
        if (regionWeights == null) regionWeights = RegionWeights.DEFAULT;
    }

    public DetectionConfig(int hashSize, double similarityThreshold, double regionThreshold,
                           int gridSize, int minDifferences) {
        this(hashSize, similarityThreshold, regionThreshold, gridSize, minDifferences,
                32, HashWeights.DEFAULT, RegionWeights.DEFAULT);
    }

    public static DetectionConfig defaults() {
        return new DetectionConfig(16, 10.0, 30.0, 4, 1);
    }

    private static void requireNonNegative(String name, double value) {
        if (!(value >= 0)) {
            throw new IllegalArgumentException(name + " must be a non-negative number, got " + value);
        }
    }
}
