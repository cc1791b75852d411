package Model;

import dev.brachtendorf.jimagehash.hash.Hash;

/**
 * Fuses the Hamming distances of two fingerprints into one weighted distance.
 */
public final class HashComparator {

    private final DetectionConfig.HashWeights weights;
    private final double threshold;

    public HashComparator(DetectionConfig config) {
        this.weights = config.hashWeights();
        this.threshold = config.similarityThreshold();
    }

    /**
     * @throws IllegalArgumentException if the fingerprints were computed under different
     *                                  hash sizes or algorithm versions
     */
    public DistanceResult compare(Fingerprint a, Fingerprint b) {
        if (!a.isComparableTo(b)) {
            throw new IllegalArgumentException("Fingerprints computed under different settings: hashSize "
                    + a.hashSize() + "/v" + a.algorithmVersion() + " vs "
                    + b.hashSize() + "/v" + b.algorithmVersion());
        }

        double distance = weights.perceptual() * hamming(a.perceptual(), b.perceptual())
                + weights.average() * hamming(a.average(), b.average())
                + weights.gradient() * hamming(a.gradient(), b.gradient());

        return new DistanceResult(distance <= threshold, distance);
    }

    static int hamming(Hash a, Hash b) {
        if (a.getBitResolution() != b.getBitResolution()) {
            throw new IllegalArgumentException("Hash lengths differ: "
                    + a.getBitResolution() + " vs " + b.getBitResolution());
        }
        return a.getHashValue().xor(b.getHashValue()).bitCount();
    }
}
