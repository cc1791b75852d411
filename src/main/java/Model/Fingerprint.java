package Model;

import dev.brachtendorf.jimagehash.hash.Hash;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Multi-algorithm fingerprint of one image.
 *
 * <p>The three components are always present together. Each is tagged with the
 * {@code hashSize} and algorithm version it was computed under; only fingerprints
 * carrying the same tag can be compared.</p>
 */
public final class Fingerprint {

    public static final int ALGORITHM_VERSION = 1;
    public static final int SMALL_GRID = 8;

    private static final int PERCEPTUAL_ID = 1;
    private static final int AVERAGE_ID = 2;
    private static final int GRADIENT_ID = 3;

    private final int hashSize;
    private final int algorithmVersion;
    private final Hash perceptual;
    private final Hash average;
    private final Hash gradient;

    private Fingerprint(int hashSize, int algorithmVersion, Hash perceptual, Hash average, Hash gradient) {
        this.hashSize = hashSize;
        this.algorithmVersion = algorithmVersion;
        this.perceptual = perceptual;
        this.average = average;
        this.gradient = gradient;
    }

    public static Fingerprint of(int hashSize, boolean[] perceptualBits, boolean[] averageBits, boolean[] gradientBits) {
        return of(hashSize, ALGORITHM_VERSION, perceptualBits, averageBits, gradientBits);
    }

    static Fingerprint of(int hashSize, int version,
                          boolean[] perceptualBits, boolean[] averageBits, boolean[] gradientBits) {
        checkLength("perceptual", perceptualBits.length, hashSize * hashSize);
        checkLength("average", averageBits.length, SMALL_GRID * SMALL_GRID);
        checkLength("gradient", gradientBits.length, SMALL_GRID * SMALL_GRID);

        return new Fingerprint(hashSize, version,
                toHash(perceptualBits, algorithmId(PERCEPTUAL_ID, hashSize, version)),
                toHash(averageBits, algorithmId(AVERAGE_ID, hashSize, version)),
                toHash(gradientBits, algorithmId(GRADIENT_ID, hashSize, version)));
    }

    /**
     * Rebuilds a fingerprint from its {@code '0'/'1'} renderings, as persisted by a store.
     */
    public static Fingerprint fromBitStrings(int hashSize, int version,
                                             String perceptualBits, String averageBits, String gradientBits) {
        return of(hashSize, version, parse(perceptualBits), parse(averageBits), parse(gradientBits));
    }

    public int hashSize() { return hashSize; }

    public int algorithmVersion() { return algorithmVersion; }

    public Hash perceptual() { return perceptual; }

    public Hash average() { return average; }

    public Hash gradient() { return gradient; }

    public String perceptualBits() { return render(perceptual); }

    public String averageBits() { return render(average); }

    public String gradientBits() { return render(gradient); }

    public boolean isComparableTo(Fingerprint other) {
        return hashSize == other.hashSize && algorithmVersion == other.algorithmVersion;
    }

    private static int algorithmId(int component, int hashSize, int version) {
        return Objects.hash(component, hashSize, version);
    }

    // bit 0 of the string is the most significant bit of the value
    private static Hash toHash(boolean[] bits, int algorithmId) {
        BigInteger value = BigInteger.ZERO;
        for (boolean bit : bits) {
            value = value.shiftLeft(1);
            if (bit) value = value.setBit(0);
        }
        return new Hash(value, bits.length, algorithmId);
    }

    private static String render(Hash hash) {
        int len = hash.getBitResolution();
        String raw = hash.getHashValue().toString(2);
        if (raw.length() >= len) return raw;
        return "0".repeat(len - raw.length()) + raw;
    }

    private static boolean[] parse(String bits) {
        boolean[] out = new boolean[bits.length()];
        for (int i = 0; i < bits.length(); i++) {
            char c = bits.charAt(i);
            if (c != '0' && c != '1') {
                throw new IllegalArgumentException("Not a bit string: " + bits);
            }
            out[i] = c == '1';
        }
        return out;
    }

    private static void checkLength(String component, int actual, int expected) {
        if (actual != expected) {
            throw new IllegalArgumentException(
                    component + " hash must have " + expected + " bits but has " + actual);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Fingerprint)) return false;
        Fingerprint that = (Fingerprint) o;
        return hashSize == that.hashSize
                && algorithmVersion == that.algorithmVersion
                && perceptual.getHashValue().equals(that.perceptual.getHashValue())
                && average.getHashValue().equals(that.average.getHashValue())
                && gradient.getHashValue().equals(that.gradient.getHashValue());
    }

    @Override
    public int hashCode() {
        return Objects.hash(hashSize, algorithmVersion,
                perceptual.getHashValue(), average.getHashValue(), gradient.getHashValue());
    }

    @Override
    public String toString() {
        return "Fingerprint{hashSize=" + hashSize + ", v" + algorithmVersion
                + ", p=" + perceptual.getHashValue().toString(16)
                + ", a=" + average.getHashValue().toString(16)
                + ", g=" + gradient.getHashValue().toString(16) + '}';
    }
}
