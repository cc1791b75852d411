package Model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Computes the perceptual, average and gradient hashes of an image.
 */
public final class HashCalculator {

    private static final Logger log = LoggerFactory.getLogger(HashCalculator.class);

    private final int hashSize;

    public HashCalculator(DetectionConfig config) {
        this.hashSize = config.hashSize();
    }

    public int hashSize() {
        return hashSize;
    }

    public Fingerprint compute(Path image) throws FingerprintException {
        BufferedImage img;
        try {
            img = Images.read(image);
        } catch (IOException | RuntimeException e) {
            throw new FingerprintException(image, "Cannot decode image", e);
        }
        return compute(img);
    }

    /**
     * Fail-open variant: a failure is logged and reported as an empty result, which callers
     * treat as "cannot judge duplication".
     */
    public Optional<Fingerprint> tryCompute(Path image) {
        try {
            return Optional.of(compute(image));
        } catch (FingerprintException e) {
            log.error("Fingerprinting failed, treating image as unique: {}", e.getMessage(), e);
            return Optional.empty();
        }
    }

    public Fingerprint compute(BufferedImage image) {
        BufferedImage gray = Images.toLuminance(image);

        int[][] wide = levels(Images.resize(gray, hashSize + 1, hashSize));
        boolean[] perceptual = new boolean[hashSize * hashSize];
        for (int y = 0; y < hashSize; y++) {
            for (int x = 0; x < hashSize; x++) {
                perceptual[y * hashSize + x] = wide[y][x] > wide[y][x + 1];
            }
        }

        int side = Fingerprint.SMALL_GRID;
        int[][] small = levels(Images.resize(gray, side, side));

        double sum = 0;
        for (int[] row : small) {
            for (int v : row) sum += v;
        }
        double mean = sum / (side * side);

        double[][] asDouble = new double[side][side];
        boolean[] average = new boolean[side * side];
        for (int y = 0; y < side; y++) {
            for (int x = 0; x < side; x++) {
                average[y * side + x] = small[y][x] > mean;
                asDouble[y][x] = small[y][x];
            }
        }

        double[][] grad = Images.gradient(asDouble, true);
        boolean[] gradient = new boolean[side * side];
        for (int y = 0; y < side; y++) {
            for (int x = 0; x < side; x++) {
                gradient[y * side + x] = grad[y][x] > 0;
            }
        }

        return Fingerprint.of(hashSize, perceptual, average, gradient);
    }

    // gray images carry the level in every channel
    private static int[][] levels(BufferedImage gray) {
        int[][] out = new int[gray.getHeight()][gray.getWidth()];
        for (int y = 0; y < out.length; y++) {
            for (int x = 0; x < out[y].length; x++) {
                out[y][x] = gray.getRGB(x, y) & 0xFF;
            }
        }
        return out;
    }
}
