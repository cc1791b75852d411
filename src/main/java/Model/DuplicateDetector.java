package Model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Decides whether an incoming image is a near-duplicate of one seen earlier in the same
 * run or recorded by a previous run.
 *
 * <p>A candidate must first pass the hash gate and then survive region confirmation. The
 * first confirmed candidate wins: session entries are scanned in admission order before
 * stored ones. The detector never writes to the session index or the store.</p>
 */
public final class DuplicateDetector {

    private static final Logger log = LoggerFactory.getLogger(DuplicateDetector.class);

    private final HashCalculator calculator;
    private final HashComparator comparator;
    private final RegionAnalyzer regionAnalyzer;
    private final int minDifferences;

    public DuplicateDetector(DetectionConfig config) {
        this(config, new HashCalculator(config), new HashComparator(config), new RegionAnalyzer(config));
    }

    public DuplicateDetector(DetectionConfig config, HashCalculator calculator,
                             HashComparator comparator, RegionAnalyzer regionAnalyzer) {
        this.calculator = calculator;
        this.comparator = comparator;
        this.regionAnalyzer = regionAnalyzer;
        this.minDifferences = config.minDifferences();
    }

    public HashCalculator calculator() {
        return calculator;
    }

    public DuplicateCheck check(Path image, SessionIndex session, FingerprintStore store) {
        Optional<Fingerprint> fp = calculator.tryCompute(image);
        if (fp.isEmpty()) return DuplicateCheck.unique(null);
        return check(image, fp.get(), session, store);
    }

    /**
     * Same as {@link #check(Path, SessionIndex, FingerprintStore)} for a fingerprint computed
     * ahead of time.
     */
    public DuplicateCheck check(Path image, Fingerprint fingerprint, SessionIndex session, FingerprintStore store) {
        Confirmation confirmation = new Confirmation(image);

        for (SessionIndex.Entry e : session.entries()) {
            if (isSameFile(image, e.path())) continue;
            if (confirmation.isDuplicate(fingerprint, e.path(), e.fingerprint())) {
                log.info("{} is a duplicate of {} (this run)", image.getFileName(), e.path().getFileName());
                return DuplicateCheck.duplicateOf(e.path(), fingerprint);
            }
        }

        for (StoredFingerprint s : storedCandidates(store, fingerprint)) {
            Path candidate = s.path();
            if (isSameFile(image, candidate) || session.contains(candidate)) continue;
            if (!Files.isRegularFile(candidate)) {
                log.info("Skipping stored candidate {}: file no longer exists", candidate);
                continue;
            }
            if (confirmation.isDuplicate(fingerprint, candidate, s.fingerprint())) {
                log.info("{} is a duplicate of {} (earlier run)", image.getFileName(), candidate.getFileName());
                return DuplicateCheck.duplicateOf(candidate, fingerprint);
            }
        }

        return DuplicateCheck.unique(fingerprint);
    }

    private static List<StoredFingerprint> storedCandidates(FingerprintStore store, Fingerprint probe) {
        try {
            return store.lookup(probe);
        } catch (FingerprintStoreException e) {
            log.error("Fingerprint store lookup failed, skipping earlier runs: {}", e.getMessage(), e);
            return List.of();
        }
    }

    private static boolean isSameFile(Path a, Path b) {
        return a.toAbsolutePath().normalize().equals(b.toAbsolutePath().normalize());
    }

    /** Two-stage test of one incoming image; its pixels are decoded at most once. */
    private final class Confirmation {

        private final Path image;
        private BufferedImage pixels;

        Confirmation(Path image) {
            this.image = image;
        }

        boolean isDuplicate(Fingerprint fingerprint, Path candidate, Fingerprint candidateFingerprint) {
            DistanceResult distance = comparator.compare(fingerprint, candidateFingerprint);
            log.debug("{} vs {}: weighted hash distance {}", image.getFileName(),
                    candidate.getFileName(), distance.weightedDistance());
            if (!distance.similar()) return false;

            BufferedImage candidatePixels;
            try {
                candidatePixels = Images.read(candidate);
                if (pixels == null) pixels = Images.read(image);
            } catch (IOException | RuntimeException e) {
                log.warn("Cannot confirm {} against {}: {}", image.getFileName(), candidate, e.getMessage());
                return false;
            }

            List<RegionDifference> regions = regionAnalyzer.analyze(pixels, candidatePixels);
            log.debug("{} vs {}: {} regions over threshold", image.getFileName(),
                    candidate.getFileName(), regions.size());
            return regions.size() <= minDifferences;
        }
    }
}
