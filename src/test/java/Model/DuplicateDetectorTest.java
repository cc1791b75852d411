package Model;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.awt.Color;
import java.awt.image.BufferedImage;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class DuplicateDetectorTest {

    private static final DetectionConfig CONFIG = new DetectionConfig(16, 4, 30, 4, 1);

    @TempDir
    Path dir;

    private CountingRegionAnalyzer regionAnalyzer;
    private DuplicateDetector detector;
    private SessionIndex session;
    private InMemoryFingerprintStore store;

    @BeforeEach
    void setUp() {
        detector = detector(CONFIG);
        session = new SessionIndex();
        store = new InMemoryFingerprintStore();
    }

    private DuplicateDetector detector(DetectionConfig config) {
        regionAnalyzer = new CountingRegionAnalyzer(config);
        return new DuplicateDetector(config, new HashCalculator(config), new HashComparator(config), regionAnalyzer);
    }

    private void admit(Path image) throws FingerprintException {
        session.add(image, detector.calculator().compute(image));
    }

    @Test
    void should_ReportOriginal_When_IdenticalImageResubmittedInSameBatch() throws Exception {
        BufferedImage poster = TestImages.ramp(200, 160);
        Path original = TestImages.write(poster, dir, "a.png");
        Path repost = TestImages.write(poster, dir, "b.png");
        admit(original);

        DuplicateCheck check = detector.check(repost, session, store);

        assertThat(check.duplicate()).isTrue();
        assertThat(check.reference()).isEqualTo(original);
        assertThat(check.fingerprint()).isEqualTo(session.get(original).orElseThrow());
    }

    @Test
    void should_ReportOriginal_When_ImageOnlyDiffersByNoise() throws Exception {
        BufferedImage poster = TestImages.ramp(200, 160);
        Path original = TestImages.write(poster, dir, "a.png");
        Path noisy = TestImages.write(TestImages.withNoise(poster, 3, 42L), dir, "b.png");
        admit(original);

        DuplicateCheck check = detector.check(noisy, session, store);

        assertThat(check.duplicate()).isTrue();
        assertThat(check.reference()).isEqualTo(original);
    }

    @Test
    void should_ReportOriginal_When_ImageReencodedAsJpeg() throws Exception {
        BufferedImage poster = TestImages.ramp(200, 160);
        Path original = TestImages.write(poster, dir, "a.png");
        Path jpeg = TestImages.write(poster, dir, "b.jpg");
        admit(original);

        assertThat(detector.check(jpeg, session, store).match()).contains(original);
    }

    @Test
    void should_SkipRegionAnalysis_When_HashGateRejects() throws Exception {
        Path rising = TestImages.write(TestImages.ramp(200, 160), dir, "a.png");
        Path falling = TestImages.write(TestImages.mirroredRamp(200, 160), dir, "b.png");
        admit(rising);

        DuplicateCheck check = detector.check(falling, session, store);

        assertThat(check.duplicate()).isFalse();
        assertThat(check.reference()).isNull();
        assertThat(regionAnalyzer.calls).isZero();
    }

    @Test
    void should_NotBeDuplicate_When_SolidColoursDiffer() throws Exception {
        // flat images carry no luminance structure, so the pixel comparison has to tell them apart
        Path red = TestImages.write(TestImages.solid(Color.RED, 64, 64), dir, "red.png");
        Path blue = TestImages.write(TestImages.solid(Color.BLUE, 64, 64), dir, "blue.png");
        admit(red);

        DuplicateCheck check = detector.check(blue, session, store);

        assertThat(check.duplicate()).isFalse();
        assertThat(check.reference()).isNull();
    }

    @Test
    void should_NotBeDuplicate_When_HashGatePassesButTooManyRegionsDiffer() throws Exception {
        DetectionConfig lenientGate = new DetectionConfig(16, 1000, 30, 4, 1);
        detector = detector(lenientGate);
        BufferedImage poster = TestImages.ramp(160, 160);
        Path original = TestImages.write(poster, dir, "a.png");
        Path watermarked = TestImages.write(TestImages.withPatch(poster, 40, 40, 120, 120, Color.BLACK), dir, "b.png");
        admit(original);

        DuplicateCheck check = detector.check(watermarked, session, store);

        assertThat(check.duplicate()).isFalse();
        assertThat(regionAnalyzer.calls).isEqualTo(1);
    }

    @Test
    void should_KeepScanning_When_RegionConfirmationFails() throws Exception {
        DetectionConfig lenientGate = new DetectionConfig(16, 1000, 30, 4, 1);
        detector = detector(lenientGate);
        BufferedImage poster = TestImages.ramp(160, 160);
        Path watermarked = TestImages.write(TestImages.withPatch(poster, 40, 40, 120, 120, Color.BLACK), dir, "a.png");
        Path original = TestImages.write(poster, dir, "b.png");
        Path repost = TestImages.write(poster, dir, "c.png");
        admit(watermarked);
        admit(original);

        DuplicateCheck check = detector.check(repost, session, store);

        assertThat(check.reference()).isEqualTo(original);
        assertThat(regionAnalyzer.calls).isEqualTo(2);
    }

    @Test
    void should_StopAtFirstConfirmedCandidate_In_AdmissionOrder() throws Exception {
        BufferedImage poster = TestImages.ramp(200, 160);
        Path first = TestImages.write(poster, dir, "z-first.png");
        Path second = TestImages.write(poster, dir, "a-second.png");
        Path incoming = TestImages.write(poster, dir, "incoming.png");
        admit(first);
        admit(second);

        DuplicateCheck check = detector.check(incoming, session, store);

        assertThat(check.reference()).isEqualTo(first);
        assertThat(regionAnalyzer.calls).isEqualTo(1);
    }

    @Test
    void should_FindDuplicate_In_StoreFromEarlierRun() throws Exception {
        BufferedImage poster = TestImages.ramp(200, 160);
        Path earlier = TestImages.write(poster, dir, "earlier.png");
        Path repost = TestImages.write(poster, dir, "repost.png");
        store.record(earlier, detector.calculator().compute(earlier), FingerprintMetadata.of(earlier));

        DuplicateCheck check = detector.check(repost, session, store);

        assertThat(check.match()).contains(earlier);
        assertThat(store.size()).isEqualTo(1);
        assertThat(session.isEmpty()).isTrue();
    }

    @Test
    void should_SkipStoredCandidate_When_BackingFileWasDeleted() throws Exception {
        BufferedImage poster = TestImages.ramp(200, 160);
        Path deleted = TestImages.write(poster, dir, "deleted.png");
        Path repost = TestImages.write(poster, dir, "repost.png");
        store.record(deleted, detector.calculator().compute(deleted), FingerprintMetadata.of(deleted));
        Files.delete(deleted);

        DuplicateCheck check = detector.check(repost, session, store);

        assertThat(check.duplicate()).isFalse();
        assertThat(check.reference()).isNull();
        assertThat(regionAnalyzer.calls).isZero();
    }

    @Test
    void should_TreatAsUnique_When_ImageCannotBeFingerprinted() throws Exception {
        Path original = TestImages.write(TestImages.ramp(200, 160), dir, "a.png");
        Path empty = Files.createFile(dir.resolve("b.jpg"));
        admit(original);

        DuplicateCheck check = detector.check(empty, session, store);

        assertThat(check.duplicate()).isFalse();
        assertThat(check.reference()).isNull();
        assertThat(check.fingerprinted()).isEmpty();
    }

    @Test
    void should_NotMatchItself_When_StoreAlreadyHoldsTheSamePath() throws Exception {
        Path poster = TestImages.write(TestImages.ramp(200, 160), dir, "a.png");
        store.record(poster, detector.calculator().compute(poster), FingerprintMetadata.of(poster));

        assertThat(detector.check(poster, session, store).duplicate()).isFalse();
    }

    @Test
    void should_IgnoreStoredFingerprints_When_ComputedUnderAnotherHashSize() throws Exception {
        BufferedImage poster = TestImages.ramp(200, 160);
        Path earlier = TestImages.write(poster, dir, "earlier.png");
        Path repost = TestImages.write(poster, dir, "repost.png");
        HashCalculator coarse = new HashCalculator(new DetectionConfig(8, 4, 30, 4, 1));
        store.record(earlier, coarse.compute(earlier), FingerprintMetadata.of(earlier));

        assertThat(detector.check(repost, session, store).duplicate()).isFalse();
    }

    @Test
    void should_FailOpen_When_StoreLookupFails() throws Exception {
        Path image = TestImages.write(TestImages.ramp(200, 160), dir, "a.png");

        DuplicateCheck check = detector.check(image, session, new FailingStore());

        assertThat(check.duplicate()).isFalse();
        assertThat(check.fingerprinted()).isPresent();
    }

    @Test
    void should_NeverWriteToSessionOrStore() throws Exception {
        BufferedImage poster = TestImages.ramp(200, 160);
        Path original = TestImages.write(poster, dir, "a.png");
        Path repost = TestImages.write(poster, dir, "b.png");
        admit(original);

        detector.check(repost, session, store);

        assertThat(session.size()).isEqualTo(1);
        assertThat(store.size()).isZero();
    }

    static final class CountingRegionAnalyzer extends RegionAnalyzer {

        int calls;

        CountingRegionAnalyzer(DetectionConfig config) {
            super(config);
        }

        @Override
        public List<RegionDifference> analyze(BufferedImage incoming, BufferedImage candidate) {
            calls++;
            return super.analyze(incoming, candidate);
        }
    }

    private static final class FailingStore implements FingerprintStore {

        @Override
        public List<StoredFingerprint> lookup(Fingerprint probe) {
            throw new FingerprintStoreException("database is locked", new IllegalStateException());
        }

        @Override
        public void record(Path path, Fingerprint fingerprint, FingerprintMetadata metadata) {
            throw new UnsupportedOperationException();
        }

        @Override
        public Optional<StoredFingerprint> find(Path path) {
            return Optional.empty();
        }

        @Override
        public void remove(Path path) {
            throw new UnsupportedOperationException();
        }

        @Override
        public void markProcessed(String imageName) {
            throw new UnsupportedOperationException();
        }

        @Override
        public boolean isProcessed(String imageName) {
            return false;
        }
    }
}
