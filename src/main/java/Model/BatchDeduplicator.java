package Model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.*;
import java.util.concurrent.*;

/**
 * Runs the detector over an ordered batch and records every fingerprint it sees.
 *
 * <p>Fingerprints are computed on a worker pool; the duplicate decisions run serially in
 * batch order so that image k is only ever compared with images 1..k-1.</p>
 */
public final class BatchDeduplicator {

    private static final Logger log = LoggerFactory.getLogger(BatchDeduplicator.class);

    public record Entry(Path path, boolean duplicate, Path reference, boolean fingerprinted) {}

    public record BatchReport(List<Entry> entries, int duplicatesFound, int skipped) {

        public List<Path> uniques() {
            List<Path> out = new ArrayList<>();
            for (Entry e : entries) {
                if (!e.duplicate()) out.add(e.path());
            }
            return out;
        }
    }

    private final ExecutorService pool;
    private final ExecutorService coordinator;
    private final DuplicateDetector detector;
    private final FingerprintStore store;

    public BatchDeduplicator(DuplicateDetector detector, FingerprintStore store) {
        this(detector, store, Math.max(2, Runtime.getRuntime().availableProcessors() / 2));
    }

    public BatchDeduplicator(DuplicateDetector detector, FingerprintStore store, int threads) {
        this.detector = detector;
        this.store = store;
        this.pool = Executors.newFixedThreadPool(Math.max(1, threads));
        // batches queue here so a waiting batch never holds a fingerprinting thread
        this.coordinator = Executors.newSingleThreadExecutor();
    }

    public CompletableFuture<BatchReport> scanAsync(List<Path> images) {
        return CompletableFuture.supplyAsync(() -> scan(images), coordinator);
    }

    /**
     * Processes {@code images} in list order. Images already marked processed in the store
     * are skipped; every other image is recorded into the session and the store and marked
     * processed, duplicate or not.
     */
    public BatchReport scan(List<Path> images) {
        List<Path> pending = new ArrayList<>(images.size());
        int skipped = 0;
        for (Path p : images) {
            if (store.isProcessed(name(p))) {
                log.debug("Already processed, skipping {}", p.getFileName());
                skipped++;
            } else {
                pending.add(p);
            }
        }

        List<CompletableFuture<Optional<Fingerprint>>> futures = new ArrayList<>(pending.size());
        for (Path p : pending) {
            futures.add(CompletableFuture.supplyAsync(() -> detector.calculator().tryCompute(p), pool));
        }

        SessionIndex session = new SessionIndex();
        List<Entry> entries = new ArrayList<>(pending.size());
        int duplicates = 0;

        for (int i = 0; i < pending.size(); i++) {
            Path p = pending.get(i);
            Optional<Fingerprint> fp = futures.get(i).join();

            DuplicateCheck check = fp
                    .map(f -> detector.check(p, f, session, store))
                    .orElseGet(() -> DuplicateCheck.unique(null));

            if (check.duplicate()) duplicates++;
            entries.add(new Entry(p, check.duplicate(), check.reference(), fp.isPresent()));

            if (fp.isPresent() && !session.contains(p)) {
                session.add(p, fp.get());
                store.record(p, fp.get(), metadata(p));
            }
            store.markProcessed(name(p));
        }

        log.info("Batch finished: {} images, {} duplicates, {} already processed",
                pending.size(), duplicates, skipped);
        return new BatchReport(entries, duplicates, skipped);
    }

    private static FingerprintMetadata metadata(Path p) {
        try {
            return FingerprintMetadata.of(p);
        } catch (IOException e) {
            log.warn("Cannot read file metadata for {}: {}", p, e.getMessage());
            return FingerprintMetadata.UNKNOWN;
        }
    }

    private static String name(Path p) {
        return p.getFileName().toString();
    }

    public void shutdown() {
        coordinator.shutdownNow();
        pool.shutdownNow();
    }
}
