package Model;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Durable record of fingerprints from earlier runs.
 *
 * <p>The detector only reads from a store; writes are issued by the orchestrating caller.
 * Implementations raise {@link FingerprintStoreException} on storage faults.</p>
 */
public interface FingerprintStore {

    /**
     * Candidates worth a full comparison against {@code probe}: every stored fingerprint
     * carrying the same hash size and algorithm version as the probe, oldest first. The
     * hash bits themselves do not narrow the result. May be empty.
     */
    List<StoredFingerprint> lookup(Fingerprint probe);

    /** Stores or replaces the fingerprint recorded for {@code path}. */
    void record(Path path, Fingerprint fingerprint, FingerprintMetadata metadata);

    Optional<StoredFingerprint> find(Path path);

    void remove(Path path);

    void markProcessed(String imageName);

    boolean isProcessed(String imageName);
}
