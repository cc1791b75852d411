package Model;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Non-durable store for dry runs and tests. Lookup order follows recording order.
 */
public final class InMemoryFingerprintStore implements FingerprintStore {

    private final Map<Path, StoredFingerprint> fingerprints = new LinkedHashMap<>();
    private final Set<String> processed = ConcurrentHashMap.newKeySet();

    @Override
    public synchronized List<StoredFingerprint> lookup(Fingerprint probe) {
        List<StoredFingerprint> out = new ArrayList<>();
        for (StoredFingerprint s : fingerprints.values()) {
            if (s.fingerprint().isComparableTo(probe)) out.add(s);
        }
        return out;
    }

    @Override
    public synchronized void record(Path path, Fingerprint fingerprint, FingerprintMetadata metadata) {
        fingerprints.remove(path);
        fingerprints.put(path, new StoredFingerprint(path, fingerprint, metadata, Instant.now()));
    }

    @Override
    public synchronized Optional<StoredFingerprint> find(Path path) {
        return Optional.ofNullable(fingerprints.get(path));
    }

    @Override
    public synchronized void remove(Path path) {
        fingerprints.remove(path);
    }

    @Override
    public void markProcessed(String imageName) {
        processed.add(imageName);
    }

    @Override
    public boolean isProcessed(String imageName) {
        return processed.contains(imageName);
    }

    public synchronized int size() {
        return fingerprints.size();
    }
}
