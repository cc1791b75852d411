package Model;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Fingerprints admitted during one batch run, in admission order.
 *
 * <p>Append-only and single-writer: the batch owner adds entries, the detector only scans.
 * Not thread-safe. Every new image is compared against every admitted one, which is fine
 * for batches of tens of images but grows quadratically.</p>
 */
public final class SessionIndex {

    public record Entry(Path path, Fingerprint fingerprint) {}

    private final Map<Path, Fingerprint> entries = new LinkedHashMap<>();

    /**
     * @throws IllegalStateException if {@code path} was already admitted
     */
    public void add(Path path, Fingerprint fingerprint) {
        if (entries.containsKey(path)) {
            throw new IllegalStateException("Already admitted to session: " + path);
        }
        entries.put(path, fingerprint);
    }

    public Optional<Fingerprint> get(Path path) {
        return Optional.ofNullable(entries.get(path));
    }

    public boolean contains(Path path) {
        return entries.containsKey(path);
    }

    public List<Entry> entries() {
        List<Entry> out = new ArrayList<>(entries.size());
        entries.forEach((p, f) -> out.add(new Entry(p, f)));
        return Collections.unmodifiableList(out);
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }
}
