package Model;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Outcome of one duplicate check.
 *
 * @param duplicate   whether a confirmed near-duplicate was found
 * @param reference   the earlier image it duplicates, {@code null} when not a duplicate
 * @param fingerprint the incoming image's fingerprint, {@code null} when it could not be computed
 */
public record DuplicateCheck(boolean duplicate, Path reference, Fingerprint fingerprint) {

    public static DuplicateCheck unique(Fingerprint fingerprint) {
        return new DuplicateCheck(false, null, fingerprint);
    }

    public static DuplicateCheck duplicateOf(Path reference, Fingerprint fingerprint) {
        return new DuplicateCheck(true, reference, fingerprint);
    }

    public Optional<Path> match() {
        return Optional.ofNullable(reference);
    }

    public Optional<Fingerprint> fingerprinted() {
        return Optional.ofNullable(fingerprint);
    }
}
