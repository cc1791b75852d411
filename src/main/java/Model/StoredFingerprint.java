package Model;

import java.nio.file.Path;
import java.time.Instant;

public record StoredFingerprint(Path path, Fingerprint fingerprint, FingerprintMetadata metadata, Instant recordedAt) {}
