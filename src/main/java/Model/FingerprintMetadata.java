package Model;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Extra facts recorded next to a fingerprint. The component bit-strings and the
 * hash size/version tag travel with the {@link Fingerprint} itself.
 */
public record FingerprintMetadata(long fileSize, long lastModified) {

    public static final FingerprintMetadata UNKNOWN = new FingerprintMetadata(-1, -1);

    public static FingerprintMetadata of(Path file) throws IOException {
        return new FingerprintMetadata(Files.size(file), Files.getLastModifiedTime(file).toMillis());
    }
}
