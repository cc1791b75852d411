package Model;

import java.nio.file.Path;

/**
 * Raised when an image cannot be fingerprinted (unreadable, undecodable or empty).
 */
public class FingerprintException extends Exception {

    private final Path image;

    public FingerprintException(Path image, String message) {
        super(message + ": " + image);
        this.image = image;
    }

    public FingerprintException(Path image, String message, Throwable cause) {
        super(message + ": " + image, cause);
        this.image = image;
    }

    public Path getImage() {
        return image;
    }
}
