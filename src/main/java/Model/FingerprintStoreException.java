package Model;

public class FingerprintStoreException extends RuntimeException {

    public FingerprintStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
