package io.github.yok.bucketdblink.storage;

/**
 * Thrown when the object store cannot list or read objects.
 *
 * @author Yasuharu.Okawauchi
 */
public class ObjectStoreException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates an exception.
     *
     * @param message description of the failed operation
     * @param cause underlying SDK failure
     */
    public ObjectStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
