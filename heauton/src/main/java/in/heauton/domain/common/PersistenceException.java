package in.heauton.domain.common;

/**
 * Thrown by repositories when the underlying store fails.
 */
public class PersistenceException extends RuntimeException {

    public PersistenceException(String message) {
        super(message);
    }

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
