package abrazar.casework.exceptions;

/**
 * Exception thrown when a cache value cannot be written to or read from its JSON form.
 *
 * <p>
 * Extends RuntimeException per project standards. {@code CacheService} treats it as a miss on read and a skipped
 * write on set.
 */
public class CacheSerializationException extends RuntimeException {

    public CacheSerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
