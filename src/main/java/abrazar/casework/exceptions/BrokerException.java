package abrazar.casework.exceptions;

/**
 * Exception thrown when a broker (Redis) command fails or the connection drops mid-operation.
 *
 * <p>
 * Never crosses a queue or cache boundary: {@code LiveJobQueue} and {@code CacheService} convert it into a logged
 * event and a sentinel/empty result.
 *
 * <p>
 * All exceptions in this project extend RuntimeException per project standards.
 */
public class BrokerException extends RuntimeException {

    public BrokerException(String message) {
        super(message);
    }

    public BrokerException(String message, Throwable cause) {
        super(message, cause);
    }
}
