package abrazar.casework.exceptions;

/**
 * Exception thrown by job handlers when retrying cannot succeed (unknown job type, malformed payload, unknown
 * discriminator such as an unsupported {@code entityType}).
 *
 * <p>
 * The worker pool moves the job straight to FAILED without consuming the remaining attempts.
 */
public class PermanentJobFailureException extends RuntimeException {

    public PermanentJobFailureException(String message) {
        super(message);
    }

    public PermanentJobFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
