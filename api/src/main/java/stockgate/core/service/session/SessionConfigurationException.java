package stockgate.core.service.session;

/**
 * Thrown when session artifacts cannot be signed because the signing secret
 * is missing or unusable.
 */
public class SessionConfigurationException extends RuntimeException {

    public SessionConfigurationException(String message) {
        super(message);
    }

    public SessionConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
