package in.ordergate.infrastructure.venue;

/**
 * Exception thrown when the gateway is configured with values it cannot
 * run with (unknown protocol, missing credentials, malformed endpoint).
 *
 * Raised at construction time and never retried.
 */
public class GatewayConfigurationException extends RuntimeException {

    public GatewayConfigurationException(String message) {
        super(message);
    }

    public GatewayConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
