package in.ordergate.infrastructure.venue;

import java.time.Duration;

/**
 * Exception thrown when a connect attempt does not complete within the
 * caller's timeout.
 */
public class ConnectTimeoutException extends VenueConnectException {

    private final Duration timeout;

    public ConnectTimeoutException(String venue, Duration timeout) {
        super(venue, "Connect attempt timed out after " + timeout.toMillis() + "ms");
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
