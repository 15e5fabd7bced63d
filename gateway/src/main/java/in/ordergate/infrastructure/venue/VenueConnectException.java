package in.ordergate.infrastructure.venue;

/**
 * Exception thrown when the protocol handshake or the transport to the
 * venue cannot be established.
 */
public class VenueConnectException extends Exception {

    private final String venue;

    public VenueConnectException(String venue, String message) {
        super(String.format("[%s] %s", venue, message));
        this.venue = venue;
    }

    public VenueConnectException(String venue, String message, Throwable cause) {
        super(String.format("[%s] %s", venue, message), cause);
        this.venue = venue;
    }

    public String getVenue() {
        return venue;
    }
}
