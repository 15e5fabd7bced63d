package in.ordergate.infrastructure.venue;

/**
 * Exception thrown when the venue link could not be closed cleanly.
 */
public class VenueDisconnectException extends Exception {

    private final String venue;

    public VenueDisconnectException(String venue, String message, Throwable cause) {
        super(String.format("[%s] %s", venue, message), cause);
        this.venue = venue;
    }

    public String getVenue() {
        return venue;
    }
}
