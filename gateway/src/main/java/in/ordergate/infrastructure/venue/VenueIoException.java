package in.ordergate.infrastructure.venue;

/**
 * Exception thrown by an adapter poll when the link to the venue is lost
 * and cannot be used any further.
 */
public class VenueIoException extends Exception {

    private final String venue;

    public VenueIoException(String venue, String message) {
        super(String.format("[%s] %s", venue, message));
        this.venue = venue;
    }

    public VenueIoException(String venue, String message, Throwable cause) {
        super(String.format("[%s] %s", venue, message), cause);
        this.venue = venue;
    }

    public String getVenue() {
        return venue;
    }
}
