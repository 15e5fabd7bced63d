package in.ordergate.infrastructure.venue;

/**
 * Exception thrown when an adapter cannot deliver a serialized command to
 * the venue.
 *
 * Never crosses the connector's worker thread: the worker turns it into a
 * REJECTED status update for the order the command belonged to.
 */
public class OrderSendException extends Exception {

    private final String venue;

    public OrderSendException(String venue, String message) {
        super(String.format("[%s] %s", venue, message));
        this.venue = venue;
    }

    public OrderSendException(String venue, String message, Throwable cause) {
        super(String.format("[%s] %s", venue, message), cause);
        this.venue = venue;
    }

    public String getVenue() {
        return venue;
    }
}
