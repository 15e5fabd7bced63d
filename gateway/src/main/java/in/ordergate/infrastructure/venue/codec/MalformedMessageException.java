package in.ordergate.infrastructure.venue.codec;

/**
 * Exception thrown when a venue message cannot be decoded.
 */
public class MalformedMessageException extends RuntimeException {

    public MalformedMessageException(String message) {
        super(message);
    }

    public MalformedMessageException(String message, Throwable cause) {
        super(message, cause);
    }
}
