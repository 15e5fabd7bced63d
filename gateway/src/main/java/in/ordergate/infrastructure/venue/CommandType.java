package in.ordergate.infrastructure.venue;

/**
 * Kind of order action sent to the venue.
 */
public enum CommandType {
    NEW,
    CANCEL,
    MODIFY
}
