package in.ordergate.infrastructure.venue;

/**
 * Result of enqueueing a command on the connector.
 */
public enum SubmissionResult {
    ACCEPTED,
    NOT_CONNECTED;

    public boolean isAccepted() {
        return this == ACCEPTED;
    }
}
