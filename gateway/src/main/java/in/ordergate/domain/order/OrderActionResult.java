package in.ordergate.domain.order;

/**
 * Outcome of an OrderManager operation.
 *
 * Everything other than OK is reported to the caller and leaves the
 * registry untouched.
 */
public enum OrderActionResult {
    OK,
    NOT_FOUND,
    NOT_CANCELABLE,
    NOT_MODIFIABLE,
    STALE_UPDATE,               // Update arrived after the order became terminal
    INVALID_TRANSITION,         // Update not legal from the current status
    DATA_INTEGRITY_VIOLATION;   // Fill would exceed requested quantity

    public boolean isSuccess() {
        return this == OK;
    }
}
