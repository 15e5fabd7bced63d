package in.ordergate.infrastructure.venue;

import java.time.Instant;

/**
 * Raw market-data message pulled from the venue, in the adapter's wire format.
 */
public record MarketDataMessage(
    String venue,
    String payload,
    Instant receivedAt
) {}
