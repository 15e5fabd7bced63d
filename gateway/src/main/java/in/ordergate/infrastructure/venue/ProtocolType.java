package in.ordergate.infrastructure.venue;

import java.util.Arrays;
import java.util.Locale;

/**
 * Wire protocols the gateway can speak to a venue.
 */
public enum ProtocolType {
    FIX,
    WEBSOCKET,
    PAPER;

    /**
     * Resolve a configured protocol name.
     *
     * @param name protocol name, case-insensitive ("WS" is accepted for WEBSOCKET)
     * @return matching protocol
     * @throws GatewayConfigurationException if the name is blank or unsupported
     */
    public static ProtocolType fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new GatewayConfigurationException("Venue protocol is not configured");
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT);
        if (normalized.equals("WS")) {
            return WEBSOCKET;
        }
        try {
            return ProtocolType.valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new GatewayConfigurationException(
                "Unsupported venue protocol: " + name + " (supported: " + Arrays.toString(values()) + ")", e);
        }
    }
}
