package in.ordergate.infrastructure.venue;

/**
 * Credentials presented to the venue during the protocol handshake.
 */
public record VenueCredentials(
    String apiKey,
    String secretKey
) {
    public VenueCredentials {
        if (apiKey == null || apiKey.isBlank()) {
            throw new GatewayConfigurationException("Venue API key cannot be null or empty");
        }
        if (secretKey == null || secretKey.isBlank()) {
            throw new GatewayConfigurationException("Venue secret key cannot be null or empty");
        }
    }

    @Override
    public String toString() {
        return "VenueCredentials[apiKey=" + mask(apiKey) + ", secretKey=****]";
    }

    private static String mask(String value) {
        if (value.length() <= 4) {
            return "****";
        }
        return value.substring(0, 4) + "****";
    }
}
