package in.tickbridge.domain.feed;

/**
 * Subscription granularity on the upstream feed.
 */
public enum FeedClass {
    DETAILED("d", "df", "detailed"),
    TOUCHLINE("t", "tf", "touchline");

    private final String wireCode;
    private final String tickType;
    private final String label;

    FeedClass(String wireCode, String tickType, String label) {
        this.wireCode = wireCode;
        this.tickType = tickType;
        this.label = label;
    }

    /** Discriminator used in subscription frames ({@code t:"d"} / {@code t:"t"}). */
    public String wireCode() {
        return wireCode;
    }

    /** Frame type of streamed updates for this class. */
    public String tickType() {
        return tickType;
    }

    /** Value of {@code feed_type} in downstream ticks. */
    public String label() {
        return label;
    }

    /**
     * Parse a viewer-supplied feed type. Accepts the wire code or the label;
     * anything else means touchline.
     */
    public static FeedClass fromCode(String code) {
        if (code == null) {
            return TOUCHLINE;
        }
        String c = code.trim().toLowerCase();
        if (c.equals(DETAILED.wireCode) || c.equals(DETAILED.label)) {
            return DETAILED;
        }
        return TOUCHLINE;
    }

    /**
     * Feed class of an inbound tick frame: {@code df}/{@code d} are detailed,
     * everything else touchline.
     */
    public static FeedClass fromTickType(String frameType) {
        return frameType != null && frameType.startsWith("d") ? DETAILED : TOUCHLINE;
    }

    public static boolean isTickType(String frameType) {
        if (frameType == null) {
            return false;
        }
        return switch (frameType) {
            case "df", "tf", "d", "t" -> true;
            default -> false;
        };
    }
}
