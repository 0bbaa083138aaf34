package uk.co.speedyvan.realtime.api.channel;

/**
 * Logical namespaces a realtime channel can belong to.
 * <p>
 * Each namespace carries the lowercase segment used on the wire, so callers pick a namespace from this
 * enumeration instead of passing free-form strings.
 */
public enum ChannelNamespace {

    ORDERS("orders"),
    DRIVERS("drivers"),
    DISPATCH("dispatch"),
    FINANCE("finance"),
    CUSTOMERS("customers"),
    JOBS("jobs"),
    NOTIFICATIONS("notifications");

    private final String wireName;

    ChannelNamespace(String wireName) {
        this.wireName = wireName;
    }

    /**
     * Returns the lowercase channel segment used on the wire.
     */
    public String wireName() {
        return wireName;
    }
}
