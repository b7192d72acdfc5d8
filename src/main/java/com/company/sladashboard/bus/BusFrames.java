package com.company.sladashboard.bus;

/**
 * Control frame types exchanged on the bus besides event frames.
 */
public final class BusFrames {

    public static final String TYPE = "type";
    public static final String KEY = "key";

    // Inbound
    public static final String SUBSCRIBE = "subscribe";
    public static final String UNSUBSCRIBE = "unsubscribe";
    public static final String PING = "ping";
    public static final String PONG = "pong";

    // Outbound
    public static final String SUBSCRIBED = "subscribed";
    public static final String UNSUBSCRIBED = "unsubscribed";
    public static final String HEARTBEAT_PING = "heartbeat-ping";
    public static final String ERROR = "error";

    private BusFrames() {
    }
}
