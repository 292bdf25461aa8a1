package uk.gegc.docintake.features.realtime.domain;

public final class LiveEventTypes {

    /** Pushed for every appended audit event. */
    public static final String RECEIVE_LOG = "ReceiveLog";

    public static final String PING = "Ping";
    public static final String PONG = "Pong";

    private LiveEventTypes() {
    }
}
