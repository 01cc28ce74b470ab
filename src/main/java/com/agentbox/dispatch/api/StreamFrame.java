package com.agentbox.dispatch.api;

/**
 * One text-event-stream frame.
 *
 * @param id    the record cursor, or null for heartbeats
 * @param event event name, or null for plain data frames
 * @param data  JSON payload
 */
public record StreamFrame(String id, String event, String data) {

    public static final String HEARTBEAT = "heartbeat";

    public static StreamFrame heartbeat(long cursor) {
        return new StreamFrame(null, HEARTBEAT, "{\"cursor\":" + cursor + "}");
    }
}
