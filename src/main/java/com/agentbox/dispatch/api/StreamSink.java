package com.agentbox.dispatch.api;

import java.io.IOException;

/**
 * Destination of one streaming connection.
 */
public interface StreamSink {

    void send(StreamFrame frame) throws IOException;

    void complete();
}
