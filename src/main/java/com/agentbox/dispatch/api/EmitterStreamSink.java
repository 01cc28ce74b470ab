package com.agentbox.dispatch.api;

import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;

/**
 * {@link StreamSink} writing to a Spring {@link SseEmitter}.
 */
public class EmitterStreamSink implements StreamSink {

    private final SseEmitter emitter;

    public EmitterStreamSink(SseEmitter emitter) {
        this.emitter = emitter;
    }

    @Override
    public void send(StreamFrame frame) throws IOException {
        SseEmitter.SseEventBuilder builder = SseEmitter.event();
        if (frame.id() != null) {
            builder.id(frame.id());
        }
        if (frame.event() != null) {
            builder.name(frame.event());
        }
        try {
            emitter.send(builder.data(frame.data()));
        } catch (IllegalStateException e) {
            // Emitter already completed or timed out
            throw new IOException("emitter no longer active", e);
        }
    }

    @Override
    public void complete() {
        emitter.complete();
    }
}
