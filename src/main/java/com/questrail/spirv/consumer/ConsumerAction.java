package com.questrail.spirv.consumer;

import java.util.Objects;

/**
 * Directive a {@link SpirvConsumer} returns from every callback.
 *
 * <ul>
 *   <li>{@link Continue} – keep parsing</li>
 *   <li>{@link Stop} – end the parse now; reported as
 *       {@code CONSUMER_STOP_REQUESTED}, not as malformed input</li>
 *   <li>{@link Fail} – end the parse now, attributing the failure to the
 *       consumer; reported as {@code CONSUMER_ERROR} wrapping the cause</li>
 * </ul>
 */
public sealed interface ConsumerAction
        permits ConsumerAction.Continue, ConsumerAction.Stop, ConsumerAction.Fail {

    static ConsumerAction proceed() {
        return Continue.INSTANCE;
    }

    static ConsumerAction stop() {
        return Stop.INSTANCE;
    }

    static ConsumerAction fail(Throwable cause) {
        return new Fail(cause);
    }

    record Continue() implements ConsumerAction {
        static final Continue INSTANCE = new Continue();
    }

    record Stop() implements ConsumerAction {
        static final Stop INSTANCE = new Stop();
    }

    record Fail(Throwable cause) implements ConsumerAction {
        public Fail {
            Objects.requireNonNull(cause, "cause");
        }
    }
}
