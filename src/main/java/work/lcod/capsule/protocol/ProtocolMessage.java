package work.lcod.capsule.protocol;

import java.util.Objects;
import work.lcod.capsule.api.CapsuleMetadata;
import work.lcod.capsule.error.CapsuleErrors;
import work.lcod.capsule.error.CapsuleException;
import work.lcod.capsule.stimulus.Stimulus;

/**
 * Messages exchanged between a remote facade and a protocol runner, one JSON object per line.
 *
 * <p>Messages answering a trigger carry the trigger's {@code id}. Error-carrying messages hold the error text and an
 * optional error code naming its category, see {@link CapsuleErrors#fromWire(String, String)}.</p>
 */
public interface ProtocolMessage {
    MessageType type();

    /**
     * Correlation id, {@code null} for boot, shutdown and stimulus messages.
     */
    default String id() {
        return null;
    }

    record Boot(String capsuleName) implements ProtocolMessage {
        @Override
        public MessageType type() {
            return MessageType.BOOT;
        }
    }

    record BootResponse(boolean ready, CapsuleMetadata metadata, String error, String errorCode) implements ProtocolMessage {
        public static BootResponse ready(CapsuleMetadata metadata) {
            return new BootResponse(true, metadata, null, null);
        }

        public static BootResponse failed(Throwable error) {
            return new BootResponse(false, null, CapsuleErrors.message(error), CapsuleErrors.code(error));
        }

        public CapsuleException failure() {
            return CapsuleErrors.fromWire(errorCode, error);
        }

        @Override
        public MessageType type() {
            return MessageType.BOOT;
        }
    }

    /**
     * @param signalAborted the caller's token was already cancelled when the trigger was sent
     */
    record Trigger(String id, String capability, String operation, Object params, boolean signalAborted)
        implements ProtocolMessage {
        public Trigger {
            Objects.requireNonNull(id, "id");
        }

        @Override
        public MessageType type() {
            return MessageType.TRIGGER;
        }
    }

    record Response(String id, Object result, String error, String errorCode) implements ProtocolMessage {
        public Response {
            Objects.requireNonNull(id, "id");
        }

        public static Response success(String id, Object result) {
            return new Response(id, result, null, null);
        }

        public static Response failed(String id, Throwable error) {
            return new Response(id, null, CapsuleErrors.message(error), CapsuleErrors.code(error));
        }

        public boolean successful() {
            return error == null;
        }

        public CapsuleException failure() {
            return CapsuleErrors.fromWire(errorCode, error);
        }

        @Override
        public MessageType type() {
            return MessageType.RESPONSE;
        }
    }

    record Abort(String id, String reason) implements ProtocolMessage {
        public Abort {
            Objects.requireNonNull(id, "id");
        }

        @Override
        public MessageType type() {
            return MessageType.ABORT;
        }
    }

    record Shutdown() implements ProtocolMessage {
        @Override
        public MessageType type() {
            return MessageType.SHUTDOWN;
        }
    }

    record ShutdownResponse(boolean ok, String error, String errorCode) implements ProtocolMessage {
        public static ShutdownResponse succeeded() {
            return new ShutdownResponse(true, null, null);
        }

        public static ShutdownResponse failed(Throwable error) {
            return new ShutdownResponse(false, CapsuleErrors.message(error), CapsuleErrors.code(error));
        }

        public CapsuleException failure() {
            return CapsuleErrors.fromWire(errorCode, error);
        }

        @Override
        public MessageType type() {
            return MessageType.SHUTDOWN;
        }
    }

    record StreamData(String id, Object data) implements ProtocolMessage {
        public StreamData {
            Objects.requireNonNull(id, "id");
        }

        @Override
        public MessageType type() {
            return MessageType.STREAM_DATA;
        }
    }

    record StreamEnd(String id, String error, String errorCode) implements ProtocolMessage {
        public StreamEnd {
            Objects.requireNonNull(id, "id");
        }

        public static StreamEnd completed(String id) {
            return new StreamEnd(id, null, null);
        }

        public static StreamEnd failed(String id, Throwable error) {
            return new StreamEnd(id, CapsuleErrors.message(error), CapsuleErrors.code(error));
        }

        public CapsuleException failure() {
            return CapsuleErrors.fromWire(errorCode, error);
        }

        @Override
        public MessageType type() {
            return MessageType.STREAM_END;
        }
    }

    record StimulusEvent(Stimulus stimulus) implements ProtocolMessage {
        public StimulusEvent {
            Objects.requireNonNull(stimulus, "stimulus");
        }

        @Override
        public MessageType type() {
            return MessageType.STIMULUS;
        }
    }
}
