package work.lcod.capsule.protocol;

import java.util.Optional;

/**
 * Values of the {@code type} field. Boot and shutdown requests share their type with the matching response.
 */
public enum MessageType {
    BOOT("boot"),
    TRIGGER("trigger"),
    RESPONSE("response"),
    ABORT("abort"),
    SHUTDOWN("shutdown"),
    STREAM_DATA("stream-data"),
    STREAM_END("stream-end"),
    STIMULUS("stimulus");

    private final String wireName;

    MessageType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<MessageType> fromWire(String value) {
        for (var type : values()) {
            if (type.wireName.equals(value)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
