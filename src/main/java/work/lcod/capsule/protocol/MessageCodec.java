package work.lcod.capsule.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import work.lcod.capsule.api.CapsuleMetadata;
import work.lcod.capsule.error.ProtocolException;
import work.lcod.capsule.stimulus.Stimulus;
import work.lcod.capsule.stimulus.StimulusSource;

/**
 * Converts protocol messages to single-line JSON and back. Payloads ({@code params}, {@code result}, {@code data})
 * decode to plain maps, lists, strings, numbers and booleans.
 */
public final class MessageCodec {
    private final ObjectMapper json;

    public MessageCodec() {
        this(defaultMapper());
    }

    public MessageCodec(ObjectMapper json) {
        this.json = json;
    }

    public static ObjectMapper defaultMapper() {
        return new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * @return the JSON text without the trailing newline
     */
    public String encode(ProtocolMessage message) {
        var node = json.createObjectNode();
        if (message.id() != null) {
            node.put("id", message.id());
        }
        node.put("type", message.type().wireName());
        if (message instanceof ProtocolMessage.Boot boot) {
            putText(node, "capsuleName", boot.capsuleName());
        } else if (message instanceof ProtocolMessage.BootResponse response) {
            node.put("ready", response.ready());
            if (response.metadata() != null) {
                node.set("metadata", json.valueToTree(response.metadata()));
            }
            putError(node, response.error(), response.errorCode());
        } else if (message instanceof ProtocolMessage.Trigger trigger) {
            node.put("capability", trigger.capability());
            node.put("operation", trigger.operation());
            node.set("params", toNode(trigger.params()));
            if (trigger.signalAborted()) {
                node.put("signalAborted", true);
            }
        } else if (message instanceof ProtocolMessage.Response response) {
            if (response.successful()) {
                node.set("result", toNode(response.result()));
            }
            putError(node, response.error(), response.errorCode());
        } else if (message instanceof ProtocolMessage.Abort abort) {
            putText(node, "reason", abort.reason());
        } else if (message instanceof ProtocolMessage.ShutdownResponse response) {
            node.put("ok", response.ok());
            putError(node, response.error(), response.errorCode());
        } else if (message instanceof ProtocolMessage.StreamData data) {
            node.set("data", toNode(data.data()));
        } else if (message instanceof ProtocolMessage.StreamEnd end) {
            putError(node, end.error(), end.errorCode());
        } else if (message instanceof ProtocolMessage.StimulusEvent event) {
            var stimulus = event.stimulus();
            node.put("sense", stimulus.sense());
            node.set("data", toNode(stimulus.data()));
            if (stimulus.source() != null) {
                var source = node.putObject("source");
                source.put("capability", stimulus.source().capability());
                source.put("operation", stimulus.source().operation());
            }
            node.put("timestamp", stimulus.timestamp() != null ? stimulus.timestamp() : System.currentTimeMillis());
        }
        try {
            return json.writeValueAsString(node);
        } catch (JsonProcessingException ex) {
            throw new ProtocolException("Cannot encode " + message.type().wireName() + " message: " + ex.getOriginalMessage(),
                message.id(), ex);
        }
    }

    /**
     * @throws ProtocolException when the line is not a message; {@link ProtocolException#requestId()} is set when the
     *                           line carried an id, so that the failure can be answered
     */
    public ProtocolMessage decode(String line) {
        JsonNode node;
        try {
            node = json.readTree(line);
        } catch (JsonProcessingException ex) {
            throw new ProtocolException("Invalid JSON message: " + line, null, ex);
        }
        if (node == null || !node.isObject()) {
            throw new ProtocolException("Message must be a JSON object: " + line);
        }
        var id = text(node, "id");
        var typeName = text(node, "type");
        var type = MessageType.fromWire(typeName)
            .orElseThrow(() -> new ProtocolException("Unknown message type: " + typeName, id, null));
        return switch (type) {
            case BOOT -> node.has("ready")
                ? new ProtocolMessage.BootResponse(
                    node.path("ready").asBoolean(false),
                    metadata(node.get("metadata"), id),
                    text(node, "error"),
                    text(node, "errorCode"))
                : new ProtocolMessage.Boot(text(node, "capsuleName"));
            case TRIGGER -> new ProtocolMessage.Trigger(
                require(id, "id", type, null),
                require(text(node, "capability"), "capability", type, id),
                require(text(node, "operation"), "operation", type, id),
                convertNode(node.get("params")),
                node.path("signalAborted").asBoolean(false));
            case RESPONSE -> new ProtocolMessage.Response(
                require(id, "id", type, null),
                convertNode(node.get("result")),
                text(node, "error"),
                text(node, "errorCode"));
            case ABORT -> new ProtocolMessage.Abort(require(id, "id", type, null), text(node, "reason"));
            case SHUTDOWN -> node.has("ok")
                ? new ProtocolMessage.ShutdownResponse(
                    node.path("ok").asBoolean(false),
                    text(node, "error"),
                    text(node, "errorCode"))
                : new ProtocolMessage.Shutdown();
            case STREAM_DATA -> new ProtocolMessage.StreamData(require(id, "id", type, null), convertNode(node.get("data")));
            case STREAM_END -> new ProtocolMessage.StreamEnd(
                require(id, "id", type, null),
                text(node, "error"),
                text(node, "errorCode"));
            case STIMULUS -> new ProtocolMessage.StimulusEvent(stimulus(node));
        };
    }

    private CapsuleMetadata metadata(JsonNode node, String id) {
        if (node == null || node.isNull()) {
            return null;
        }
        try {
            return json.treeToValue(node, CapsuleMetadata.class);
        } catch (JsonProcessingException ex) {
            throw new ProtocolException("Invalid capsule metadata: " + ex.getOriginalMessage(), id, ex);
        }
    }

    private Stimulus stimulus(JsonNode node) {
        var sense = require(text(node, "sense"), "sense", MessageType.STIMULUS, null);
        StimulusSource source = null;
        var sourceNode = node.get("source");
        if (sourceNode != null && sourceNode.isObject()) {
            source = new StimulusSource(text(sourceNode, "capability"), text(sourceNode, "operation"));
        }
        var timestampNode = node.get("timestamp");
        Long timestamp = timestampNode != null && timestampNode.isNumber() ? timestampNode.asLong() : null;
        return new Stimulus(sense, convertNode(node.get("data")), source, timestamp);
    }

    private JsonNode toNode(Object value) {
        return value == null ? NullNode.getInstance() : json.valueToTree(value);
    }

    private static void putText(ObjectNode node, String field, String value) {
        if (value != null) {
            node.put(field, value);
        }
    }

    private static void putError(ObjectNode node, String error, String errorCode) {
        putText(node, "error", error);
        putText(node, "errorCode", errorCode);
    }

    private static String text(JsonNode node, String field) {
        var value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static String require(String value, String field, MessageType type, String id) {
        if (value == null) {
            throw new ProtocolException("Missing '" + field + "' in " + type.wireName() + " message", id, null);
        }
        return value;
    }

    static Object convertNode(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isObject()) {
            var map = new LinkedHashMap<String, Object>();
            var fields = node.fields();
            while (fields.hasNext()) {
                var entry = fields.next();
                map.put(entry.getKey(), convertNode(entry.getValue()));
            }
            return map;
        }
        if (node.isArray()) {
            var list = new ArrayList<Object>();
            for (var item : node) {
                list.add(convertNode(item));
            }
            return list;
        }
        if (node.isNumber()) {
            return node.numberValue();
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        return node.asText();
    }
}
