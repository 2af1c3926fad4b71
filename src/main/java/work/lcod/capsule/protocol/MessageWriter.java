package work.lcod.capsule.protocol;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.capsule.error.TransportException;

/**
 * Writes one message per line and flushes after each. Writes are serialized so concurrent senders never interleave
 * partial lines. Once closed, further messages are dropped.
 */
public final class MessageWriter implements AutoCloseable {
    private static final Logger LOGGER = LoggerFactory.getLogger(MessageWriter.class);

    private final Writer output;
    private final MessageCodec codec;
    private boolean closed;

    public MessageWriter(OutputStream output, MessageCodec codec) {
        this.output = new BufferedWriter(new OutputStreamWriter(output, StandardCharsets.UTF_8));
        this.codec = codec;
    }

    /**
     * @return {@code false} when the writer was already closed and the message was dropped
     * @throws TransportException when the underlying stream fails; the writer is closed afterwards
     */
    public synchronized boolean send(ProtocolMessage message) {
        if (closed) {
            LOGGER.debug("Dropping {} message for '{}': writer closed", message.type().wireName(), message.id());
            return false;
        }
        var line = codec.encode(message);
        try {
            output.write(line);
            output.write('\n');
            output.flush();
        } catch (IOException ex) {
            closed = true;
            throw new TransportException("Failed to write " + message.type().wireName() + " message: " + ex.getMessage(), ex);
        }
        LOGGER.debug("-> {}", line);
        return true;
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            output.close();
        } catch (IOException ex) {
            LOGGER.debug("Closing message output failed: {}", ex.getMessage());
        }
    }
}
