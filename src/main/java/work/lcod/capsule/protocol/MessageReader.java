package work.lcod.capsule.protocol;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.capsule.error.ProtocolException;

/**
 * Pulls chunks from an input stream, splits them into lines and hands decoded messages to a {@link Listener}.
 * A malformed line is reported and skipped; only the end of the stream or a read failure stops the reader.
 */
public final class MessageReader implements Runnable {
    private static final Logger LOGGER = LoggerFactory.getLogger(MessageReader.class);
    private static final int CHUNK_SIZE = 8192;

    public interface Listener {
        void onMessage(ProtocolMessage message);

        default void onMalformed(String line, ProtocolException error) {
            LOGGER.warn("Skipping malformed line: {}", error.getMessage());
        }

        /**
         * @param error {@code null} on a clean end of stream
         */
        void onClosed(IOException error);
    }

    private final Reader input;
    private final MessageCodec codec;
    private final Listener listener;
    private final LineAssembler assembler = new LineAssembler();

    public MessageReader(InputStream input, MessageCodec codec, Listener listener) {
        this.input = new InputStreamReader(input, StandardCharsets.UTF_8);
        this.codec = codec;
        this.listener = listener;
    }

    public Thread start(String threadName) {
        var thread = new Thread(this, threadName);
        thread.setDaemon(true);
        thread.start();
        return thread;
    }

    @Override
    public void run() {
        var chunk = new char[CHUNK_SIZE];
        IOException failure = null;
        try {
            int read;
            while ((read = input.read(chunk)) != -1) {
                for (var line : assembler.feed(new String(chunk, 0, read))) {
                    dispatch(line);
                }
            }
            if (!assembler.pending().isBlank()) {
                LOGGER.warn("Discarding incomplete trailing line ({} chars)", assembler.pending().length());
            }
        } catch (IOException ex) {
            failure = ex;
        } finally {
            listener.onClosed(failure);
        }
    }

    private void dispatch(String line) {
        ProtocolMessage message;
        try {
            message = codec.decode(line);
        } catch (ProtocolException ex) {
            listener.onMalformed(line, ex);
            return;
        }
        LOGGER.debug("<- {}", line);
        listener.onMessage(message);
    }
}
