package work.lcod.capsule.protocol;

import java.util.ArrayList;
import java.util.List;

/**
 * Reassembles newline-delimited lines from arbitrary chunks. The fragment after the last newline is kept until a
 * later chunk completes it. Not thread-safe; owned by a single reader.
 */
public final class LineAssembler {
    private final StringBuilder buffer = new StringBuilder();

    /**
     * @return the complete, non-blank lines this chunk finished, with any trailing {@code \r} removed
     */
    public List<String> feed(CharSequence chunk) {
        buffer.append(chunk);
        var lines = new ArrayList<String>();
        int start = 0;
        for (int i = 0; i < buffer.length(); i++) {
            if (buffer.charAt(i) == '\n') {
                int end = i;
                if (end > start && buffer.charAt(end - 1) == '\r') {
                    end--;
                }
                var line = buffer.substring(start, end);
                if (!line.isBlank()) {
                    lines.add(line);
                }
                start = i + 1;
            }
        }
        buffer.delete(0, start);
        return lines;
    }

    /**
     * The retained fragment, empty when the last chunk ended with a newline.
     */
    public String pending() {
        return buffer.toString();
    }
}
