package ai.paraflow.analyzer;

import java.nio.charset.StandardCharsets;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.treesitter.TSNode;

/**
 * Wrapper for a source text and its UTF-8 bytes. Tree-sitter reports UTF-8 byte offsets, so node text must be cut
 * from the bytes rather than from the String.
 */
public final class SourceContent {
    private static final Logger log = LogManager.getLogger(SourceContent.class);

    private static final char BOM = '\uFEFF';

    private final String text;
    private final byte[] utf8Bytes;

    private SourceContent(String text, byte[] utf8Bytes) {
        this.text = text;
        this.utf8Bytes = utf8Bytes;
    }

    /** Creates a SourceContent for the provided text, dropping a leading byte order mark. */
    public static SourceContent of(String src) {
        var text = !src.isEmpty() && src.charAt(0) == BOM ? src.substring(1) : src;
        return new SourceContent(text, text.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Extracts the text in the UTF-8 byte range [startByte, endByte). Out-of-range requests return the empty string
     * and an end past the source is truncated.
     */
    public String substringFromBytes(int startByte, int endByte) {
        if (startByte < 0 || endByte < startByte || startByte > utf8Bytes.length) {
            log.warn(
                    "Requested bytes outside valid range for source text (length: {} bytes): startByte={}, endByte={}",
                    utf8Bytes.length,
                    startByte,
                    endByte);
            return "";
        }
        int end = Math.min(endByte, utf8Bytes.length);
        return new String(utf8Bytes, startByte, end - startByte, StandardCharsets.UTF_8);
    }

    /** Text of a node, or the empty string for a null node. */
    public String substringFrom(TSNode node) {
        if (node.isNull()) {
            return "";
        }
        return substringFromBytes(node.getStartByte(), node.getEndByte());
    }

    public String text() {
        return text;
    }

    public int byteLength() {
        return utf8Bytes.length;
    }

    @Override
    public String toString() {
        return "SourceContent[byteLength=" + utf8Bytes.length + ']';
    }
}
