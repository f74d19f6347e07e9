package com.questrail.rpclink.transport;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * Frame
 * -----------------------------------------------------------------------------
 * One opaque message exchanged with the peer.
 *
 * <p>A frame is either text or binary. The distinction is preserved end to
 * end: whatever encoding the peer used is what the protocol engine receives,
 * and the content is never altered.</p>
 */
public final class Frame
{
    private enum Encoding {
        TEXT,
        BINARY
    }

    private final Encoding encoding;
    private final byte[] payload;

    private Frame(Encoding encoding, byte[] payload) {
        this.encoding = encoding;
        this.payload = payload;
    }

    public static Frame text(String text) {
        Objects.requireNonNull(text, "text");
        return new Frame(Encoding.TEXT, text.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Creates a binary frame. The array is copied.
     */
    public static Frame binary(byte[] payload) {
        Objects.requireNonNull(payload, "payload");
        return new Frame(Encoding.BINARY, payload.clone());
    }

    public boolean isText() {
        return encoding == Encoding.TEXT;
    }

    /**
     * Returns a copy of the raw payload. Text frames are UTF-8 encoded.
     */
    public byte[] payload() {
        return payload.clone();
    }

    /**
     * Decodes the payload as UTF-8, regardless of encoding.
     */
    public String asText() {
        return new String(payload, StandardCharsets.UTF_8);
    }

    public int length() {
        return payload.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Frame)) {
            return false;
        }
        Frame other = (Frame) o;
        return encoding == other.encoding && Arrays.equals(payload, other.payload);
    }

    @Override
    public int hashCode() {
        return 31 * encoding.hashCode() + Arrays.hashCode(payload);
    }

    @Override
    public String toString() {
        return encoding == Encoding.TEXT
                ? "Frame[TEXT " + asText() + "]"
                : "Frame[BINARY " + payload.length + " bytes]";
    }
}
