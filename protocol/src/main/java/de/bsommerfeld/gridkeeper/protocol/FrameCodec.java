package de.bsommerfeld.gridkeeper.protocol;

import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * Length-prefixed framing: a 4-byte little-endian unsigned length followed by
 * exactly that many body bytes.
 */
public final class FrameCodec {

    public static final int HEADER_BYTES = 4;

    private FrameCodec() {
    }

    public static void writeFrame(OutputStream out, byte[] body) throws IOException {
        ByteBuffer header = ByteBuffer.allocate(HEADER_BYTES).order(ByteOrder.LITTLE_ENDIAN);
        header.putInt(body.length);
        out.write(header.array());
        out.write(body);
        out.flush();
    }

    /**
     * Reads one frame.
     *
     * @throws EOFException      if the stream ends cleanly before any header byte
     * @throws ProtocolException if the header or body is truncated, or the
     *                           announced length exceeds {@code maxBytes}
     */
    public static byte[] readFrame(InputStream in, int maxBytes) throws IOException {
        byte[] header = new byte[HEADER_BYTES];
        int read = readFully(in, header);
        if (read == 0)
            throw new EOFException("Peer closed the channel");
        if (read < HEADER_BYTES)
            throw new ProtocolException("Truncated frame header: " + read + " of " + HEADER_BYTES + " bytes");

        long length = Integer.toUnsignedLong(ByteBuffer.wrap(header).order(ByteOrder.LITTLE_ENDIAN).getInt());
        if (length > maxBytes)
            throw new ProtocolException("Frame of " + length + " bytes exceeds limit of " + maxBytes);

        byte[] body = new byte[(int) length];
        int bodyRead = readFully(in, body);
        if (bodyRead < body.length)
            throw new ProtocolException("Truncated frame body: " + bodyRead + " of " + length + " bytes");
        return body;
    }

    private static int readFully(InputStream in, byte[] buffer) throws IOException {
        int total = 0;
        while (total < buffer.length) {
            int n = in.read(buffer, total, buffer.length - total);
            if (n < 0)
                break;
            total += n;
        }
        return total;
    }
}
