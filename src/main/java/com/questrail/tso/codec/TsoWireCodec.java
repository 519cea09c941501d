package com.questrail.tso.codec;

import com.questrail.tso.api.StreamKey;

import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * TsoWireCodec
 * -----------------------------------------------------------------------------
 * Datagram codec for {@code GetTimestamp} requests and responses.
 *
 * <h2>Layout (big-endian)</h2>
 * <pre>
 *   header   : magic (u16 = 0x5453 "TS") | version (u8 = 1) | type (u8)
 *
 *   request  : header(type = 1) | requestId (i64) | count (i32)
 *              | streamKeyLength (u16) | streamKey (UTF-8)
 *
 *   response : header(type = 2) | requestId (i64) | status (u8)
 *              | physical (i64) | logical (i32) | count (i32)
 * </pre>
 *
 * <p>An empty stream key denotes the global stream.</p>
 *
 * <p>Each datagram is decoded as a complete unit. A datagram that is truncated,
 * carries trailing bytes, a foreign magic, an unsupported version or an invalid
 * field is dropped: the decoder returns {@link Optional#empty()} and never throws.</p>
 */
public final class TsoWireCodec
{
    public static final int MAGIC = 0x5453;
    public static final int VERSION = 1;

    static final int TYPE_REQUEST = 1;
    static final int TYPE_RESPONSE = 2;

    private static final int HEADER_LENGTH = 4;
    private static final int MAX_STREAM_KEY_LENGTH = 255;
    private static final int RESPONSE_LENGTH = HEADER_LENGTH + 8 + 1 + 8 + 4 + 4;

    public byte[] encodeRequest(TsoRequest request) {
        byte[] key = request.stream().isGlobal()
                ? new byte[0]
                : request.stream().region().getBytes(StandardCharsets.UTF_8);
        if (key.length > MAX_STREAM_KEY_LENGTH) {
            throw new IllegalArgumentException("Stream key too long: " + key.length + " bytes");
        }

        ByteBuffer buf = ByteBuffer.allocate(HEADER_LENGTH + 8 + 4 + 2 + key.length);
        putHeader(buf, TYPE_REQUEST);
        buf.putLong(request.requestId());
        buf.putInt(request.count());
        buf.putShort((short) key.length);
        buf.put(key);
        return buf.array();
    }

    public Optional<TsoRequest> decodeRequest(byte[] datagram) {
        try {
            ByteBuffer buf = ByteBuffer.wrap(datagram);
            checkHeader(buf, TYPE_REQUEST);

            long requestId = buf.getLong();
            int count = buf.getInt();
            int keyLength = buf.getShort() & 0xFFFF;
            if (keyLength > MAX_STREAM_KEY_LENGTH) {
                throw new WireFormatException("Stream key too long: " + keyLength);
            }
            byte[] key = new byte[keyLength];
            buf.get(key);
            checkFullyConsumed(buf);

            StreamKey stream = StreamKey.parse(new String(key, StandardCharsets.UTF_8));
            return Optional.of(new TsoRequest(requestId, stream, count));
        }
        catch (WireFormatException | BufferUnderflowException | IllegalArgumentException e) {
            // Malformed datagram -> drop
            return Optional.empty();
        }
    }

    public byte[] encodeResponse(TsoResponse response) {
        ByteBuffer buf = ByteBuffer.allocate(RESPONSE_LENGTH);
        putHeader(buf, TYPE_RESPONSE);
        buf.putLong(response.requestId());
        buf.put((byte) response.status().code());
        buf.putLong(response.physical());
        buf.putInt((int) response.logical());
        buf.putInt(response.count());
        return buf.array();
    }

    public Optional<TsoResponse> decodeResponse(byte[] datagram) {
        try {
            ByteBuffer buf = ByteBuffer.wrap(datagram);
            checkHeader(buf, TYPE_RESPONSE);

            long requestId = buf.getLong();
            int code = buf.get() & 0xFF;
            long physical = buf.getLong();
            long logical = buf.getInt();
            int count = buf.getInt();
            checkFullyConsumed(buf);

            TsoResponseStatus status = TsoResponseStatus.fromCode(code)
                    .orElseThrow(() -> new WireFormatException("Unknown status code " + code));
            return Optional.of(new TsoResponse(requestId, status, physical, logical, count));
        }
        catch (WireFormatException | BufferUnderflowException | IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    private static void putHeader(ByteBuffer buf, int type) {
        buf.putShort((short) MAGIC);
        buf.put((byte) VERSION);
        buf.put((byte) type);
    }

    private static void checkHeader(ByteBuffer buf, int expectedType) {
        int magic = buf.getShort() & 0xFFFF;
        if (magic != MAGIC) {
            throw new WireFormatException("Bad magic 0x" + Integer.toHexString(magic));
        }
        int version = buf.get() & 0xFF;
        if (version != VERSION) {
            throw new WireFormatException("Unsupported version " + version);
        }
        int type = buf.get() & 0xFF;
        if (type != expectedType) {
            throw new WireFormatException("Unexpected message type " + type);
        }
    }

    private static void checkFullyConsumed(ByteBuffer buf) {
        if (buf.hasRemaining()) {
            throw new WireFormatException(buf.remaining() + " trailing bytes");
        }
    }

    private static final class WireFormatException extends RuntimeException
    {
        WireFormatException(String message) {
            super(message);
        }
    }
}
