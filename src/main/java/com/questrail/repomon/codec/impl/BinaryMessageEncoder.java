package com.questrail.repomon.codec.impl;

import com.questrail.repomon.codec.MessageEncodeException;
import com.questrail.repomon.codec.MessageEncoder;
import com.questrail.repomon.model.Message;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetEncoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * BinaryMessageEncoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link MessageEncoder} for {@link BinaryWireFormat}.
 *
 * <p>Encoding fails, rather than silently replacing characters, when the text
 * holds an unpaired surrogate. It also fails when the frame would not fit in
 * {@code maxFrameLength} bytes, so that every frame produced here can be sent
 * as one datagram.</p>
 */
public final class BinaryMessageEncoder implements MessageEncoder
{
    private final int maxFrameLength;

    public BinaryMessageEncoder()
    {
        this(BinaryWireFormat.DEFAULT_MAX_FRAME_LENGTH);
    }

    public BinaryMessageEncoder(int maxFrameLength)
    {
        if (maxFrameLength < BinaryWireFormat.HEADER_LENGTH) {
            throw new IllegalArgumentException("maxFrameLength must be at least " + BinaryWireFormat.HEADER_LENGTH);
        }
        this.maxFrameLength = maxFrameLength;
    }

    @Override
    public byte[] encode(Message message)
    {
        Objects.requireNonNull(message, "message");

        final ByteBuffer text = encodeText(message.text());
        final int frameLength = BinaryWireFormat.HEADER_LENGTH + text.remaining();
        if (frameLength > maxFrameLength) {
            throw new MessageEncodeException(
                    "Frame of " + frameLength + " bytes exceeds limit of " + maxFrameLength);
        }

        ByteBuffer frame = ByteBuffer.allocate(frameLength).order(ByteOrder.LITTLE_ENDIAN);
        frame.putInt(message.category().tag());
        frame.putLong(text.remaining());
        frame.put(text);
        return frame.array();
    }

    private static ByteBuffer encodeText(String text)
    {
        // CharsetEncoder is stateful; one per call.
        CharsetEncoder utf8 = StandardCharsets.UTF_8.newEncoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        try {
            return utf8.encode(CharBuffer.wrap(text));
        }
        catch (CharacterCodingException e) {
            throw new MessageEncodeException("Message text is not valid UTF-16", e);
        }
    }
}
