package com.questrail.repomon.codec.impl;

import com.questrail.repomon.codec.MessageDecodeException;
import com.questrail.repomon.codec.MessageDecoder;
import com.questrail.repomon.model.Message;
import com.questrail.repomon.model.MessageCategory;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * BinaryMessageDecoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link MessageDecoder} for {@link BinaryWireFormat}.
 *
 * <p>The decoder performs the following steps, in order:</p>
 * <ol>
 *   <li>Empty buffer: no message</li>
 *   <li>Header length check</li>
 *   <li>Category tag lookup</li>
 *   <li>Declared text length must equal the remaining bytes exactly</li>
 *   <li>Strict UTF-8 decode of the text</li>
 * </ol>
 *
 * <p>Trailing bytes are a failure, not ignored: a buffer holding two frames
 * is malformed because one read is one frame.</p>
 */
public final class BinaryMessageDecoder implements MessageDecoder
{
    @Override
    public Optional<Message> decode(byte[] frame)
    {
        if (frame == null || frame.length == 0) {
            return Optional.empty();
        }

        if (frame.length < BinaryWireFormat.HEADER_LENGTH) {
            throw new MessageDecodeException(
                    "Frame of " + frame.length + " bytes is shorter than the "
                            + BinaryWireFormat.HEADER_LENGTH + "-byte header");
        }

        ByteBuffer in = ByteBuffer.wrap(frame).order(ByteOrder.LITTLE_ENDIAN);

        final long tag = Integer.toUnsignedLong(in.getInt());
        final MessageCategory category;
        try {
            category = MessageCategory.fromTag(tag);
        }
        catch (IllegalArgumentException e) {
            throw new MessageDecodeException(e.getMessage(), e);
        }

        final long declared = in.getLong();
        if (declared != in.remaining()) {
            // Negative values are lengths above Long.MAX_VALUE; never equal to remaining().
            throw new MessageDecodeException(
                    "Declared text length " + Long.toUnsignedString(declared)
                            + " does not match " + in.remaining() + " remaining bytes");
        }

        CharsetDecoder utf8 = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        try {
            String text = utf8.decode(in).toString();
            return Optional.of(new Message(category, text));
        }
        catch (CharacterCodingException e) {
            throw new MessageDecodeException("Message text is not valid UTF-8", e);
        }
    }
}
