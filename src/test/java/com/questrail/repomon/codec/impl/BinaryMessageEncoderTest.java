package com.questrail.repomon.codec.impl;

import com.questrail.repomon.codec.MessageEncodeException;
import com.questrail.repomon.model.Message;
import com.questrail.repomon.model.MessageCategory;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

/**
 * BinaryMessageEncoderTest
 * -----------------------------------------------------------------------------
 * Byte-level checks of the wire layout: little-endian u32 tag, little-endian
 * u64 text length, UTF-8 text.
 */
final class BinaryMessageEncoderTest
{
    private final BinaryMessageEncoder encoder = new BinaryMessageEncoder();

    @Test
    void encodesHeaderThenText()
    {
        byte[] frame = encoder.encode(new Message(MessageCategory.BEHIND, "3 commits"));

        assertEquals(12 + 9, frame.length);
        assertArrayEquals(new byte[] { 2, 0, 0, 0 }, slice(frame, 0, 4));
        assertArrayEquals(new byte[] { 9, 0, 0, 0, 0, 0, 0, 0 }, slice(frame, 4, 12));
        assertEquals("3 commits", new String(frame, 12, 9, StandardCharsets.UTF_8));
    }

    @Test
    void placeholderIsTwelveZeroBytes()
    {
        assertArrayEquals(new byte[12], encoder.encode(Message.placeholder()));
    }

    @Test
    void lengthCountsUtf8BytesNotChars()
    {
        byte[] frame = encoder.encode(new Message(MessageCategory.UP_TO_DATE, "été"));

        assertEquals(3, frame[0]);
        assertEquals(5, frame[4]);
        assertEquals(12 + 5, frame.length);
    }

    @Test
    void unpairedSurrogateFails()
    {
        assertThrows(MessageEncodeException.class, () -> encoder.encode(Message.info("bad \uD800 text")));
    }

    @Test
    void frameOverLimitFails()
    {
        BinaryMessageEncoder small = new BinaryMessageEncoder(16);

        assertEquals(16, small.encode(Message.info("four")).length);
        MessageEncodeException e = assertThrows(MessageEncodeException.class,
                () -> small.encode(Message.info("hello")));
        assertTrue(e.getMessage().contains("17"));
    }

    @Test
    void limitBelowHeaderIsRejected()
    {
        assertThrows(IllegalArgumentException.class, () -> new BinaryMessageEncoder(11));
    }

    private static byte[] slice(byte[] bytes, int from, int to)
    {
        byte[] out = new byte[to - from];
        System.arraycopy(bytes, from, out, 0, out.length);
        return out;
    }
}
