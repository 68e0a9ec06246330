package com.questrail.repomon.codec.impl;

/**
 * BinaryWireFormat
 * -----------------------------------------------------------------------------
 * Layout of one message frame. All integers are little endian.
 *
 * <pre>
 *   offset 0   u32   category tag
 *   offset 4   u64   text length N, in bytes
 *   offset 12  N     UTF-8 text
 * </pre>
 *
 * <p>A frame carries no terminator and no outer length prefix. The transport
 * read that delivered it is its only boundary.</p>
 */
public final class BinaryWireFormat
{
    static final int TAG_LENGTH = 4;

    static final int TEXT_LENGTH_LENGTH = 8;

    /** Smallest valid frame: a message with empty text. */
    public static final int HEADER_LENGTH = TAG_LENGTH + TEXT_LENGTH_LENGTH;

    /** Largest payload of a single UDP datagram over IPv4. */
    public static final int DEFAULT_MAX_FRAME_LENGTH = 65_507;

    private BinaryWireFormat() {}
}
