package com.questrail.repomon.input;

import com.questrail.repomon.model.Message;

import java.nio.charset.StandardCharsets;

/**
 * Builds the message handed over for one non-empty console read.
 */
@FunctionalInterface
public interface InputMessageFactory
{
    /**
     * @param buffer read buffer; only the first {@code length} bytes are valid
     * @param length number of bytes read, always greater than zero
     */
    Message fromChunk(byte[] buffer, int length);

    static InputMessageFactory text()
    {
        // Chunks are cut at fixed sizes, so a multi-byte sequence split across
        // two reads decodes as replacement characters on both sides.
        return (buffer, length) -> Message.info(new String(buffer, 0, length, StandardCharsets.UTF_8));
    }

    static InputMessageFactory placeholder()
    {
        return (buffer, length) -> Message.placeholder();
    }

    static InputMessageFactory forMode(InputMode mode)
    {
        return switch (mode) {
            case TEXT -> text();
            case PLACEHOLDER -> placeholder();
        };
    }
}
