package com.questrail.repomon.input;

/**
 * How the input thread turns a console chunk into a message.
 */
public enum InputMode
{
    /** {@code INFO} message whose text is the chunk decoded as UTF-8. */
    TEXT,

    /**
     * {@link com.questrail.repomon.model.Message#placeholder()} for every chunk.
     * The chunk content is discarded; the peer only sees one pulse per read.
     */
    PLACEHOLDER
}
