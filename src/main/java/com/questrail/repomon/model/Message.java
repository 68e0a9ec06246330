package com.questrail.repomon.model;

import java.util.Objects;

/**
 * Message
 * -----------------------------------------------------------------------------
 * Application-level unit relayed by the bridge.
 *
 * <p>The bridge never inspects a message beyond passing it through: the input
 * side creates one per console chunk, the transports encode and decode it, and
 * the forwarding driver prints its {@link #displayForm()}.</p>
 *
 * <p>Instances are immutable and are consumed exactly once, either by the
 * outbound encode step or by the output sink.</p>
 */
public record Message(MessageCategory category, String text)
{
    private static final Message PLACEHOLDER = new Message(MessageCategory.INFO, "");

    public Message
    {
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(text, "text");
    }

    /**
     * The default message: {@code INFO} with empty text.
     */
    public static Message placeholder()
    {
        return PLACEHOLDER;
    }

    public static Message info(String text)
    {
        return new Message(MessageCategory.INFO, text);
    }

    /**
     * Human-readable form written to the console, e.g. {@code "Behind: 3 commits"}.
     */
    public String displayForm()
    {
        return category.displayName() + ": " + text;
    }
}
