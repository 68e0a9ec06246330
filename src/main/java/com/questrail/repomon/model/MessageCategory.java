package com.questrail.repomon.model;

/**
 * Category carried by every {@link Message}.
 *
 * <p>The ordinal of each constant is its wire tag. Constants must only ever be
 * appended, never reordered.</p>
 */
public enum MessageCategory
{
    INFO("Info"),
    AHEAD("Ahead"),
    BEHIND("Behind"),
    UP_TO_DATE("Up to date");

    private final String displayName;

    MessageCategory(String displayName)
    {
        this.displayName = displayName;
    }

    public String displayName()
    {
        return displayName;
    }

    public int tag()
    {
        return ordinal();
    }

    /**
     * Resolve a wire tag.
     *
     * @throws IllegalArgumentException if the tag is not assigned
     */
    public static MessageCategory fromTag(long tag)
    {
        MessageCategory[] all = values();
        if (tag < 0 || tag >= all.length) {
            throw new IllegalArgumentException("Unknown message category tag: " + tag);
        }
        return all[(int) tag];
    }
}
