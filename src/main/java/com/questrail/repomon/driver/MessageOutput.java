package com.questrail.repomon.driver;

import com.questrail.repomon.model.Message;

import java.io.IOException;

/**
 * Local sink for inbound messages.
 */
@FunctionalInterface
public interface MessageOutput
{
    /**
     * Write one message and flush it.
     */
    void write(Message message) throws IOException;
}
