package com.questrail.repomon.error;

/**
 * Classification of terminal bridge failures.
 */
public enum BridgeErrorKind
{
    /** Remote endpoint string is malformed or not a literal IP address and port. */
    ADDRESS_RESOLUTION,

    /** Stream transport could not establish its connection. */
    CONNECTION,

    /** Datagram transport could not bind its local socket. */
    BIND,

    /** Reading from the network failed. */
    READ,

    /** Writing a frame to the network failed. */
    WRITE,

    /** Writing a message to the local output sink failed. */
    OUTPUT;

    public boolean isIoFailure()
    {
        return this == BIND || this == READ || this == WRITE || this == OUTPUT;
    }
}
