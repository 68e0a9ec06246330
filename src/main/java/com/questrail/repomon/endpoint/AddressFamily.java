package com.questrail.repomon.endpoint;

import java.net.Inet4Address;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.UnknownHostException;

/**
 * Address family of an {@link Endpoint}.
 */
public enum AddressFamily
{
    IPV4(new byte[4]),
    IPV6(new byte[16]);

    private final byte[] wildcard;

    AddressFamily(byte[] wildcard)
    {
        this.wildcard = wildcard;
    }

    public static AddressFamily of(InetAddress address)
    {
        return address instanceof Inet4Address ? IPV4 : IPV6;
    }

    /**
     * Unspecified address with an ephemeral port: {@code 0.0.0.0:0} or {@code [::]:0}.
     */
    public InetSocketAddress wildcardBindAddress()
    {
        try {
            return new InetSocketAddress(InetAddress.getByAddress(wildcard.clone()), 0);
        }
        catch (UnknownHostException e) {
            // getByAddress only fails on an illegal length.
            throw new IllegalStateException(e);
        }
    }
}
