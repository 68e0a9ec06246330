package com.questrail.repomon.endpoint;

import com.questrail.repomon.error.BridgeErrorKind;
import com.questrail.repomon.error.BridgeException;

import java.net.Inet4Address;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.net.UnknownHostException;
import java.util.Objects;

/**
 * Endpoint
 * -----------------------------------------------------------------------------
 * The single remote peer of a bridge session: a literal IP address, a port,
 * and the address family derived from the address.
 *
 * <p>Parsing accepts only literal addresses, {@code a.b.c.d:port} or
 * {@code [v6]:port}. Host names are rejected so that parsing never performs a
 * DNS lookup. IPv4-mapped IPv6 literals such as {@code [::ffff:1.2.3.4]:80}
 * are rejected, since the JDK would turn them into plain IPv4 addresses.</p>
 *
 * <p>For datagram sessions the endpoint is also the peer identity: inbound
 * datagrams are accepted only when {@link #matches(SocketAddress)}.</p>
 */
public record Endpoint(InetSocketAddress address, AddressFamily family)
{
    public static final String DEFAULT = "127.0.0.1:8080";

    public Endpoint
    {
        Objects.requireNonNull(address, "address");
        Objects.requireNonNull(family, "family");
        if (address.isUnresolved()) {
            throw new IllegalArgumentException("Endpoint address must be resolved: " + address);
        }
        if (AddressFamily.of(address.getAddress()) != family) {
            throw new IllegalArgumentException("Address " + address + " is not " + family);
        }
    }

    public static Endpoint of(InetSocketAddress address)
    {
        Objects.requireNonNull(address, "address");
        if (address.isUnresolved()) {
            throw new IllegalArgumentException("Endpoint address must be resolved: " + address);
        }
        return new Endpoint(address, AddressFamily.of(address.getAddress()));
    }

    public static Endpoint defaultEndpoint()
    {
        return parse(DEFAULT);
    }

    /**
     * Parse {@code ip:port}.
     *
     * @throws BridgeException of kind {@link BridgeErrorKind#ADDRESS_RESOLUTION}
     *                         if the string is not a literal socket address
     */
    public static Endpoint parse(String text)
    {
        if (text == null || text.isBlank()) {
            throw invalid(text, "empty address");
        }
        final String trimmed = text.trim();

        final String host;
        final String port;
        if (trimmed.startsWith("[")) {
            int close = trimmed.indexOf("]:");
            if (close < 0) {
                throw invalid(text, "expected [ipv6]:port");
            }
            host = trimmed.substring(1, close);
            port = trimmed.substring(close + 2);
            if (!isIpv6Literal(host)) {
                throw invalid(text, "not an IPv6 literal");
            }
        }
        else {
            int colon = trimmed.lastIndexOf(':');
            if (colon < 0) {
                throw invalid(text, "missing port");
            }
            host = trimmed.substring(0, colon);
            port = trimmed.substring(colon + 1);
            if (parseIpv4(host) == null) {
                throw invalid(text, "not an IPv4 literal");
            }
        }

        final int portNumber = parsePort(text, port);
        final InetAddress address;
        try {
            byte[] v4 = parseIpv4(host);
            // Literal forms only; neither branch consults a resolver.
            address = v4 != null ? InetAddress.getByAddress(v4) : InetAddress.getByName(host);
        }
        catch (UnknownHostException e) {
            throw new BridgeException(BridgeErrorKind.ADDRESS_RESOLUTION,
                    "Invalid address '" + text + "': " + e.getMessage(), e);
        }
        if (trimmed.startsWith("[") && address instanceof Inet4Address) {
            throw invalid(text, "IPv4-mapped IPv6 literal not supported");
        }

        return of(new InetSocketAddress(address, portNumber));
    }

    /**
     * True if {@code sender} is this endpoint (same address and port).
     */
    public boolean matches(SocketAddress sender)
    {
        return address.equals(sender);
    }

    @Override
    public String toString()
    {
        String host = address.getAddress().getHostAddress();
        return family == AddressFamily.IPV6
                ? "[" + host + "]:" + address.getPort()
                : host + ":" + address.getPort();
    }

    private static int parsePort(String text, String port)
    {
        if (port.isEmpty() || port.length() > 5 || !port.chars().allMatch(Character::isDigit)) {
            throw invalid(text, "invalid port '" + port + "'");
        }
        int value = Integer.parseInt(port);
        if (value > 65_535) {
            throw invalid(text, "port out of range");
        }
        return value;
    }

    private static byte[] parseIpv4(String host)
    {
        String[] parts = host.split("\\.", -1);
        if (parts.length != 4) {
            return null;
        }
        byte[] bytes = new byte[4];
        for (int i = 0; i < 4; i++) {
            String part = parts[i];
            if (part.isEmpty() || part.length() > 3 || !part.chars().allMatch(Character::isDigit)) {
                return null;
            }
            // Leading zeros are rejected.
            if (part.length() > 1 && part.charAt(0) == '0') {
                return null;
            }
            int octet = Integer.parseInt(part);
            if (octet > 255) {
                return null;
            }
            bytes[i] = (byte) octet;
        }
        return bytes;
    }

    private static boolean isIpv6Literal(String host)
    {
        if (host.isEmpty() || host.indexOf(':') < 0) {
            return false;
        }
        for (int i = 0; i < host.length(); i++) {
            char c = host.charAt(i);
            boolean ok = c == ':' || c == '.' || Character.digit(c, 16) >= 0;
            if (!ok) {
                return false;
            }
        }
        return true;
    }

    private static BridgeException invalid(String text, String reason)
    {
        return new BridgeException(BridgeErrorKind.ADDRESS_RESOLUTION,
                "Invalid address '" + text + "': " + reason);
    }
}
