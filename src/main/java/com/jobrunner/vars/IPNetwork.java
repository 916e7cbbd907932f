package com.jobrunner.vars;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.Arrays;
import java.util.regex.Pattern;

/**
 * An IPv4 or IPv6 address together with a prefix length, e.g. {@code 192.0.2.10/24}.
 *
 * <p>The address may have host bits set; {@link #isNetworkAddress()} tells whether it is
 * a proper prefix.</p>
 */
public final class IPNetwork {
    private static final Pattern IPV4 = Pattern.compile(
            "(25[0-5]|2[0-4]\\d|1\\d\\d|[1-9]?\\d)(\\.(25[0-5]|2[0-4]\\d|1\\d\\d|[1-9]?\\d)){3}");
    private static final Pattern IPV6 = Pattern.compile("[0-9a-fA-F:.]*:[0-9a-fA-F:.]*");

    private final InetAddress address;
    private final int prefixLength;

    public IPNetwork(InetAddress address, int prefixLength) {
        int maxLength = address.getAddress().length * 8;
        if (prefixLength < 0 || prefixLength > maxLength) {
            throw new IllegalArgumentException("Invalid prefix length " + prefixLength + " for " + address.getHostAddress());
        }
        this.address = address;
        this.prefixLength = prefixLength;
    }

    /**
     * Parse {@code address/length}.
     *
     * @throws IllegalArgumentException if the text is not an address with a prefix length
     */
    public static IPNetwork parse(String text) {
        int slash = text.indexOf('/');
        if (slash < 0) {
            throw new IllegalArgumentException("Missing prefix length: " + text);
        }
        InetAddress address = parseAddress(text.substring(0, slash));
        int prefixLength;
        try {
            prefixLength = Integer.parseInt(text.substring(slash + 1));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid prefix length: " + text, e);
        }
        return new IPNetwork(address, prefixLength);
    }

    /**
     * Parse an IP address literal. Host names are rejected, never resolved.
     *
     * @throws IllegalArgumentException if the text is not an IPv4 or IPv6 literal
     */
    public static InetAddress parseAddress(String text) {
        String literal = text.strip();
        if (!IPV4.matcher(literal).matches() && !IPV6.matcher(literal).matches()) {
            throw new IllegalArgumentException("Not an IP address: " + text);
        }
        try {
            return InetAddress.getByName(literal);
        } catch (UnknownHostException e) {
            throw new IllegalArgumentException("Not an IP address: " + text, e);
        }
    }

    public InetAddress getAddress() {
        return address;
    }

    public int getPrefixLength() {
        return prefixLength;
    }

    /**
     * The network this address belongs to, with all host bits cleared.
     */
    public IPNetwork getNetwork() {
        byte[] bytes = address.getAddress();
        for (int bit = prefixLength; bit < bytes.length * 8; bit++) {
            bytes[bit / 8] &= (byte) ~(0x80 >>> (bit % 8));
        }
        try {
            return new IPNetwork(InetAddress.getByAddress(bytes), prefixLength);
        } catch (UnknownHostException e) {
            throw new IllegalStateException(e);
        }
    }

    public boolean isNetworkAddress() {
        return equals(getNetwork());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof IPNetwork)) {
            return false;
        }
        IPNetwork other = (IPNetwork) o;
        return prefixLength == other.prefixLength
                && Arrays.equals(address.getAddress(), other.address.getAddress());
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(address.getAddress()) + prefixLength;
    }

    @Override
    public String toString() {
        return address.getHostAddress() + "/" + prefixLength;
    }
}
