package com.netctl.fib.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.regex.Pattern;

/**
 * A destination prefix: network address plus mask length.
 *
 * <p>
 * The address is canonicalised and host bits beyond {@code prefixLength} are
 * cleared, so {@code 10.1.2.3/24} and {@code 10.1.2.0/24} compare equal. This is
 * the hash key of the diff engine and of the programmed state, so
 * equality must be exact and cheap.
 *
 * <p>
 * JSON form is the string {@code "address/length"}.
 */
public record IpPrefix(String address, int prefixLength) implements Comparable<IpPrefix> {

    private static final Pattern IPV4_LITERAL = Pattern.compile("\\d{1,3}(\\.\\d{1,3}){3}");

    public IpPrefix {
        if (address == null || address.isBlank())
            throw new MalformedSnapshotException("prefix address is empty");
        byte[] raw = parseLiteral(address.trim());
        int maxLen = raw.length * 8;
        if (prefixLength < 0 || prefixLength > maxLen)
            throw new MalformedSnapshotException(
                    "prefix length " + prefixLength + " out of range 0.." + maxLen + " for " + address);
        mask(raw, prefixLength);
        address = toText(raw);
    }

    /**
     * Parses {@code "address/length"}. A bare address is a host route.
     */
    @JsonCreator
    public static IpPrefix parse(String text) {
        if (text == null)
            throw new MalformedSnapshotException("prefix is null");
        int slash = text.indexOf('/');
        if (slash < 0) {
            String addr = text.trim();
            return new IpPrefix(addr, addr.contains(":") ? 128 : 32);
        }
        String addr = text.substring(0, slash).trim();
        int len;
        try {
            len = Integer.parseInt(text.substring(slash + 1).trim());
        } catch (NumberFormatException e) {
            throw new MalformedSnapshotException("bad prefix length in '" + text + "'");
        }
        return new IpPrefix(addr, len);
    }

    public boolean isV6() {
        return address.indexOf(':') >= 0;
    }

    @JsonValue
    @Override
    public String toString() {
        return address + "/" + prefixLength;
    }

    @Override
    public int compareTo(IpPrefix o) {
        int byFamily = Boolean.compare(isV6(), o.isV6());
        if (byFamily != 0)
            return byFamily;
        int byAddr = address.compareTo(o.address);
        return byAddr != 0 ? byAddr : Integer.compare(prefixLength, o.prefixLength);
    }

    // Literal-only parsing: a hostname must never trigger a DNS lookup.
    private static byte[] parseLiteral(String addr) {
        boolean v4 = IPV4_LITERAL.matcher(addr).matches();
        if (!v4 && addr.indexOf(':') < 0)
            throw new MalformedSnapshotException("not an IP literal: " + addr);
        try {
            return InetAddress.getByName(addr).getAddress();
        } catch (UnknownHostException e) {
            throw new MalformedSnapshotException("not an IP literal: " + addr);
        }
    }

    private static void mask(byte[] raw, int len) {
        for (int i = 0; i < raw.length; i++) {
            int bitsInByte = Math.max(0, Math.min(8, len - i * 8));
            raw[i] &= (byte) (0xFF << (8 - bitsInByte));
        }
    }

    private static String toText(byte[] raw) {
        try {
            return InetAddress.getByAddress(raw).getHostAddress();
        } catch (UnknownHostException e) {
            // getByAddress only fails on an illegal length, which parseLiteral rules out
            throw new IllegalStateException(e);
        }
    }
}
