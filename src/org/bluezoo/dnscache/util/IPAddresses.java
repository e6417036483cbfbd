/*
 * IPAddresses.java
 * Copyright (C) 2026 Chris Burdess
 *
 * This file is part of dnscache, a caching DNS lookup library.
 *
 * dnscache is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * dnscache is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Lesser General Public License for more details.
 *
 * You should have received a copy of the GNU Lesser General Public License
 * along with dnscache.  If not, see <http://www.gnu.org/licenses/>.
 */

package org.bluezoo.dnscache.util;

import java.net.Inet6Address;
import java.net.InetAddress;
import java.net.UnknownHostException;

/**
 * Parsing and formatting of textual IP addresses.
 *
 * <p>Parsing never performs a name lookup: strings that are not address
 * literals are rejected. Formatting produces the canonical text form
 * (dotted quad for IPv4, RFC 5952 compressed form for IPv6), so that
 * addresses obtained from different sources compare equal as strings.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class IPAddresses {

    private IPAddresses() {
    }

    /**
     * Parses an IPv4 or IPv6 address literal.
     *
     * @param text the candidate literal
     * @return the address, or null if the text is not an address literal
     */
    public static InetAddress parseLiteral(String text) {
        if (text == null || text.isEmpty()) {
            return null;
        }
        try {
            if (text.indexOf(':') >= 0) {
                return parseIPv6(text);
            }
            byte[] bytes = parseIPv4(text);
            return bytes == null ? null : InetAddress.getByAddress(bytes);
        } catch (UnknownHostException e) {
            return null;
        }
    }

    private static byte[] parseIPv4(String addr) {
        String[] parts = addr.split("\\.", -1);
        if (parts.length != 4) {
            return null;
        }
        byte[] bytes = new byte[4];
        for (int i = 0; i < 4; i++) {
            String part = parts[i];
            if (part.isEmpty() || part.length() > 3) {
                return null;
            }
            for (int j = 0; j < part.length(); j++) {
                char c = part.charAt(j);
                if (c < '0' || c > '9') {
                    return null;
                }
            }
            int val = Integer.parseInt(part);
            if (val > 255) {
                return null;
            }
            bytes[i] = (byte) val;
        }
        return bytes;
    }

    private static InetAddress parseIPv6(String addr) throws UnknownHostException {
        for (int i = 0; i < addr.length(); i++) {
            char c = addr.charAt(i);
            boolean hex = (c >= '0' && c <= '9') || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
            if (!hex && c != ':' && c != '.') {
                return null;
            }
        }
        // A string containing ':' is only ever treated as a literal by
        // InetAddress, so no lookup can happen here.
        InetAddress parsed = InetAddress.getByName(addr);
        byte[] bytes = parsed.getAddress();
        if (bytes.length == 4) {
            // InetAddress unwraps IPv4-mapped literals
            byte[] mapped = new byte[16];
            mapped[10] = (byte) 0xFF;
            mapped[11] = (byte) 0xFF;
            System.arraycopy(bytes, 0, mapped, 12, 4);
            bytes = mapped;
        }
        return fromBytes(bytes);
    }

    /**
     * Returns the address for raw address bytes. Sixteen bytes always
     * give an IPv6 address, including IPv4-mapped ones.
     *
     * @param bytes 4 or 16 address bytes
     * @return the address
     * @throws UnknownHostException if the length is neither 4 nor 16
     */
    public static InetAddress fromBytes(byte[] bytes) throws UnknownHostException {
        if (bytes.length == 16) {
            return Inet6Address.getByAddress(null, bytes, -1);
        }
        return InetAddress.getByAddress(bytes);
    }

    /**
     * Returns the canonical text form of an address. IPv6 addresses are
     * rendered in RFC 5952 form without any scope suffix.
     *
     * @param address the address
     * @return the address text
     */
    public static String toText(InetAddress address) {
        byte[] bytes = address.getAddress();
        if (bytes.length == 4) {
            return (bytes[0] & 0xFF) + "." + (bytes[1] & 0xFF) + "." + (bytes[2] & 0xFF) + "." + (bytes[3] & 0xFF);
        }
        int[] groups = new int[8];
        for (int i = 0; i < 8; i++) {
            groups[i] = ((bytes[2 * i] & 0xFF) << 8) | (bytes[2 * i + 1] & 0xFF);
        }
        // Longest run of two or more zero groups, leftmost on ties
        int bestStart = -1;
        int bestLength = 1;
        for (int i = 0; i < 8; ) {
            if (groups[i] != 0) {
                i++;
                continue;
            }
            int j = i;
            while (j < 8 && groups[j] == 0) {
                j++;
            }
            if (j - i > bestLength) {
                bestStart = i;
                bestLength = j - i;
            }
            i = j;
        }
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < 8; i++) {
            if (i == bestStart) {
                sb.append("::");
                i += bestLength - 1;
                continue;
            }
            if (sb.length() > 0 && sb.charAt(sb.length() - 1) != ':') {
                sb.append(':');
            }
            sb.append(Integer.toHexString(groups[i]));
        }
        return sb.toString();
    }

    /**
     * Returns the canonical text form of an address literal, or the text
     * unchanged if it is not a literal.
     *
     * @param text an address literal or other string
     * @return the normalized text
     */
    public static String normalize(String text) {
        InetAddress address = parseLiteral(text);
        return address == null ? text : toText(address);
    }

}
