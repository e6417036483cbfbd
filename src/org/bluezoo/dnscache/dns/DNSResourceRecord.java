/*
 * DNSResourceRecord.java
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

package org.bluezoo.dnscache.dns;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.text.MessageFormat;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.ResourceBundle;

import org.bluezoo.dnscache.util.IPAddresses;

/**
 * A DNS resource record.
 *
 * <p>Resource records appear in the answer, authority, and additional
 * sections of DNS responses. The record data is kept in wire format;
 * {@link #toText()} renders it in zone-file presentation form, which is
 * the form handed back to callers of the lookup cache.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class DNSResourceRecord {

    static final ResourceBundle L10N = ResourceBundle.getBundle("org.bluezoo.dnscache.dns.L10N");

    private static final char[] HEX = "0123456789ABCDEF".toCharArray();

    private final String name;
    private final DNSType type;
    private final DNSClass dnsClass;
    private final int ttl;
    private final byte[] rdata;

    /**
     * Creates a new DNS resource record.
     *
     * @param name the domain name
     * @param type the record type
     * @param dnsClass the record class
     * @param ttl time to live in seconds
     * @param rdata the record data
     */
    public DNSResourceRecord(String name, DNSType type, DNSClass dnsClass, int ttl, byte[] rdata) {
        this.name = name;
        this.type = type;
        this.dnsClass = dnsClass;
        this.ttl = ttl;
        this.rdata = rdata.clone();
    }

    /**
     * Returns the owner name, without trailing dot.
     *
     * @return the domain name
     */
    public String getName() {
        return name;
    }

    /**
     * Returns the record type.
     *
     * @return the record type
     */
    public DNSType getType() {
        return type;
    }

    /**
     * Returns the record class.
     *
     * @return the record class
     */
    public DNSClass getDNSClass() {
        return dnsClass;
    }

    /**
     * Returns the time to live in seconds.
     *
     * @return the TTL
     */
    public int getTTL() {
        return ttl;
    }

    /**
     * Returns the raw record data.
     *
     * @return a copy of the record data
     */
    public byte[] getRData() {
        return rdata.clone();
    }

    // -- Convenience factory methods --

    /**
     * Creates an A record (IPv4 address).
     *
     * @param name the domain name
     * @param ttl time to live in seconds
     * @param address the IPv4 address
     * @return the resource record
     */
    public static DNSResourceRecord a(String name, int ttl, InetAddress address) {
        return new DNSResourceRecord(name, DNSType.A, DNSClass.IN, ttl, address.getAddress());
    }

    /**
     * Creates an AAAA record (IPv6 address).
     *
     * @param name the domain name
     * @param ttl time to live in seconds
     * @param address the IPv6 address
     * @return the resource record
     */
    public static DNSResourceRecord aaaa(String name, int ttl, InetAddress address) {
        return new DNSResourceRecord(name, DNSType.AAAA, DNSClass.IN, ttl, address.getAddress());
    }

    /**
     * Creates a CNAME record.
     *
     * @param name the domain name
     * @param ttl time to live in seconds
     * @param canonicalName the canonical name
     * @return the resource record
     */
    public static DNSResourceRecord cname(String name, int ttl, String canonicalName) {
        return new DNSResourceRecord(name, DNSType.CNAME, DNSClass.IN, ttl, DNSMessage.encodeName(canonicalName));
    }

    /**
     * Creates a PTR record.
     *
     * @param name the domain name (reverse lookup name)
     * @param ttl time to live in seconds
     * @param ptrName the target domain name
     * @return the resource record
     */
    public static DNSResourceRecord ptr(String name, int ttl, String ptrName) {
        return new DNSResourceRecord(name, DNSType.PTR, DNSClass.IN, ttl, DNSMessage.encodeName(ptrName));
    }

    /**
     * Creates an NS record.
     *
     * @param name the domain name
     * @param ttl time to live in seconds
     * @param nsName the name server hostname
     * @return the resource record
     */
    public static DNSResourceRecord ns(String name, int ttl, String nsName) {
        return new DNSResourceRecord(name, DNSType.NS, DNSClass.IN, ttl, DNSMessage.encodeName(nsName));
    }

    /**
     * Creates an MX record.
     *
     * @param name the domain name
     * @param ttl time to live in seconds
     * @param preference the preference value (lower = higher priority)
     * @param exchange the mail server hostname
     * @return the resource record
     */
    public static DNSResourceRecord mx(String name, int ttl, int preference, String exchange) {
        byte[] exchangeBytes = DNSMessage.encodeName(exchange);
        ByteBuffer buf = ByteBuffer.allocate(2 + exchangeBytes.length);
        buf.putShort((short) preference);
        buf.put(exchangeBytes);
        return new DNSResourceRecord(name, DNSType.MX, DNSClass.IN, ttl, buf.array());
    }

    /**
     * Creates a TXT record holding a single logical string, split into
     * 255-byte character-strings as required.
     *
     * @param name the domain name
     * @param ttl time to live in seconds
     * @param text the text content
     * @return the resource record
     */
    public static DNSResourceRecord txt(String name, int ttl, String text) {
        byte[] textBytes = text.getBytes(StandardCharsets.UTF_8);
        ByteBuffer buf = ByteBuffer.allocate(textBytes.length + (textBytes.length / 255) + 1);
        int offset = 0;
        while (offset < textBytes.length) {
            int len = Math.min(255, textBytes.length - offset);
            buf.put((byte) len);
            buf.put(textBytes, offset, len);
            offset += len;
        }
        byte[] rdataBytes = new byte[buf.position()];
        buf.flip();
        buf.get(rdataBytes);
        return new DNSResourceRecord(name, DNSType.TXT, DNSClass.IN, ttl, rdataBytes);
    }

    // -- RDATA interpretation methods --

    /**
     * Interprets the RDATA as an IP address (for A or AAAA records).
     *
     * @return the IP address
     * @throws IllegalStateException if this is not an A or AAAA record
     */
    public InetAddress getAddress() {
        if (type != DNSType.A && type != DNSType.AAAA) {
            String msg = MessageFormat.format(L10N.getString("err.not_address_record"), type);
            throw new IllegalStateException(msg);
        }
        int length = (type == DNSType.A) ? 4 : 16;
        if (rdata.length != length) {
            throw new IllegalStateException(L10N.getString("err.invalid_address_data"));
        }
        try {
            return IPAddresses.fromBytes(rdata);
        } catch (UnknownHostException e) {
            throw new IllegalStateException(L10N.getString("err.invalid_address_data"), e);
        }
    }

    /**
     * Interprets the RDATA as a domain name (for CNAME, PTR, NS records).
     *
     * @return the domain name, without trailing dot
     * @throws IllegalStateException if this is not a name-type record
     */
    public String getTargetName() {
        if (type != DNSType.CNAME && type != DNSType.PTR && type != DNSType.NS) {
            String msg = MessageFormat.format(L10N.getString("err.not_name_record"), type);
            throw new IllegalStateException(msg);
        }
        ByteBuffer buf = ByteBuffer.wrap(rdata);
        return DNSMessage.decodeName(buf, buf);
    }

    /**
     * Returns the character-strings of a TXT or SPF record.
     *
     * @return the strings in record order
     * @throws IllegalStateException if this is not a TXT record
     */
    public List<String> getStrings() {
        if (type != DNSType.TXT && type != DNSType.SPF) {
            String msg = MessageFormat.format(L10N.getString("err.not_txt_record"), type);
            throw new IllegalStateException(msg);
        }
        List<String> strings = new ArrayList<>();
        ByteBuffer buf = ByteBuffer.wrap(rdata);
        while (buf.hasRemaining()) {
            int len = buf.get() & 0xFF;
            byte[] segment = new byte[len];
            buf.get(segment);
            strings.add(new String(segment, StandardCharsets.UTF_8));
        }
        return strings;
    }

    /**
     * Interprets the RDATA as TXT record content, concatenating all
     * character-strings.
     *
     * @return the text content
     * @throws IllegalStateException if this is not a TXT record
     */
    public String getText() {
        StringBuilder sb = new StringBuilder();
        for (String s : getStrings()) {
            sb.append(s);
        }
        return sb.toString();
    }

    /**
     * Returns the MX preference (for MX records).
     *
     * @return the preference value
     * @throws IllegalStateException if this is not an MX record
     */
    public int getMXPreference() {
        if (type != DNSType.MX) {
            String msg = MessageFormat.format(L10N.getString("err.not_mx_record"), type);
            throw new IllegalStateException(msg);
        }
        return ((rdata[0] & 0xFF) << 8) | (rdata[1] & 0xFF);
    }

    /**
     * Returns the MX exchange hostname (for MX records).
     *
     * @return the mail server hostname
     * @throws IllegalStateException if this is not an MX record
     */
    public String getMXExchange() {
        if (type != DNSType.MX) {
            String msg = MessageFormat.format(L10N.getString("err.not_mx_record"), type);
            throw new IllegalStateException(msg);
        }
        ByteBuffer buf = ByteBuffer.wrap(rdata);
        buf.getShort(); // preference
        return DNSMessage.decodeName(buf, ByteBuffer.wrap(rdata));
    }

    // -- Presentation format --

    /**
     * Returns the record data in presentation (zone file) form.
     *
     * <p>Addresses are rendered as dotted quads or compressed IPv6 text,
     * domain names are absolute (with trailing dot), and TXT strings are
     * quoted. Types without a dedicated rendering use the generic
     * {@code \# length hex} form.
     *
     * @return the presentation form of the RDATA
     * @throws IllegalStateException if the RDATA is malformed
     */
    public String toText() {
        try {
            switch (type) {
                case A:
                case AAAA:
                    return IPAddresses.toText(getAddress());
                case CNAME:
                case PTR:
                case NS:
                    return absolute(getTargetName());
                case MX:
                    return getMXPreference() + " " + absolute(getMXExchange());
                case TXT:
                case SPF:
                    return quoteStrings(getStrings());
                case SOA:
                    return soaText();
                case SRV:
                    return srvText();
                default:
                    return genericText();
            }
        } catch (BufferUnderflowException | IndexOutOfBoundsException e) {
            String msg = MessageFormat.format(L10N.getString("err.invalid_rdata"), name, type);
            throw new IllegalStateException(msg, e);
        }
    }

    /**
     * Returns the given domain name in absolute form, with a trailing dot.
     * The root is rendered as a single dot.
     *
     * @param name a domain name
     * @return the absolute name
     */
    public static String absolute(String name) {
        if (name.isEmpty()) {
            return ".";
        }
        return name.endsWith(".") ? name : name + ".";
    }

    private String soaText() {
        ByteBuffer buf = ByteBuffer.wrap(rdata);
        ByteBuffer original = ByteBuffer.wrap(rdata);
        String mname = DNSMessage.decodeName(buf, original);
        String rname = DNSMessage.decodeName(buf, original);
        StringBuilder sb = new StringBuilder();
        sb.append(absolute(mname)).append(' ').append(absolute(rname));
        for (int i = 0; i < 5; i++) {
            sb.append(' ').append(buf.getInt() & 0xFFFFFFFFL);
        }
        return sb.toString();
    }

    private String srvText() {
        ByteBuffer buf = ByteBuffer.wrap(rdata);
        int priority = buf.getShort() & 0xFFFF;
        int weight = buf.getShort() & 0xFFFF;
        int port = buf.getShort() & 0xFFFF;
        String target = DNSMessage.decodeName(buf, ByteBuffer.wrap(rdata));
        return priority + " " + weight + " " + port + " " + absolute(target);
    }

    private String genericText() {
        StringBuilder sb = new StringBuilder("\\# ");
        sb.append(rdata.length);
        if (rdata.length > 0) {
            sb.append(' ');
            for (byte b : rdata) {
                sb.append(HEX[(b >> 4) & 0x0F]).append(HEX[b & 0x0F]);
            }
        }
        return sb.toString();
    }

    private static String quoteStrings(List<String> strings) {
        StringBuilder sb = new StringBuilder();
        for (String s : strings) {
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append('"');
            for (byte b : s.getBytes(StandardCharsets.UTF_8)) {
                int c = b & 0xFF;
                if (c == '"' || c == '\\') {
                    sb.append('\\').append((char) c);
                } else if (c < 0x20 || c >= 0x7F) {
                    sb.append('\\');
                    sb.append((char) ('0' + c / 100));
                    sb.append((char) ('0' + (c / 10) % 10));
                    sb.append((char) ('0' + c % 10));
                } else {
                    sb.append((char) c);
                }
            }
            sb.append('"');
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DNSResourceRecord)) {
            return false;
        }
        DNSResourceRecord that = (DNSResourceRecord) o;
        return ttl == that.ttl &&
               name.equalsIgnoreCase(that.name) &&
               type == that.type &&
               dnsClass == that.dnsClass &&
               Arrays.equals(rdata, that.rdata);
    }

    @Override
    public int hashCode() {
        int result = name.toLowerCase().hashCode();
        result = 31 * result + type.hashCode();
        result = 31 * result + dnsClass.hashCode();
        result = 31 * result + ttl;
        result = 31 * result + Arrays.hashCode(rdata);
        return result;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(name);
        sb.append(" ");
        sb.append(ttl);
        sb.append(" ");
        sb.append(dnsClass);
        sb.append(" ");
        sb.append(type);
        sb.append(" ");
        try {
            sb.append(toText());
        } catch (IllegalStateException e) {
            sb.append("[invalid]");
        }
        return sb.toString();
    }

}
