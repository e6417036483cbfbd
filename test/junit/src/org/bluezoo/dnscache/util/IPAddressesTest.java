/*
 * IPAddressesTest.java
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

import org.junit.Test;

import java.net.Inet4Address;
import java.net.Inet6Address;
import java.net.InetAddress;

import static org.junit.Assert.*;

/**
 * Unit tests for {@link IPAddresses}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class IPAddressesTest {

    @Test
    public void testParseIPv4() {
        InetAddress address = IPAddresses.parseLiteral("192.0.2.1");

        assertTrue(address instanceof Inet4Address);
        assertEquals("192.0.2.1", address.getHostAddress());
    }

    @Test
    public void testParseIPv6() {
        InetAddress address = IPAddresses.parseLiteral("2001:DB8:0:0:0:0:0:1");

        assertTrue(address instanceof Inet6Address);
        assertEquals("2001:db8::1", IPAddresses.toText(address));
    }

    @Test
    public void testHostnamesAreNotLiterals() {
        assertNull(IPAddresses.parseLiteral("localhost"));
        assertNull(IPAddresses.parseLiteral("www.example.com"));
        assertNull(IPAddresses.parseLiteral("cafe.example"));
        assertNull(IPAddresses.parseLiteral(""));
        assertNull(IPAddresses.parseLiteral(null));
    }

    @Test
    public void testInvalidLiterals() {
        assertNull(IPAddresses.parseLiteral("256.1.1.1"));
        assertNull(IPAddresses.parseLiteral("1.2.3"));
        assertNull(IPAddresses.parseLiteral("1.2.3.4.5"));
        assertNull(IPAddresses.parseLiteral("1..3.4"));
        assertNull(IPAddresses.parseLiteral("1:2:3:4:5:6:7:8:9"));
        assertNull(IPAddresses.parseLiteral("fe80::1%eth0"));
    }

    @Test
    public void testNonASCIIDigitsRejected() {
        assertNull(IPAddresses.parseLiteral("\u0661\u0662\u0667.0.0.1"));
        assertNull(IPAddresses.parseLiteral("192.0.2.\uFF11"));
    }

    @Test
    public void testMappedLiteralStaysIPv6() {
        InetAddress address = IPAddresses.parseLiteral("::ffff:127.0.0.1");

        assertTrue(address instanceof Inet6Address);
        assertFalse(address.isLoopbackAddress());
        assertEquals("::ffff:7f00:1", IPAddresses.toText(address));
        assertEquals("::ffff:7f00:1", IPAddresses.normalize("::FFFF:7F00:1"));
    }

    @Test
    public void testToTextCompression() {
        assertEquals("::", toText("0:0:0:0:0:0:0:0"));
        assertEquals("::1", toText("0:0:0:0:0:0:0:1"));
        assertEquals("1::", toText("1:0:0:0:0:0:0:0"));
        assertEquals("2001:db8::1:0:0:1", toText("2001:db8:0:0:1:0:0:1"));
        assertEquals("2001:db8:0:1:1:1:1:1", toText("2001:db8:0:1:1:1:1:1"));
        assertEquals("2001:db8::2:1", toText("2001:0db8:0000:0000:0000:0000:0002:0001"));
        assertEquals("fec0::1", toText("FEC0::1"));
    }

    @Test
    public void testNormalize() {
        assertEquals("2001:db8::1", IPAddresses.normalize("2001:0db8::0001"));
        assertEquals("192.0.2.1", IPAddresses.normalize("192.0.2.1"));
        assertEquals("mail.example.com", IPAddresses.normalize("mail.example.com"));
    }

    private static String toText(String literal) {
        return IPAddresses.toText(IPAddresses.parseLiteral(literal));
    }

}
