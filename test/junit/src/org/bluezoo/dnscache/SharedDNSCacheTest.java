/*
 * SharedDNSCacheTest.java
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

package org.bluezoo.dnscache;

import org.bluezoo.dnscache.dns.DNSClass;
import org.bluezoo.dnscache.dns.DNSResourceRecord;
import org.bluezoo.dnscache.dns.DNSType;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.bluezoo.dnscache.FakeNameResolver.ip;
import static org.junit.Assert.*;

/**
 * Unit tests for {@link SharedDNSCache}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class SharedDNSCacheTest {

    private FakeNameResolver resolver;
    private CombinedListCache shared;

    @Before
    public void setUp() {
        resolver = new FakeNameResolver();
        shared = new CombinedListCache(resolver, 1000L, CombinedListConfig.empty());
        SharedDNSCache.setDefault(shared);
    }

    @After
    public void tearDown() {
        SharedDNSCache.setDefault(null);
        System.clearProperty(SharedDNSCache.TIMEOUT_PROPERTY);
    }

    @Test
    public void testHandlesShareOneCache() {
        resolver.answer("www.example.com", DNSType.A,
                DNSResourceRecord.a("www.example.com", 300, ip("192.0.2.1")));

        SharedDNSCache fast = new SharedDNSCache(2500L);
        SharedDNSCache slow = new SharedDNSCache(7000L);

        assertEquals(Collections.singletonList("192.0.2.1"), fast.lookup("www.example.com"));
        assertEquals(Collections.singletonList("192.0.2.1"), slow.lookup("www.example.com"));
        assertEquals(1, resolver.queries.size());
        assertSame(shared, SharedDNSCache.getDefault());
    }

    @Test
    public void testEachHandleUsesItsOwnTimeout() {
        SharedDNSCache fast = new SharedDNSCache(2500L);
        SharedDNSCache slow = new SharedDNSCache(7000L);

        fast.lookup("a.example.com");
        slow.lookup("b.example.com", DNSType.MX);
        fast.lookup("c.example.com", DNSType.AAAA, DNSClass.IN, true);
        slow.getNS("example.com");

        assertEquals(Arrays.asList(2500L, 7000L, 2500L, 7000L), resolver.lifetimes);
        assertEquals(DNSType.MX, resolver.queries.get(1).getType());
        assertEquals(DNSType.NS, resolver.queries.get(3).getType());
    }

    @Test
    public void testGetConfig() {
        assertSame(CombinedListConfig.empty(), new SharedDNSCache(1000L).getConfig());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNonPositiveTimeout() {
        new SharedDNSCache(0L);
    }

    @Test
    public void testDefaultTimeout() {
        assertEquals(DNSCache.DEFAULT_LIFETIME_MS, SharedDNSCache.defaultTimeout());
        assertEquals(DNSCache.DEFAULT_LIFETIME_MS, new SharedDNSCache().getTimeout());

        System.setProperty(SharedDNSCache.TIMEOUT_PROPERTY, "3");
        assertEquals(3000L, SharedDNSCache.defaultTimeout());
        assertEquals(3000L, new SharedDNSCache().getTimeout());

        System.setProperty(SharedDNSCache.TIMEOUT_PROPERTY, "soon");
        assertEquals(DNSCache.DEFAULT_LIFETIME_MS, SharedDNSCache.defaultTimeout());

        System.setProperty(SharedDNSCache.TIMEOUT_PROPERTY, "-1");
        assertEquals(DNSCache.DEFAULT_LIFETIME_MS, SharedDNSCache.defaultTimeout());
    }

}
