/*
 * HostIdentityTest.java
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


package org.bluezoo.dnscache.host;

import okhttp3.OkHttpClient;
import org.bluezoo.dnscache.CombinedListCache;
import org.bluezoo.dnscache.CombinedListConfig;
import org.bluezoo.dnscache.FakeNameResolver;
import org.bluezoo.dnscache.SharedDNSCache;
import org.bluezoo.dnscache.dns.DNSResourceRecord;
import org.bluezoo.dnscache.dns.DNSType;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.net.UnknownHostException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.bluezoo.dnscache.FakeNameResolver.ip;
import static org.junit.Assert.*;

/**
 * Unit tests for {@link HostIdentity}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class HostIdentityTest {

    private static final String HOSTNAME = "mail.example.com";
    private static final Path CACHE = Paths.get("/var/cache/dnscache/local_ips");

    private FakeNameResolver resolver;
    private StubLocalAddresses local;
    private StubHostIdentity identity;

    @Before
    public void setUp() {
        resolver = new FakeNameResolver();
        SharedDNSCache.setDefault(new CombinedListCache(resolver, 1000L, CombinedListConfig.empty()));
        local = new StubLocalAddresses("192.0.2.10", "2001:db8::10");
        identity = new StubHostIdentity(new SharedDNSCache(1000L), local, HOSTNAME);

        resolver.answer("v4only.example.com", DNSType.A,
                DNSResourceRecord.a("v4only.example.com", 300, ip("192.0.2.2")));
        resolver.answer("dual.example.com", DNSType.A,
                DNSResourceRecord.a("dual.example.com", 300, ip("192.0.2.3")));
        resolver.answer("dual.example.com", DNSType.AAAA,
                DNSResourceRecord.aaaa("dual.example.com", 300, ip("2001:db8::1")));
        resolver.answer("v6.example.com", DNSType.AAAA,
                DNSResourceRecord.aaaa("v6.example.com", 300, ip("2001:db8::1")));
        resolver.answer("loop.example.com", DNSType.A,
                DNSResourceRecord.a("loop.example.com", 300, ip("127.0.0.1")));
        resolver.answer("alias.example.com", DNSType.A,
                DNSResourceRecord.cname("alias.example.com", 300, "v4only.example.com"),
                DNSResourceRecord.a("v4only.example.com", 300, ip("192.0.2.2")));
    }

    @After
    public void tearDown() {
        SharedDNSCache.setDefault(null);
    }

    @Test
    public void testIdentical() {
        assertTrue(identity.hostsEqual("anything.invalid", "anything.invalid", CACHE));
        assertTrue(resolver.queries.isEmpty());
    }

    @Test
    public void testLocalhostIsThisMachine() {
        assertTrue(identity.hostsEqual("localhost", HOSTNAME, CACHE, true, null));
        assertTrue(identity.hostsEqual("localhost", "192.0.2.10", CACHE, true, null));
    }

    @Test
    public void testLoopbackIsThisMachine() {
        assertTrue(identity.hostsEqual("127.0.0.1", HOSTNAME, CACHE, true, null));
        assertTrue(identity.hostsEqual("::1", "2001:db8::10", CACHE, true, null));
        assertTrue(identity.hostsEqual("127.0.0.1", "::1", CACHE, true, null));
    }

    @Test
    public void testLoopbackLiteralIsNotItsOwnAddress() {
        assertFalse(identity.hostsEqual("127.0.0.1", "loop.example.com", CACHE, true, null));
    }

    @Test
    public void testLoopbackLiteralMatchesLocalLoopback() {
        local.addresses = Arrays.asList("127.0.0.1", "192.0.2.10");
        assertTrue(identity.hostsEqual("127.0.0.1", "loop.example.com", CACHE, true, null));
    }

    @Test
    public void testSiteLocalIsThisMachine() {
        assertTrue(identity.hostsEqual("fec0::1", HOSTNAME, CACHE, true, null));
    }

    @Test
    public void testPrivateIPv4IsNotSubstituted() {
        assertFalse(identity.hostsEqual("10.0.0.1", HOSTNAME, CACHE, true, null));

        local.addresses = Arrays.asList("10.0.0.1", "192.0.2.10");
        assertTrue(identity.hostsEqual("10.0.0.1", HOSTNAME, CACHE, true, null));
    }

    @Test
    public void testSharedAddress() {
        assertTrue(identity.hostsEqual("alias.example.com", "v4only.example.com", CACHE, true, null));
        assertTrue(identity.hostsEqual("v4only.example.com", "192.0.2.2", CACHE, true, null));
        assertFalse(identity.hostsEqual("v4only.example.com", "dual.example.com", CACHE, true, null));
    }

    @Test
    public void testAAAAOnlyComparedWhenFirstHostHasAny() {
        assertTrue(identity.hostsEqual("dual.example.com", "v6.example.com", CACHE, true, null));
        assertEquals(1, resolver.count("v6.example.com", DNSType.AAAA));

        resolver.answer("other6.example.com", DNSType.AAAA,
                DNSResourceRecord.aaaa("other6.example.com", 300, ip("2001:db8::2")));
        assertFalse(identity.hostsEqual("v4only.example.com", "other6.example.com", CACHE, true, null));
        assertEquals(1, resolver.count("v4only.example.com", DNSType.AAAA));
        assertEquals(0, resolver.count("other6.example.com", DNSType.AAAA));
        assertEquals(1, resolver.count("other6.example.com", DNSType.A));
    }

    @Test
    public void testIPv6LiteralNormalized() {
        assertTrue(identity.hostsEqual("v6.example.com", "2001:0DB8:0:0::0001", CACHE, true, null));
    }

    @Test
    public void testLocalAddressesRequestedForThisMachine() {
        identity.hostsEqual(HOSTNAME, "v4only.example.com", CACHE, true, "https://ip.example.net/");

        assertEquals(Collections.singletonList(CACHE), local.cacheFiles);
        assertEquals(Collections.singletonList("https://ip.example.net/"), local.externalLinks);
        assertEquals(Collections.singletonList(Boolean.TRUE), local.useCached);
    }

    @Test
    public void testLocalAddressesNotRequestedForOtherHosts() {
        identity.hostsEqual("dual.example.com", "v4only.example.com", CACHE, true, null);

        assertTrue(local.cacheFiles.isEmpty());
    }

    @Test
    public void testFallback() {
        identity.resolved.put("a.example.org", "198.51.100.7");
        identity.resolved.put("b.example.org", "198.51.100.7");
        identity.resolved.put("c.example.org", "198.51.100.8");

        assertTrue(identity.hostsEqual("a.example.org", "b.example.org", CACHE));
        assertFalse(identity.hostsEqual("a.example.org", "c.example.org", CACHE));
        assertTrue(identity.hostsEqual("198.51.100.8", "c.example.org", CACHE));
        assertFalse(identity.hostsEqual("a.example.org", "unknown.example.org", CACHE));
        assertFalse(identity.hostsEqual("a.example.org", "b.example.org", CACHE, true, null));
    }

    @Test
    public void testFallbackWithoutAddress() {
        identity.resolved.put("a.example.org", null);
        identity.resolved.put("b.example.org", null);

        assertFalse(identity.hostsEqual("a.example.org", "b.example.org", CACHE));
    }

    @Test
    public void testDefaultConstructor() {
        HostIdentity defaults = new HostIdentity();

        assertNotNull(defaults.getHostname());
        assertFalse(defaults.getHostname().isEmpty());
        assertEquals(HostIdentity.localHostname(), defaults.getHostname());
    }

    @Test
    public void testMappedLoopbackIsNotThisMachine() {
        assertFalse(identity.hostsEqual("::ffff:127.0.0.1", HOSTNAME, CACHE, true, null));
        assertEquals(1, local.cacheFiles.size());
    }

    @Test
    public void testNameToIP() throws UnknownHostException {
        assertEquals("192.0.2.1", HostIdentity.nameToIP("192.0.2.1", true));
        assertEquals("2001:db8::1", HostIdentity.nameToIP("2001:0db8::1", false));
    }

    /**
     * Records requests for local addresses and returns a fixed list.
     */
    static class StubLocalAddresses extends LocalAddresses {

        List<String> addresses;
        final List<Path> cacheFiles = new ArrayList<>();
        final List<String> externalLinks = new ArrayList<>();
        final List<Boolean> useCached = new ArrayList<>();

        StubLocalAddresses(String... addresses) {
            super(new OkHttpClient(), null);
            this.addresses = Arrays.asList(addresses);
        }

        @Override
        public List<String> getAddresses(Path cacheFile, String externalLink, boolean useCached) {
            cacheFiles.add(cacheFile);
            externalLinks.add(externalLink);
            this.useCached.add(useCached);
            return new ArrayList<>(addresses);
        }

    }

    /**
     * Resolves names from a map instead of the operating system.
     */
    static class StubHostIdentity extends HostIdentity {

        final Map<String, String> resolved = new HashMap<>();

        StubHostIdentity(SharedDNSCache dns, LocalAddresses localAddresses, String hostname) {
            super(dns, localAddresses, hostname);
        }

        @Override
        protected String resolve(String name) throws UnknownHostException {
            if (!resolved.containsKey(name)) {
                throw new UnknownHostException(name);
            }
            return resolved.get(name);
        }

    }

}
