/*
 * HostIdentity.java
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

import java.net.Inet4Address;
import java.net.Inet6Address;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.file.Path;
import java.text.MessageFormat;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.bluezoo.dnscache.SharedDNSCache;
import org.bluezoo.dnscache.dns.DNSClass;
import org.bluezoo.dnscache.dns.DNSType;
import org.bluezoo.dnscache.util.IPAddresses;

/**
 * Decides whether two host identifiers name the same machine.
 *
 * <p>Host identifiers are hostnames or IP address literals. Loopback and
 * IPv6 site-local literals, and the name {@code localhost}, are taken to
 * mean this machine and are replaced by its hostname. Each side is then
 * expanded to a set of addresses: its A records (and AAAA records, when
 * the first host has any), the literal itself, and, for this machine, the
 * addresses reported by {@link LocalAddresses}. Hosts whose sets intersect
 * are equal. Otherwise the operating system resolver is consulted as a
 * last resort.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class HostIdentity {

    private static final Logger LOGGER = Logger.getLogger(HostIdentity.class.getName());

    private static final String LOCALHOST = "localhost";

    private final SharedDNSCache dns;
    private final LocalAddresses localAddresses;
    private final String hostname;

    /**
     * Creates a reconciler using the shared DNS cache and this machine's
     * hostname.
     */
    public HostIdentity() {
        this(new SharedDNSCache(), new LocalAddresses(), localHostname());
    }

    /**
     * Creates a reconciler.
     *
     * @param dns the DNS cache handle used for A and AAAA lookups
     * @param localAddresses the local address enumerator
     * @param hostname the hostname of this machine
     */
    public HostIdentity(SharedDNSCache dns, LocalAddresses localAddresses, String hostname) {
        this.dns = dns;
        this.localAddresses = localAddresses;
        this.hostname = hostname;
    }

    public String getHostname() {
        return hostname;
    }

    /**
     * Returns the hostname of this machine, or {@code localhost} if it
     * cannot be resolved.
     */
    static String localHostname() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            if (LOGGER.isLoggable(Level.FINE)) {
                LOGGER.fine(MessageFormat.format(LocalAddresses.L10N.getString("debug.no_hostname"), e.getMessage()));
            }
            return LOCALHOST;
        }
    }

    /**
     * Returns true if the two hosts are the same physical machine.
     *
     * @param host1 a hostname or IP address
     * @param host2 a hostname or IP address
     * @param cacheFile the local address cache file
     * @return true if the hosts are equal
     */
    public boolean hostsEqual(String host1, String host2, Path cacheFile) {
        return hostsEqual(host1, host2, cacheFile, false, null);
    }

    /**
     * Returns true if the two hosts are the same physical machine.
     *
     * @param host1 a hostname or IP address
     * @param host2 a hostname or IP address
     * @param cacheFile the local address cache file
     * @param skipFallback if true, do not consult the operating system
     *        resolver when the address sets are disjoint
     * @param externalLink URL of an endpoint returning this machine's
     *        external address, or null
     * @return true if the hosts are equal
     */
    public boolean hostsEqual(String host1, String host2, Path cacheFile, boolean skipFallback,
                              String externalLink) {
        if (host1.equals(host2)) {
            return true;
        }
        Host first = new Host(host1);
        Host second = new Host(host2);

        List<String> addresses1 = new ArrayList<>();
        boolean firstHasIPv6 = false;
        if (!first.literal) {
            addresses1.addAll(dns.lookup(first.name, DNSType.A, DNSClass.IN, true));
            List<String> aaaa = dns.lookup(first.name, DNSType.AAAA, DNSClass.IN, true);
            if (!aaaa.isEmpty()) {
                addresses1.addAll(aaaa);
                firstHasIPv6 = true;
            }
        } else {
            addresses1.add(first.addressText);
        }
        if (first.name.equals(hostname)) {
            addresses1.addAll(localAddresses.getAddresses(cacheFile, externalLink, true));
        }

        List<String> addresses2 = new ArrayList<>();
        if (!second.literal) {
            addresses2.addAll(dns.lookup(second.name, DNSType.A, DNSClass.IN, true));
            if (firstHasIPv6) {
                addresses2.addAll(dns.lookup(second.name, DNSType.AAAA, DNSClass.IN, true));
            }
        } else {
            addresses2.add(second.addressText);
        }
        if (second.name.equals(hostname)) {
            addresses2.addAll(localAddresses.getAddresses(cacheFile, externalLink, true));
        }

        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine(MessageFormat.format(LocalAddresses.L10N.getString("debug.hosts_equal_addresses"),
                    first.name, addresses1, second.name, addresses2));
        }
        Set<String> intersection = new HashSet<>(addresses1);
        intersection.retainAll(addresses2);
        if (!intersection.isEmpty()) {
            return true;
        }
        if (skipFallback) {
            return false;
        }
        try {
            String ip1 = first.literal ? first.name : resolve(first.name);
            String ip2 = second.literal ? second.name : resolve(second.name);
            return ip1 != null && ip1.equals(ip2);
        } catch (UnknownHostException | SecurityException e) {
            if (LOGGER.isLoggable(Level.FINE)) {
                LOGGER.fine(MessageFormat.format(LocalAddresses.L10N.getString("debug.fallback_failed"),
                        host1 + ", " + host2, e));
            }
            return false;
        }
    }

    /**
     * Resolves a hostname through the operating system resolver for the
     * fallback comparison.
     *
     * @param name the hostname
     * @return the address text, preferring IPv6
     * @throws UnknownHostException if the name cannot be resolved
     */
    protected String resolve(String name) throws UnknownHostException {
        return nameToIP(name, true);
    }

    /**
     * Resolves a hostname through the operating system resolver.
     *
     * @param name the hostname
     * @param preferIPv6 if true, the first IPv6 address is returned when
     *        there is one
     * @return the last IPv4 address, or an IPv6 address if preferred or if
     *         there is no IPv4 address, or null if there are neither
     * @throws UnknownHostException if the name cannot be resolved
     */
    public static String nameToIP(String name, boolean preferIPv6) throws UnknownHostException {
        String ipv4 = null;
        String ipv6 = null;
        for (InetAddress address : InetAddress.getAllByName(name)) {
            if (address instanceof Inet6Address) {
                ipv6 = IPAddresses.toText(address);
                if (preferIPv6) {
                    return ipv6;
                }
            } else if (address instanceof Inet4Address) {
                ipv4 = IPAddresses.toText(address);
            }
        }
        return ipv4 != null ? ipv4 : ipv6;
    }

    /**
     * One side of the comparison, after local-name substitution.
     */
    private final class Host {

        final String name;
        final boolean literal;
        final String addressText;

        Host(String host) {
            InetAddress address = IPAddresses.parseLiteral(host);
            if (address == null) {
                name = LOCALHOST.equals(host) ? hostname : host;
                literal = false;
                addressText = null;
            } else if (address.isLoopbackAddress() || isSiteLocalIPv6(address)) {
                name = hostname;
                literal = false;
                addressText = null;
            } else {
                name = host;
                literal = true;
                addressText = IPAddresses.toText(address);
            }
        }

    }

    /**
     * IPv6 site-local addresses ({@code fec0::/10}). IPv4 private ranges
     * are not site-local in this sense.
     */
    private static boolean isSiteLocalIPv6(InetAddress address) {
        return address instanceof Inet6Address && address.isSiteLocalAddress();
    }

}
