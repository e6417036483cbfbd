/*
 * SharedDNSCache.java
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

import java.text.MessageFormat;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.bluezoo.dnscache.dns.DNSClass;
import org.bluezoo.dnscache.dns.DNSType;
import org.bluezoo.dnscache.dns.client.UDPNameResolver;

/**
 * Handle on the process-wide combined list cache.
 *
 * <p>All handles share one {@link CombinedListCache}, so that every part
 * of a process benefits from lookups made by the others. Each handle
 * carries its own query timeout, which is passed to the shared cache on
 * every call; handles with different timeouts may be used concurrently.
 *
 * <p>The shared cache is built on first use from the system nameservers
 * and the combined list configuration file. Applications may install
 * their own with {@link #setDefault}.
 *
 * <pre><code>
 * SharedDNSCache dns = new SharedDNSCache(5000L);
 * List&lt;String&gt; mx = dns.lookup("example.com", DNSType.MX);
 * </code></pre>
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class SharedDNSCache {

    private static final Logger LOGGER = Logger.getLogger(SharedDNSCache.class.getName());

    /** System property giving the default timeout, in seconds. */
    public static final String TIMEOUT_PROPERTY = "dnscache.timeout";

    private static CombinedListCache defaultCache;

    private final long timeoutMs;

    /**
     * Creates a handle using the default timeout.
     */
    public SharedDNSCache() {
        this(defaultTimeout());
    }

    /**
     * Creates a handle.
     *
     * @param timeoutMs the overall query lifetime for this handle's
     *        lookups, in milliseconds
     */
    public SharedDNSCache(long timeoutMs) {
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("timeout must be positive: " + timeoutMs);
        }
        this.timeoutMs = timeoutMs;
    }

    /**
     * Returns the shared cache, creating it if necessary.
     *
     * @return the process-wide cache
     */
    public static synchronized CombinedListCache getDefault() {
        if (defaultCache == null) {
            UDPNameResolver resolver = new UDPNameResolver();
            resolver.useSystemResolvers();
            CombinedListConfig config = CombinedListConfig.load();
            defaultCache = new CombinedListCache(resolver, defaultTimeout(), config);
            if (LOGGER.isLoggable(Level.FINE)) {
                LOGGER.fine(MessageFormat.format(DNSCache.L10N.getString("debug.shared_cache_created"),
                        resolver.getServers(), config));
            }
        }
        return defaultCache;
    }

    /**
     * Replaces the shared cache.
     * Passing null causes a new cache to be created on next use.
     *
     * @param cache the new process-wide cache
     */
    public static synchronized void setDefault(CombinedListCache cache) {
        defaultCache = cache;
    }

    static long defaultTimeout() {
        String value = System.getProperty(TIMEOUT_PROPERTY);
        if (value == null) {
            return DNSCache.DEFAULT_LIFETIME_MS;
        }
        String msg = MessageFormat.format(DNSCache.L10N.getString("warn.bad_timeout"), TIMEOUT_PROPERTY, value);
        long seconds;
        try {
            seconds = Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            LOGGER.log(Level.WARNING, msg, e);
            return DNSCache.DEFAULT_LIFETIME_MS;
        }
        if (seconds <= 0) {
            LOGGER.warning(msg);
            return DNSCache.DEFAULT_LIFETIME_MS;
        }
        return seconds * 1000L;
    }

    public long getTimeout() {
        return timeoutMs;
    }

    /**
     * Returns the combined list configuration of the shared cache.
     *
     * @return the read-only configuration
     */
    public CombinedListConfig getConfig() {
        return getDefault().getConfig();
    }

    /**
     * Looks up IN A records.
     *
     * @param question the name to query
     * @return the record values, empty on failure
     */
    public List<String> lookup(String question) {
        return lookup(question, DNSType.A, DNSClass.IN, false);
    }

    /**
     * Looks up IN records of the given type.
     *
     * @param question the name to query
     * @param type the record type
     * @return the record values, empty on failure
     */
    public List<String> lookup(String question, DNSType type) {
        return lookup(question, type, DNSClass.IN, false);
    }

    /**
     * Looks up records through the shared cache with this handle's
     * timeout.
     *
     * @param question the name to query
     * @param type the record type
     * @param dnsClass the record class
     * @param exact whether to return only records matching type and class
     * @return the record values, empty on failure
     * @see CombinedListCache#lookup(String, DNSType, DNSClass, boolean, long)
     */
    public List<String> lookup(String question, DNSType type, DNSClass dnsClass, boolean exact) {
        return getDefault().lookup(question, type, dnsClass, exact, timeoutMs);
    }

    /**
     * Returns the nameservers for a domain through the shared cache with
     * this handle's timeout.
     *
     * @param domain the domain
     * @return the nameserver names, empty on failure
     * @see DNSCache#getNS(String, long)
     */
    public List<String> getNS(String domain) {
        return getDefault().getNS(domain, timeoutMs);
    }

}
