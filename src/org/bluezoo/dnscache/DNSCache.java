/*
 * DNSCache.java
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

import java.net.InetAddress;
import java.security.SecureRandom;
import java.text.MessageFormat;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.ResourceBundle;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.bluezoo.dnscache.dns.DNSClass;
import org.bluezoo.dnscache.dns.DNSMessage;
import org.bluezoo.dnscache.dns.DNSQuestion;
import org.bluezoo.dnscache.dns.DNSRecordSet;
import org.bluezoo.dnscache.dns.DNSResourceRecord;
import org.bluezoo.dnscache.dns.DNSType;
import org.bluezoo.dnscache.dns.client.NameResolver;
import org.bluezoo.dnscache.dns.client.QueryResult;
import org.bluezoo.dnscache.util.IPAddresses;

/**
 * Memoizing front end to a {@link NameResolver}.
 *
 * <p>Successful replies and failed lookups are both remembered for the
 * lifetime of the cache, keyed by {@link QueryKey}. Failures of every kind
 * (non-existent domain, no answer, no nameservers, timeout, malformed
 * response) are recorded as an empty result and never retried. Lookups
 * never throw for DNS outcomes: a failure is an empty list.
 *
 * <p>Entries are never evicted. A cache is intended to live for the
 * duration of a short-lived process; a transient resolver outage will
 * make the affected keys return empty until the cache is discarded.
 *
 * <p>Record values are returned in presentation form, e.g.
 * {@code "192.0.2.1"} for A records or {@code "10 mx.example.com."} for
 * MX records. Every call returns a new list that the caller may modify.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class DNSCache {

    private static final Logger LOGGER = Logger.getLogger(DNSCache.class.getName());
    static final ResourceBundle L10N = ResourceBundle.getBundle("org.bluezoo.dnscache.L10N");

    /** Default overall query lifetime, in milliseconds. */
    public static final long DEFAULT_LIFETIME_MS = 10000L;

    /**
     * Types for which a missing answer is common enough not to be worth
     * logging.
     */
    private static final Set<DNSType> COMMONLY_ABSENT = EnumSet.of(DNSType.MX, DNSType.AAAA, DNSType.TXT);

    private final NameResolver resolver;
    private final long defaultLifetimeMs;
    private final Random random;

    private final Map<QueryKey, DNSMessage> replies;
    private final Set<QueryKey> failures;
    private final Map<String, List<String>> nsCache;
    private final Set<String> nsFailures;

    private volatile Level timeoutLogLevel = Level.INFO;

    /**
     * Creates a new cache with the default query lifetime.
     *
     * @param resolver the upstream resolver
     */
    public DNSCache(NameResolver resolver) {
        this(resolver, DEFAULT_LIFETIME_MS);
    }

    /**
     * Creates a new cache.
     *
     * @param resolver the upstream resolver
     * @param defaultLifetimeMs the query lifetime used when the caller
     *        does not supply one, in milliseconds
     */
    public DNSCache(NameResolver resolver, long defaultLifetimeMs) {
        this(resolver, defaultLifetimeMs, new SecureRandom());
    }

    DNSCache(NameResolver resolver, long defaultLifetimeMs, Random random) {
        if (resolver == null) {
            throw new NullPointerException("resolver");
        }
        if (defaultLifetimeMs <= 0) {
            throw new IllegalArgumentException("lifetime must be positive: " + defaultLifetimeMs);
        }
        this.resolver = resolver;
        this.defaultLifetimeMs = defaultLifetimeMs;
        this.random = random;
        this.replies = new ConcurrentHashMap<>();
        this.failures = ConcurrentHashMap.newKeySet();
        this.nsCache = new ConcurrentHashMap<>();
        this.nsFailures = ConcurrentHashMap.newKeySet();
    }

    public NameResolver getResolver() {
        return resolver;
    }

    public long getDefaultLifetime() {
        return defaultLifetimeMs;
    }

    /**
     * Returns the level at which lookup timeouts are logged.
     *
     * @return the timeout log level
     */
    public Level getTimeoutLogLevel() {
        return timeoutLogLevel;
    }

    /**
     * Sets the level at which lookup timeouts are logged.
     * The default is {@link Level#INFO}.
     *
     * @param level the timeout log level
     */
    public void setTimeoutLogLevel(Level level) {
        if (level == null) {
            throw new NullPointerException("level");
        }
        this.timeoutLogLevel = level;
    }

    // -- Lookup --

    /**
     * Looks up the IN A records for a name.
     *
     * @param question the name to query
     * @return the record values, empty on failure
     */
    public List<String> lookup(String question) {
        return lookup(question, DNSType.A, DNSClass.IN, false, defaultLifetimeMs);
    }

    /**
     * Looks up IN records of the given type.
     *
     * @param question the name to query
     * @param type the record type
     * @return the record values, empty on failure
     */
    public List<String> lookup(String question, DNSType type) {
        return lookup(question, type, DNSClass.IN, false, defaultLifetimeMs);
    }

    /**
     * Looks up records using the default query lifetime.
     *
     * @param question the name to query
     * @param type the record type
     * @param dnsClass the record class
     * @param exact whether to return only records matching type and class
     * @return the record values, empty on failure
     * @see #lookup(String, DNSType, DNSClass, boolean, long)
     */
    public List<String> lookup(String question, DNSType type, DNSClass dnsClass, boolean exact) {
        return lookup(question, type, dnsClass, exact, defaultLifetimeMs);
    }

    /**
     * Looks up records.
     *
     * <p>If the lookup failed before, the empty result is returned without
     * any network access. If a reply for the same key is cached it is
     * reused; otherwise the upstream resolver is queried.
     *
     * <p>If {@code exact} is true, every record in every answer record set
     * whose type and class equal the requested ones is returned, in
     * response order. Otherwise the values of the first answer record set
     * are returned whatever its type; for an aliased name this is the
     * CNAME target.
     *
     * @param question the name to query, used verbatim as the cache key
     * @param type the record type
     * @param dnsClass the record class
     * @param exact whether to return only records matching type and class
     * @param lifetimeMs the overall query lifetime in milliseconds
     * @return the record values, empty on failure
     */
    public List<String> lookup(String question, DNSType type, DNSClass dnsClass, boolean exact,
                               long lifetimeMs) {
        QueryKey key = new QueryKey(question, type, dnsClass);
        if (failures.contains(key)) {
            return new ArrayList<>();
        }
        DNSMessage reply = replies.get(key);
        if (reply == null) {
            QueryResult result = resolver.query(new DNSQuestion(question, type, dnsClass), lifetimeMs);
            if (!result.isSuccess()) {
                return recordFailure(key, result);
            }
            reply = result.getResponse();
            replies.put(key, reply);
        }
        try {
            return shape(reply, type, dnsClass, exact);
        } catch (IllegalStateException e) {
            String msg = MessageFormat.format(L10N.getString("warn.lookup_failed"),
                    question, type, e.getMessage());
            LOGGER.warning(msg);
            replies.remove(key);
            failures.add(key);
            return new ArrayList<>();
        }
    }

    private List<String> recordFailure(QueryKey key, QueryResult result) {
        String question = key.getQuestion();
        DNSType type = key.getType();
        switch (result.getStatus()) {
            case TIMEOUT:
                LOGGER.log(timeoutLogLevel, MessageFormat.format(L10N.getString("warn.lookup_timeout"),
                        question, type));
                break;
            case NO_ANSWER:
            case NO_NAMESERVERS:
                if (!COMMONLY_ABSENT.contains(type) && LOGGER.isLoggable(Level.FINE)) {
                    String msg = MessageFormat.format(L10N.getString("debug.lookup_failed"),
                            question, type, result.getDetail());
                    LOGGER.fine(msg);
                }
                break;
            case MALFORMED:
                LOGGER.warning(MessageFormat.format(L10N.getString("warn.lookup_failed"),
                        question, type, result.getDetail()));
                break;
            default:
                // NXDOMAIN is a valid negative answer
                break;
        }
        failures.add(key);
        return new ArrayList<>();
    }

    private static List<String> shape(DNSMessage reply, DNSType type, DNSClass dnsClass, boolean exact) {
        List<DNSRecordSet> sets = reply.getAnswerSets();
        List<String> values = new ArrayList<>();
        if (exact) {
            for (DNSRecordSet set : sets) {
                if (set.getType() == type && set.getDNSClass() == dnsClass) {
                    values.addAll(set.toText());
                }
            }
        } else if (!sets.isEmpty()) {
            values.addAll(sets.get(0).toText());
        }
        return values;
    }

    // -- NS lookup --

    /**
     * Returns the nameservers for a domain using the default query
     * lifetime.
     *
     * @param domain the domain
     * @return the nameserver names, empty on failure
     * @see #getNS(String, long)
     */
    public List<String> getNS(String domain) {
        return getNS(domain, defaultLifetimeMs);
    }

    /**
     * Returns the nameservers for a domain.
     *
     * <p>If the NS query is answered with a CNAME, the nameservers are
     * instead obtained by asking one of the parent zone's nameservers
     * directly, and the owner names of its additional section are
     * returned. Only one level of indirection is followed.
     *
     * <p>A complete result is remembered for the domain. If the parent
     * chase fails part way, the names gathered so far are returned and
     * nothing is remembered. A non-existent domain is remembered as such.
     *
     * @param domain the domain
     * @param lifetimeMs the overall query lifetime in milliseconds, also
     *        used for the query to the parent zone's nameserver
     * @return the nameserver names, empty on failure
     */
    public List<String> getNS(String domain, long lifetimeMs) {
        if (nsFailures.contains(domain)) {
            return new ArrayList<>();
        }
        List<String> cached = nsCache.get(domain);
        if (cached != null) {
            return new ArrayList<>(cached);
        }
        QueryResult result = resolver.query(new DNSQuestion(domain, DNSType.NS), lifetimeMs);
        if (!isUsableNSReply(domain, result, "warn.ns_timeout", "debug.ns_failed")) {
            return new ArrayList<>();
        }
        List<String> nameservers = new ArrayList<>();
        try {
            for (DNSRecordSet answer : result.getResponse().getAnswerSets()) {
                if (answer.getType() == DNSType.CNAME) {
                    if (!chaseParent(domain, lifetimeMs, nameservers)) {
                        return nameservers;
                    }
                } else {
                    nameservers.addAll(answer.toText());
                }
            }
        } catch (IllegalStateException e) {
            if (LOGGER.isLoggable(Level.FINE)) {
                LOGGER.fine(MessageFormat.format(L10N.getString("debug.ns_failed"), domain, e.getMessage()));
            }
            return nameservers;
        }
        nsCache.put(domain, Collections.unmodifiableList(new ArrayList<>(nameservers)));
        return nameservers;
    }

    /**
     * Asks a nameserver of the parent zone for the NS records of the
     * domain, appending the owner names of the additional section.
     *
     * @return false if the chase failed
     */
    private boolean chaseParent(String domain, long lifetimeMs, List<String> nameservers) {
        int dot = domain.indexOf('.');
        if (dot < 0) {
            if (LOGGER.isLoggable(Level.FINE)) {
                LOGGER.fine(MessageFormat.format(L10N.getString("debug.ns_failed"), domain, "no parent zone"));
            }
            return false;
        }
        String parent = domain.substring(dot + 1);
        if (!parent.endsWith(".")) {
            parent += ".";
        }
        List<String> parentNS = lookup(parent, DNSType.NS, DNSClass.IN, false, lifetimeMs);
        if (parentNS.isEmpty()) {
            if (LOGGER.isLoggable(Level.FINE)) {
                LOGGER.fine(MessageFormat.format(L10N.getString("debug.ns_failed"), domain,
                        "no nameservers for " + parent));
            }
            return false;
        }
        String chosen = parentNS.get(random.nextInt(parentNS.size()));
        List<InetAddress> servers = new ArrayList<>();
        for (String address : lookup(chosen, DNSType.A, DNSClass.IN, false, lifetimeMs)) {
            InetAddress server = IPAddresses.parseLiteral(address);
            if (server != null) {
                servers.add(server);
            }
        }
        if (servers.isEmpty()) {
            if (LOGGER.isLoggable(Level.FINE)) {
                LOGGER.fine(MessageFormat.format(L10N.getString("debug.ns_no_parent"), domain));
            }
            return false;
        }
        QueryResult reply = resolver.forServers(servers).query(new DNSQuestion(domain, DNSType.NS), lifetimeMs);
        if (!isUsableNSReply(domain, reply, "warn.ns_parent_timeout", "debug.ns_parent_failed")) {
            return false;
        }
        for (DNSRecordSet additional : reply.getResponse().getAdditionalSets()) {
            nameservers.add(DNSResourceRecord.absolute(additional.getName()));
        }
        return true;
    }

    /**
     * Returns true if an NS reply carries a response, whether or not it
     * answers the question. A non-existent domain is remembered.
     */
    private boolean isUsableNSReply(String domain, QueryResult result, String timeoutKey, String failedKey) {
        switch (result.getStatus()) {
            case SUCCESS:
            case NO_ANSWER:
                return true;
            case NXDOMAIN:
                nsFailures.add(domain);
                return false;
            case TIMEOUT:
                LOGGER.log(timeoutLogLevel, MessageFormat.format(L10N.getString(timeoutKey), domain));
                return false;
            default:
                if (LOGGER.isLoggable(Level.FINE)) {
                    LOGGER.fine(MessageFormat.format(L10N.getString(failedKey), domain, result.getDetail()));
                }
                return false;
        }
    }

}
