/*
 * CombinedListCache.java
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
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.bluezoo.dnscache.dns.DNSClass;
import org.bluezoo.dnscache.dns.DNSType;
import org.bluezoo.dnscache.dns.client.NameResolver;

/**
 * DNS cache that answers queries against combined block lists.
 *
 * <p>Callers query a block list by its usual name, e.g.
 * {@code 4.3.2.1.list1.dnsbl.example.com}. If the list (the last four
 * labels of the question) is covered by a combined zone, the query is
 * rewritten to {@code 4.3.2.1.<combined zone>} and the combined answer is
 * interpreted through the reverse mapping. One physical query then serves
 * every list sharing the combined zone, through the cache.
 *
 * <p>For a rewritten query the result is {@code ["127.0.0.2"]} if any
 * answer value maps back to the original list, and empty otherwise. The
 * raw combined answer is never returned. Questions for other lists are
 * passed through unchanged.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class CombinedListCache extends DNSCache {

    private static final Logger LOGGER = Logger.getLogger(CombinedListCache.class.getName());

    /** Result returned for an address listed on the original list. */
    public static final String LISTED = "127.0.0.2";

    private static final int LIST_LABELS = 4;

    private final CombinedListConfig config;

    /**
     * Creates a new combined list cache.
     *
     * @param resolver the upstream resolver
     * @param defaultLifetimeMs the default query lifetime in milliseconds
     * @param config the combined list configuration
     */
    public CombinedListCache(NameResolver resolver, long defaultLifetimeMs, CombinedListConfig config) {
        super(resolver, defaultLifetimeMs);
        this.config = config;
    }

    CombinedListCache(NameResolver resolver, long defaultLifetimeMs, CombinedListConfig config,
                      Random random) {
        super(resolver, defaultLifetimeMs, random);
        this.config = config;
    }

    public CombinedListConfig getConfig() {
        return config;
    }

    @Override
    public List<String> lookup(String question, DNSType type, DNSClass dnsClass, boolean exact,
                               long lifetimeMs) {
        String[] labels = question.split("\\.", -1);
        int split = Math.max(0, labels.length - LIST_LABELS);
        String originalList = join(labels, split, labels.length);
        String address = join(labels, 0, split);

        String rewriteAnswer = null;
        Map<String, String> reverse = null;
        String query = question;
        if (config.isCombinedDNSBL(originalList)) {
            if (LOGGER.isLoggable(Level.FINE)) {
                LOGGER.fine(MessageFormat.format(L10N.getString("debug.rewrite_dnsbl"), question));
            }
            rewriteAnswer = originalList;
            query = address + "." + config.getCombined();
            reverse = config.getDNSBLReverse();
        } else if (config.isCombinedURLBL(originalList)) {
            if (LOGGER.isLoggable(Level.FINE)) {
                LOGGER.fine(MessageFormat.format(L10N.getString("debug.rewrite_urlbl"), question));
            }
            rewriteAnswer = originalList;
            query = address + "." + config.getCombinedURL();
            reverse = config.getURLBLReverse();
        }

        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine(MessageFormat.format(L10N.getString("debug.looking_up"), type, query));
        }
        List<String> result = super.lookup(query, type, dnsClass, exact, lifetimeMs);
        if (rewriteAnswer == null || result.isEmpty()) {
            return result;
        }
        for (String answer : result) {
            if (rewriteAnswer.equals(reverse.get(answer))) {
                if (LOGGER.isLoggable(Level.FINE)) {
                    LOGGER.fine(MessageFormat.format(L10N.getString("debug.combined_listed"),
                            result, query, address, rewriteAnswer));
                }
                List<String> listed = new ArrayList<>();
                listed.add(LISTED);
                return listed;
            }
        }
        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine(MessageFormat.format(L10N.getString("debug.combined_not_listed"),
                    result, query, address, rewriteAnswer));
        }
        return new ArrayList<>();
    }

    private static String join(String[] labels, int start, int end) {
        StringBuilder sb = new StringBuilder();
        for (int i = start; i < end; i++) {
            if (i > start) {
                sb.append('.');
            }
            sb.append(labels[i]);
        }
        return sb.toString();
    }

}
