/*
 * NameResolver.java
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

package org.bluezoo.dnscache.dns.client;

import java.net.InetAddress;
import java.util.List;

import org.bluezoo.dnscache.dns.DNSQuestion;

/**
 * Blocking name-resolution primitive.
 *
 * <p>Implementations send a question to upstream nameservers and report
 * the outcome as a {@link QueryResult}. They perform no caching of their
 * own. The query lifetime is supplied on every call and bounds the whole
 * exchange, including retries against further servers.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 * @see UDPNameResolver
 */
public interface NameResolver {

    /**
     * Resolves a question.
     *
     * @param question the question to ask
     * @param lifetimeMs the maximum time to spend on the query, in
     *        milliseconds
     * @return the outcome, never null
     */
    QueryResult query(DNSQuestion question, long lifetimeMs);

    /**
     * Returns a resolver that sends its queries only to the given
     * nameservers, bypassing the configured ones.
     *
     * @param nameservers the nameserver addresses, in order of preference
     * @return a resolver for those nameservers
     */
    NameResolver forServers(List<InetAddress> nameservers);

}
