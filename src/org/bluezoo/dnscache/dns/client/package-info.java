/*
 * package-info.java
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

/**
 * Blocking DNS client.
 *
 * <ul>
 * <li>{@link org.bluezoo.dnscache.dns.client.NameResolver} - resolver
 *     interface</li>
 * <li>{@link org.bluezoo.dnscache.dns.client.QueryResult} - typed query
 *     outcome</li>
 * <li>{@link org.bluezoo.dnscache.dns.client.UDPNameResolver} - UDP
 *     implementation, with TCP retry for truncated responses</li>
 * </ul>
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 * @see org.bluezoo.dnscache.dns.client.UDPNameResolver
 */
package org.bluezoo.dnscache.dns.client;
