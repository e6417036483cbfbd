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
 * Caching DNS lookups for short-lived processes.
 *
 * <ul>
 * <li>{@link org.bluezoo.dnscache.DNSCache} - memoizes successful and
 *     failed lookups, and finds the nameservers of a domain</li>
 * <li>{@link org.bluezoo.dnscache.CombinedListCache} - answers block list
 *     queries from a combined list zone</li>
 * <li>{@link org.bluezoo.dnscache.SharedDNSCache} - per-caller handle on
 *     the process-wide cache</li>
 * </ul>
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
package org.bluezoo.dnscache;
