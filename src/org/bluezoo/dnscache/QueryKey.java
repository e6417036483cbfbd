/*
 * QueryKey.java
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
import org.bluezoo.dnscache.dns.DNSType;

/**
 * Cache key combining question, type, and class.
 *
 * <p>The question is compared exactly as given: no case folding and no
 * trailing dot normalization, so {@code "Example.com"} and
 * {@code "example.com."} are distinct keys.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class QueryKey {

    private final String question;
    private final DNSType type;
    private final DNSClass dnsClass;

    /**
     * Creates a new query key.
     *
     * @param question the question string
     * @param type the record type
     * @param dnsClass the record class
     */
    public QueryKey(String question, DNSType type, DNSClass dnsClass) {
        if (question == null || type == null || dnsClass == null) {
            throw new NullPointerException();
        }
        this.question = question;
        this.type = type;
        this.dnsClass = dnsClass;
    }

    public String getQuestion() {
        return question;
    }

    public DNSType getType() {
        return type;
    }

    public DNSClass getDNSClass() {
        return dnsClass;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof QueryKey)) {
            return false;
        }
        QueryKey other = (QueryKey) o;
        return question.equals(other.question) &&
               type == other.type &&
               dnsClass == other.dnsClass;
    }

    @Override
    public int hashCode() {
        int result = question.hashCode();
        result = 31 * result + type.hashCode();
        result = 31 * result + dnsClass.hashCode();
        return result;
    }

    @Override
    public String toString() {
        return question + " " + dnsClass + " " + type;
    }

}
