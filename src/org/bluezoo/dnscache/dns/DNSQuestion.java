/*
 * DNSQuestion.java
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

package org.bluezoo.dnscache.dns;

/**
 * A question in the question section of a DNS message.
 *
 * <p>Equality follows DNS name comparison rules: the name is compared
 * case-insensitively and a trailing dot is not significant. Callers that
 * need exact textual identity (such as the lookup cache) must compare the
 * name themselves.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class DNSQuestion {

    private final String name;
    private final DNSType type;
    private final DNSClass dnsClass;

    /**
     * Creates a new DNS question.
     *
     * @param name the domain name to query
     * @param type the record type
     * @param dnsClass the record class
     */
    public DNSQuestion(String name, DNSType type, DNSClass dnsClass) {
        if (name == null || type == null || dnsClass == null) {
            throw new NullPointerException();
        }
        this.name = name;
        this.type = type;
        this.dnsClass = dnsClass;
    }

    /**
     * Creates a new DNS question with IN class.
     *
     * @param name the domain name to query
     * @param type the record type
     */
    public DNSQuestion(String name, DNSType type) {
        this(name, type, DNSClass.IN);
    }

    /**
     * Returns the domain name being queried, exactly as supplied.
     *
     * @return the domain name
     */
    public String getName() {
        return name;
    }

    /**
     * Returns the record type being queried.
     *
     * @return the record type
     */
    public DNSType getType() {
        return type;
    }

    /**
     * Returns the record class being queried.
     *
     * @return the record class
     */
    public DNSClass getDNSClass() {
        return dnsClass;
    }

    /**
     * Returns true if the two names denote the same DNS owner name.
     *
     * @param a a domain name, with or without trailing dot
     * @param b a domain name, with or without trailing dot
     * @return true if the names are equivalent
     */
    public static boolean sameName(String a, String b) {
        return canonical(a).equals(canonical(b));
    }

    static String canonical(String name) {
        String lower = name.toLowerCase();
        if (lower.endsWith(".")) {
            lower = lower.substring(0, lower.length() - 1);
        }
        return lower;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DNSQuestion)) {
            return false;
        }
        DNSQuestion that = (DNSQuestion) o;
        return sameName(name, that.name) &&
               type == that.type &&
               dnsClass == that.dnsClass;
    }

    @Override
    public int hashCode() {
        int result = canonical(name).hashCode();
        result = 31 * result + type.hashCode();
        result = 31 * result + dnsClass.hashCode();
        return result;
    }

    @Override
    public String toString() {
        return name + " " + dnsClass + " " + type;
    }

}
