/*
 * DNSType.java
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
 * DNS resource record types.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public enum DNSType {

    /**
     * IPv4 address record.
     */
    A(1),

    /**
     * Authoritative name server.
     */
    NS(2),

    /**
     * Canonical name (alias).
     */
    CNAME(5),

    /**
     * Start of authority.
     */
    SOA(6),

    /**
     * Domain name pointer (reverse DNS).
     */
    PTR(12),

    /**
     * Mail exchange.
     */
    MX(15),

    /**
     * Text record.
     */
    TXT(16),

    /**
     * IPv6 address record.
     */
    AAAA(28),

    /**
     * Service locator.
     */
    SRV(33),

    /**
     * Option (EDNS).
     */
    OPT(41),

    /**
     * Sender Policy Framework (historical).
     */
    SPF(99),

    /**
     * All records (query only, not stored).
     */
    ANY(255);

    private final int value;

    DNSType(int value) {
        this.value = value;
    }

    /**
     * Returns the numeric value of this type.
     *
     * @return the type value
     */
    public int getValue() {
        return value;
    }

    /**
     * Returns the DNSType for the given numeric value.
     *
     * @param value the type value
     * @return the DNSType, or null if unknown
     */
    public static DNSType fromValue(int value) {
        for (DNSType type : values()) {
            if (type.value == value) {
                return type;
            }
        }
        return null;
    }

    /**
     * Returns the DNSType for the given mnemonic, e.g. "MX".
     * The comparison is case-insensitive.
     *
     * @param name the type mnemonic
     * @return the DNSType, or null if unknown
     */
    public static DNSType fromName(String name) {
        for (DNSType type : values()) {
            if (type.name().equalsIgnoreCase(name)) {
                return type;
            }
        }
        return null;
    }

}
