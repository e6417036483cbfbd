/*
 * DNSClass.java
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
 * DNS record classes.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public enum DNSClass {

    /**
     * Internet class.
     */
    IN(1),

    /**
     * Chaos class (historical).
     */
    CH(3),

    /**
     * Hesiod class (historical).
     */
    HS(4),

    /**
     * Any class (query only).
     */
    ANY(255);

    private final int value;

    DNSClass(int value) {
        this.value = value;
    }

    /**
     * Returns the numeric value of this class.
     *
     * @return the class value
     */
    public int getValue() {
        return value;
    }

    /**
     * Returns the DNSClass for the given numeric value.
     *
     * @param value the class value
     * @return the DNSClass, or null if unknown
     */
    public static DNSClass fromValue(int value) {
        for (DNSClass cls : values()) {
            if (cls.value == value) {
                return cls;
            }
        }
        return null;
    }

    /**
     * Returns the DNSClass for the given mnemonic, e.g. "IN".
     *
     * @param name the class mnemonic
     * @return the DNSClass, or null if unknown
     */
    public static DNSClass fromName(String name) {
        for (DNSClass cls : values()) {
            if (cls.name().equalsIgnoreCase(name)) {
                return cls;
            }
        }
        return null;
    }

}
