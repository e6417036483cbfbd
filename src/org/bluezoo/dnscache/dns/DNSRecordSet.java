/*
 * DNSRecordSet.java
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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * All records of a message section sharing the same owner name, type
 * and class.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class DNSRecordSet {

    private final String name;
    private final DNSType type;
    private final DNSClass dnsClass;
    private final List<DNSResourceRecord> records;

    DNSRecordSet(String name, DNSType type, DNSClass dnsClass, List<DNSResourceRecord> records) {
        this.name = name;
        this.type = type;
        this.dnsClass = dnsClass;
        this.records = Collections.unmodifiableList(new ArrayList<>(records));
    }

    /**
     * Returns the owner name of the set.
     *
     * @return the owner name
     */
    public String getName() {
        return name;
    }

    /**
     * Returns the record type of the set.
     *
     * @return the record type
     */
    public DNSType getType() {
        return type;
    }

    /**
     * Returns the record class of the set.
     *
     * @return the record class
     */
    public DNSClass getDNSClass() {
        return dnsClass;
    }

    /**
     * Returns the records of the set, in message order.
     *
     * @return unmodifiable list of records
     */
    public List<DNSResourceRecord> getRecords() {
        return records;
    }

    /**
     * Returns the presentation form of every record in the set.
     *
     * @return the record values, in message order
     * @throws IllegalStateException if a record has malformed data
     */
    public List<String> toText() {
        List<String> values = new ArrayList<>(records.size());
        for (DNSResourceRecord rr : records) {
            values.add(rr.toText());
        }
        return values;
    }

    /**
     * Groups records into sets by owner name, type and class. Sets are
     * ordered by the first appearance of their key; records keep their
     * relative order within a set.
     *
     * @param records the records of one message section
     * @return the record sets
     */
    public static List<DNSRecordSet> group(List<DNSResourceRecord> records) {
        Map<String, List<DNSResourceRecord>> grouped = new LinkedHashMap<>();
        for (DNSResourceRecord rr : records) {
            String key = DNSQuestion.canonical(rr.getName()) + " " + rr.getDNSClass() + " " + rr.getType();
            List<DNSResourceRecord> list = grouped.get(key);
            if (list == null) {
                list = new ArrayList<>();
                grouped.put(key, list);
            }
            list.add(rr);
        }
        List<DNSRecordSet> sets = new ArrayList<>(grouped.size());
        for (List<DNSResourceRecord> list : grouped.values()) {
            DNSResourceRecord first = list.get(0);
            sets.add(new DNSRecordSet(first.getName(), first.getType(), first.getDNSClass(), list));
        }
        return sets;
    }

    @Override
    public String toString() {
        return name + " " + dnsClass + " " + type + " " + records.size();
    }

}
