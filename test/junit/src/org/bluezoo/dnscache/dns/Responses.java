/*
 * Responses.java
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

import java.util.Collections;
import java.util.List;

/**
 * Builds the replies a nameserver would send to a query.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class Responses {

    private Responses() {
    }

    public static DNSMessage answer(DNSMessage query, List<DNSResourceRecord> answers) {
        List<DNSResourceRecord> empty = Collections.emptyList();
        return answer(query, answers, empty, empty);
    }

    public static DNSMessage answer(DNSMessage query, List<DNSResourceRecord> answers,
                                    List<DNSResourceRecord> authorities,
                                    List<DNSResourceRecord> additionals) {
        return new DNSMessage(query.getId(), responseFlags(query), query.getQuestions(),
                answers, authorities, additionals);
    }

    public static DNSMessage error(DNSMessage query, int rcode) {
        List<DNSResourceRecord> empty = Collections.emptyList();
        return new DNSMessage(query.getId(), responseFlags(query) | (rcode & 0x0F), query.getQuestions(),
                empty, empty, empty);
    }

    private static int responseFlags(DNSMessage query) {
        return DNSMessage.FLAG_QR | DNSMessage.FLAG_RA | (query.getFlags() & DNSMessage.FLAG_RD);
    }

}
