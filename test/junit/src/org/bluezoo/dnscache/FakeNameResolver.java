/*
 * FakeNameResolver.java
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

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.bluezoo.dnscache.dns.DNSMessage;
import org.bluezoo.dnscache.dns.Responses;
import org.bluezoo.dnscache.dns.DNSQuestion;
import org.bluezoo.dnscache.dns.DNSResourceRecord;
import org.bluezoo.dnscache.dns.DNSType;
import org.bluezoo.dnscache.dns.client.NameResolver;
import org.bluezoo.dnscache.dns.client.QueryResult;

/**
 * Scripted resolver for unit tests. Questions without a scripted result
 * are answered with NXDOMAIN. Every query is recorded.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class FakeNameResolver implements NameResolver {

    private final Map<DNSQuestion, QueryResult> results = new HashMap<>();
    public final List<DNSQuestion> queries = new ArrayList<>();
    public final List<Long> lifetimes = new ArrayList<>();

    /** Resolver returned by {@link #forServers}. */
    private FakeNameResolver serverResolver;
    public List<InetAddress> lastServers;

    @Override
    public QueryResult query(DNSQuestion question, long lifetimeMs) {
        queries.add(question);
        lifetimes.add(lifetimeMs);
        QueryResult result = results.get(question);
        if (result == null) {
            return QueryResult.failure(question, QueryResult.Status.NXDOMAIN, "no such name: " + question.getName());
        }
        return result;
    }

    @Override
    public NameResolver forServers(List<InetAddress> nameservers) {
        lastServers = new ArrayList<>(nameservers);
        return getServerResolver();
    }

    public FakeNameResolver getServerResolver() {
        if (serverResolver == null) {
            serverResolver = new FakeNameResolver();
        }
        return serverResolver;
    }

    // -- Scripting --

    public void answer(String name, DNSType type, DNSResourceRecord... answers) {
        answer(name, type, Arrays.asList(answers), Collections.<DNSResourceRecord>emptyList());
    }

    public void answer(String name, DNSType type, List<DNSResourceRecord> answers,
                       List<DNSResourceRecord> additionals) {
        DNSQuestion question = new DNSQuestion(name, type);
        results.put(question, QueryResult.success(question, response(question, answers, additionals)));
    }

    public void noAnswer(String name, DNSType type, DNSResourceRecord... answers) {
        DNSQuestion question = new DNSQuestion(name, type);
        List<DNSResourceRecord> empty = Collections.emptyList();
        results.put(question, QueryResult.noAnswer(question, response(question, Arrays.asList(answers), empty)));
    }

    public void fail(String name, DNSType type, QueryResult.Status status) {
        DNSQuestion question = new DNSQuestion(name, type);
        results.put(question, QueryResult.failure(question, status, status.toString()));
    }

    /**
     * Returns the number of queries made for the given name and type.
     */
    public int count(String name, DNSType type) {
        DNSQuestion question = new DNSQuestion(name, type);
        int count = 0;
        for (DNSQuestion q : queries) {
            if (q.equals(question)) {
                count++;
            }
        }
        return count;
    }

    static DNSMessage response(DNSQuestion question, List<DNSResourceRecord> answers,
                               List<DNSResourceRecord> additionals) {
        List<DNSResourceRecord> empty = Collections.emptyList();
        return Responses.answer(DNSMessage.createQuery(1, question), answers, empty, additionals);
    }

    public static InetAddress ip(String literal) {
        try {
            return InetAddress.getByName(literal);
        } catch (UnknownHostException e) {
            throw new IllegalArgumentException(literal, e);
        }
    }

}
